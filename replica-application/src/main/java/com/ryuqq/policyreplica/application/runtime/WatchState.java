package com.ryuqq.policyreplica.application.runtime;

/**
 * Change feed consumer lifecycle state.
 *
 * <pre>
 * RUNNING ──cancel()──► STOPPING ──loop exits──► STOPPED
 * </pre>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public enum WatchState {

    RUNNING,
    STOPPING,
    STOPPED;

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
