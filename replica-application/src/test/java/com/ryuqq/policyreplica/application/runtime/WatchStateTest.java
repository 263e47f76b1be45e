package com.ryuqq.policyreplica.application.runtime;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * WatchState / WatchHandle 기본 동작 테스트.
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
class WatchStateTest {

    @Test
    void isTerminal_OnlyStopped() {
        assertFalse(WatchState.RUNNING.isTerminal());
        assertFalse(WatchState.STOPPING.isTerminal());
        assertTrue(WatchState.STOPPED.isTerminal());
    }

    @Test
    void isRunning_DerivedFromState() {
        assertTrue(handleIn(WatchState.RUNNING).isRunning());
        assertFalse(handleIn(WatchState.STOPPING).isRunning());
        assertFalse(handleIn(WatchState.STOPPED).isRunning());
    }

    private static WatchHandle handleIn(WatchState state) {
        return new WatchHandle() {
            @Override
            public void cancel() {
            }

            @Override
            public boolean awaitTermination(long timeout, TimeUnit unit) {
                return state.isTerminal();
            }

            @Override
            public WatchState state() {
                return state;
            }

            @Override
            public long appliedEvents() {
                return 0;
            }

            @Override
            public long skippedEvents() {
                return 0;
            }

            @Override
            public long resubscribeCount() {
                return 0;
            }
        };
    }
}
