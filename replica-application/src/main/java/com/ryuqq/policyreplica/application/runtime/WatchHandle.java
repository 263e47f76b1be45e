package com.ryuqq.policyreplica.application.runtime;

import java.util.concurrent.TimeUnit;

/**
 * Handle of a running change feed consumer.
 *
 * <p>Returned by {@code PolicyManager.watch()}. Carries the cancellation signal and exposes
 * counters for operators and tests.</p>
 *
 * <p><strong>Cancellation:</strong> {@link #cancel()} is honored both while the consumer waits
 * for the next event and while it waits to resubscribe. The live subscription is closed and the
 * loop returns; {@link #state()} becomes {@link WatchState#STOPPED}.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public interface WatchHandle {

    /**
     * Requests the consumer to stop. Idempotent, non-blocking.
     */
    void cancel();

    /**
     * Waits for the consumer loop to exit.
     *
     * @param timeout maximum time to wait
     * @param unit unit of the timeout
     * @return true if the consumer stopped within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    WatchState state();

    default boolean isRunning() {
        return state() == WatchState.RUNNING;
    }

    /**
     * Number of change events applied to the replica.
     */
    long appliedEvents();

    /**
     * Number of change events skipped because a side could not be decoded.
     */
    long skippedEvents();

    /**
     * Number of successful resubscriptions after the initial subscription.
     */
    long resubscribeCount();
}
