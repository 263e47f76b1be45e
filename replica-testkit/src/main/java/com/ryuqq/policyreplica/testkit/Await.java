package com.ryuqq.policyreplica.testkit;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Polling helper for asserting eventually-consistent state.
 *
 * <pre>
 * manager.create(policy);
 * Await.until(() -> manager.find("p1").isPresent(), Duration.ofSeconds(5));
 * </pre>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public final class Await {

    private static final long POLL_INTERVAL_MS = 10;

    private Await() {
    }

    /**
     * Blocks until the condition holds.
     *
     * @param condition condition to poll
     * @param timeout maximum wait
     * @throws AssertionError if the condition does not hold within the timeout
     */
    public static void until(BooleanSupplier condition, Duration timeout) {
        until("condition", condition, timeout);
    }

    /**
     * Blocks until the condition holds.
     *
     * @param description shown in the failure message
     * @param condition condition to poll
     * @param timeout maximum wait
     * @throws AssertionError if the condition does not hold within the timeout
     */
    public static void until(String description, BooleanSupplier condition, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() - deadline >= 0) {
                throw new AssertionError(description + " not met within " + timeout.toMillis() + "ms");
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting for " + description, e);
            }
        }
    }
}
