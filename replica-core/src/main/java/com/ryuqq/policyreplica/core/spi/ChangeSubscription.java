package com.ryuqq.policyreplica.core.spi;

import com.ryuqq.policyreplica.core.exception.ChangeStreamTerminatedException;

import java.util.concurrent.TimeUnit;

/**
 * Live subscription to a store's change stream.
 *
 * <p>The stream is open-ended but may terminate at any time, with or without an error.
 * Once terminated a subscription never delivers again; the consumer must call
 * {@link PolicyStore#subscribeChanges()} to resume.</p>
 *
 * <p><strong>Delivery Guarantees:</strong></p>
 * <ul>
 *   <li>Events for the same id arrive in commit order</li>
 *   <li>No ordering is assumed across different ids</li>
 * </ul>
 *
 * <p><strong>Threading:</strong> {@link #poll(long, TimeUnit)} is called by a single consumer
 * thread. {@link #close()} may be called from any thread and must unblock a pending poll.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public interface ChangeSubscription extends AutoCloseable {

    /**
     * Waits up to the given timeout for the next change event.
     *
     * @param timeout maximum time to wait
     * @param unit unit of the timeout
     * @return the next event, or null if none arrived within the timeout
     * @throws ChangeStreamTerminatedException if the stream has ended (cause set when it ended with an error)
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    ChangeEvent poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Tears the subscription down. Idempotent.
     *
     * <p>After close, {@link #poll(long, TimeUnit)} throws {@link ChangeStreamTerminatedException}.</p>
     */
    @Override
    void close();
}
