package com.ryuqq.policyreplica.application.runtime;

import com.ryuqq.policyreplica.core.exception.StoreException;

/**
 * Background replica synchronization runtime.
 *
 * <p>Keeps a replica convergent with durable state without caller intervention by consuming the
 * store's change stream for as long as it is not cancelled.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * start()
 *   1. subscribe to the change stream (synchronously)
 *   2. spawn the consumer loop and return a WatchHandle
 *
 * loop (until cancelled):
 *   a. poll next event (bounded wait)
 *   b. decode both sides; undecodable events are logged and skipped
 *   c. apply insert / delete / update to the replica
 *   d. on stream termination: close, back off (capped exponential + jitter), resubscribe
 * </pre>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Initial subscription failure → thrown from {@link #start()}</li>
 *   <li>Stream errors, resubscription failures → logged, retried forever</li>
 *   <li>Decode errors → logged, event skipped</li>
 * </ul>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public interface ReplicaSynchronizer {

    /**
     * Subscribes and starts the consumer in the background.
     *
     * @return handle of the running consumer
     * @throws StoreException if the initial subscription fails
     * @throws IllegalStateException if this synchronizer was already started
     */
    WatchHandle start();
}
