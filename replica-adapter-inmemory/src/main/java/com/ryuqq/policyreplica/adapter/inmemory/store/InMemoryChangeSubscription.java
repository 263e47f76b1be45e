package com.ryuqq.policyreplica.adapter.inmemory.store;

import com.ryuqq.policyreplica.core.exception.ChangeStreamTerminatedException;
import com.ryuqq.policyreplica.core.spi.ChangeEvent;
import com.ryuqq.policyreplica.core.spi.ChangeSubscription;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One live change stream of an {@link InMemoryPolicyStore}.
 *
 * <p>Events are queued in a {@link LinkedBlockingQueue}. Termination enqueues a marker that is
 * never consumed, so every {@code poll} after the end of stream throws.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
final class InMemoryChangeSubscription implements ChangeSubscription {

    private static final ChangeEvent END_OF_STREAM = new ChangeEvent(null, null);

    private final InMemoryPolicyStore store;
    private final LinkedBlockingQueue<ChangeEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private volatile ChangeStreamTerminatedException termination;

    InMemoryChangeSubscription(InMemoryPolicyStore store) {
        this.store = store;
    }

    @Override
    public ChangeEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        ChangeEvent event = queue.poll(timeout, unit);
        if (event == END_OF_STREAM) {
            queue.offer(END_OF_STREAM);
            throw termination;
        }
        return event;
    }

    @Override
    public void close() {
        if (ended.get()) {
            return;
        }
        store.unregister(this);
        terminate(null, "Change subscription closed");
    }

    void offer(ChangeEvent event) {
        if (!ended.get()) {
            queue.offer(event);
        }
    }

    void terminate(Throwable cause) {
        terminate(cause, cause == null ? "Change stream ended" : "Change stream terminated: " + cause.getMessage());
    }

    private void terminate(Throwable cause, String message) {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        termination = cause == null
            ? new ChangeStreamTerminatedException(message)
            : new ChangeStreamTerminatedException(message, cause);
        queue.offer(END_OF_STREAM);
    }

    /**
     * Removes and returns the events not yet polled.
     */
    List<ChangeEvent> drainUndelivered() {
        List<ChangeEvent> undelivered = new ArrayList<>();
        queue.drainTo(undelivered);
        undelivered.removeIf(event -> event == END_OF_STREAM);
        return undelivered;
    }
}
