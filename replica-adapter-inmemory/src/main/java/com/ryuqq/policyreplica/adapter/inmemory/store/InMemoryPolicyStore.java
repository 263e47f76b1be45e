package com.ryuqq.policyreplica.adapter.inmemory.store;

import com.ryuqq.policyreplica.core.codec.WireRecord;
import com.ryuqq.policyreplica.core.exception.StoreException;
import com.ryuqq.policyreplica.core.spi.ChangeEvent;
import com.ryuqq.policyreplica.core.spi.ChangeSubscription;
import com.ryuqq.policyreplica.core.spi.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory implementation of {@link PolicyStore} SPI for testing and reference purposes.
 *
 * <p>Records are kept in a map keyed by policy id. Every committed write is published as a
 * {@link ChangeEvent} to all live subscriptions, in commit order.</p>
 *
 * <p><strong>Write Semantics:</strong></p>
 * <ul>
 *   <li><strong>insert:</strong> new id → insert event; existing id with different content →
 *       update event; identical record → no event</li>
 *   <li><strong>deleteById:</strong> existing id → delete event; missing id → no-op</li>
 * </ul>
 *
 * <p><strong>Change Feed Buffering:</strong></p>
 * <p>While no subscription is live, committed events are buffered and handed to the next
 * subscriber. When the last live subscription closes or is broken, its undelivered events go
 * back to the front of the buffer. A consumer that resubscribes therefore sees every change
 * committed while it was disconnected, like a resumable change stream.</p>
 *
 * <p><strong>Fault Injection:</strong></p>
 * <ul>
 *   <li>{@link #breakSubscriptions(Throwable)}: terminate every live stream</li>
 *   <li>{@link #failNextSubscribe(int)}: make the next N {@code subscribeChanges()} calls fail</li>
 *   <li>{@link #setAvailable(boolean)}: fail every store call while unavailable
 *       (live streams keep running until broken explicitly)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class InMemoryPolicyStore implements PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPolicyStore.class);

    private final Object lock = new Object();

    /**
     * Durable records. Key: policy id.
     */
    private final Map<String, WireRecord> records = new HashMap<>();

    private final List<InMemoryChangeSubscription> subscriptions = new ArrayList<>();

    /**
     * Events committed while no subscription was live.
     */
    private final Deque<ChangeEvent> pending = new ArrayDeque<>();

    private volatile boolean available = true;
    private int failNextSubscribe;

    @Override
    public List<WireRecord> scanAll() {
        synchronized (lock) {
            checkAvailable("scanAll");
            return new ArrayList<>(records.values());
        }
    }

    @Override
    public void insert(WireRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (record.id() == null || record.id().isBlank()) {
            throw new IllegalArgumentException("record id cannot be null or blank");
        }

        synchronized (lock) {
            checkAvailable("insert");
            WireRecord previous = records.put(record.id(), record);
            if (previous == null) {
                publish(ChangeEvent.insert(record));
            } else if (!previous.equals(record)) {
                publish(ChangeEvent.update(previous, record));
            }
        }
    }

    @Override
    public void deleteById(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }

        synchronized (lock) {
            checkAvailable("deleteById");
            WireRecord previous = records.remove(id);
            if (previous != null) {
                publish(ChangeEvent.delete(previous));
            }
        }
    }

    @Override
    public ChangeSubscription subscribeChanges() {
        synchronized (lock) {
            checkAvailable("subscribeChanges");
            if (failNextSubscribe > 0) {
                failNextSubscribe--;
                log.debug("Injected subscribe failure ({} remaining)", failNextSubscribe);
                throw new StoreException("Injected subscribe failure");
            }

            InMemoryChangeSubscription subscription = new InMemoryChangeSubscription(this);
            while (!pending.isEmpty()) {
                subscription.offer(pending.pollFirst());
            }
            subscriptions.add(subscription);
            return subscription;
        }
    }

    /**
     * Terminates every live subscription.
     *
     * <p>Each subscription's next {@code poll} throws
     * {@link com.ryuqq.policyreplica.core.exception.ChangeStreamTerminatedException}
     * carrying the given cause. Undelivered events are kept for the next subscriber.</p>
     *
     * @param cause termination cause, or null for a normal end of stream
     */
    public void breakSubscriptions(Throwable cause) {
        List<InMemoryChangeSubscription> broken;
        synchronized (lock) {
            broken = new ArrayList<>(subscriptions);
            for (InMemoryChangeSubscription subscription : broken) {
                unregisterLocked(subscription);
            }
        }
        log.info("Breaking {} change subscription(s)", broken.size());
        for (InMemoryChangeSubscription subscription : broken) {
            subscription.terminate(cause);
        }
    }

    /**
     * Makes the next {@code count} calls to {@link #subscribeChanges()} throw {@link StoreException}.
     *
     * @param count number of failing calls (zero resets)
     */
    public void failNextSubscribe(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0 (current: " + count + ")");
        }
        synchronized (lock) {
            this.failNextSubscribe = count;
        }
    }

    /**
     * Toggles store availability. While unavailable every SPI call throws {@link StoreException}.
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int subscriberCount() {
        synchronized (lock) {
            return subscriptions.size();
        }
    }

    public int size() {
        synchronized (lock) {
            return records.size();
        }
    }

    /**
     * Clears all records and buffered events and ends every live subscription.
     *
     * <p>No events are published for the removed records.</p>
     */
    public void clear() {
        List<InMemoryChangeSubscription> ended;
        synchronized (lock) {
            ended = new ArrayList<>(subscriptions);
            subscriptions.clear();
            records.clear();
            pending.clear();
            failNextSubscribe = 0;
            available = true;
        }
        for (InMemoryChangeSubscription subscription : ended) {
            subscription.terminate(null);
        }
    }

    void unregister(InMemoryChangeSubscription subscription) {
        synchronized (lock) {
            unregisterLocked(subscription);
        }
    }

    private void unregisterLocked(InMemoryChangeSubscription subscription) {
        if (!subscriptions.remove(subscription)) {
            return;
        }
        List<ChangeEvent> undelivered = subscription.drainUndelivered();
        if (subscriptions.isEmpty()) {
            for (int i = undelivered.size() - 1; i >= 0; i--) {
                pending.addFirst(undelivered.get(i));
            }
        }
    }

    private void publish(ChangeEvent event) {
        if (subscriptions.isEmpty()) {
            pending.addLast(event);
            return;
        }
        for (InMemoryChangeSubscription subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    private void checkAvailable(String operation) {
        if (!available) {
            throw new StoreException("Store unavailable: " + operation);
        }
    }
}
