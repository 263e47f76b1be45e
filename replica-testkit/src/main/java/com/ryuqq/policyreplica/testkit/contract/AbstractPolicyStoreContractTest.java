package com.ryuqq.policyreplica.testkit.contract;

import com.ryuqq.policyreplica.core.codec.WireRecord;
import com.ryuqq.policyreplica.core.exception.ChangeStreamTerminatedException;
import com.ryuqq.policyreplica.core.model.ChangeType;
import com.ryuqq.policyreplica.core.spi.ChangeEvent;
import com.ryuqq.policyreplica.core.spi.ChangeSubscription;
import com.ryuqq.policyreplica.core.spi.PolicyStore;
import com.ryuqq.policyreplica.testkit.TestPolicies;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract base class for {@link PolicyStore} contract tests.
 *
 * <p>Every store adapter extends this class and supplies a fresh store from
 * {@link #createStore()}. The tests pin down the SPI guarantees the replica relies on:</p>
 * <ul>
 *   <li>scanAll returns every stored record</li>
 *   <li>deleting a missing id is not an error</li>
 *   <li>committed writes reach live subscriptions in commit order per id</li>
 *   <li>close is idempotent and unblocks a pending poll</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractPolicyStoreContractTest {
 *     {@literal @}Override
 *     protected PolicyStore createStore() {
 *         return new MyStore(...);
 *     }
 * }
 * </pre>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public abstract class AbstractPolicyStoreContractTest {

    protected static final long POLL_TIMEOUT_MS = 2000;

    protected PolicyStore store;

    private final List<ChangeSubscription> opened = new ArrayList<>();

    /**
     * Creates an empty store for one test.
     */
    protected abstract PolicyStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @AfterEach
    void closeSubscriptions() {
        opened.forEach(ChangeSubscription::close);
        opened.clear();
    }

    protected ChangeSubscription subscribe() {
        ChangeSubscription subscription = store.subscribeChanges();
        opened.add(subscription);
        return subscription;
    }

    protected ChangeEvent nextEvent(ChangeSubscription subscription) throws InterruptedException {
        ChangeEvent event = subscription.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        assertThat(event).as("change event within %dms", POLL_TIMEOUT_MS).isNotNull();
        return event;
    }

    // ============================================================
    // Reads and writes
    // ============================================================

    @Test
    void scanAll_EmptyStore_ReturnsEmptyList() {
        assertThat(store.scanAll()).isEmpty();
    }

    @Test
    void scanAll_AfterInserts_ReturnsEveryRecord() {
        // given
        WireRecord a = TestPolicies.record(TestPolicies.simple("a"));
        WireRecord b = TestPolicies.record(TestPolicies.simple("b"));
        WireRecord c = TestPolicies.record(TestPolicies.withAllConditions("c"));

        // when
        store.insert(a);
        store.insert(b);
        store.insert(c);

        // then
        assertThat(store.scanAll()).containsExactlyInAnyOrder(a, b, c);
    }

    @Test
    void deleteById_ExistingRecord_RemovesFromScan() {
        // given
        WireRecord a = TestPolicies.record(TestPolicies.simple("a"));
        WireRecord b = TestPolicies.record(TestPolicies.simple("b"));
        store.insert(a);
        store.insert(b);

        // when
        store.deleteById("a");

        // then
        assertThat(store.scanAll()).containsExactly(b);
    }

    @Test
    void deleteById_MissingRecord_IsNotAnError() {
        store.deleteById("missing");

        assertThat(store.scanAll()).isEmpty();
    }

    // ============================================================
    // Change feed
    // ============================================================

    @Test
    void subscribeChanges_Insert_DeliversInsertEvent() throws InterruptedException {
        // given
        ChangeSubscription subscription = subscribe();
        WireRecord a = TestPolicies.record(TestPolicies.simple("a"));

        // when
        store.insert(a);

        // then
        ChangeEvent event = nextEvent(subscription);
        assertThat(event.type()).isEqualTo(ChangeType.INSERT);
        assertThat(event.newValue()).isEqualTo(a);
        assertThat(event.oldValue()).isNull();
    }

    @Test
    void subscribeChanges_Delete_DeliversDeleteEventWithOldValue() throws InterruptedException {
        // given
        WireRecord a = TestPolicies.record(TestPolicies.simple("a"));
        ChangeSubscription subscription = subscribe();
        store.insert(a);
        nextEvent(subscription);

        // when
        store.deleteById("a");

        // then
        ChangeEvent event = nextEvent(subscription);
        assertThat(event.type()).isEqualTo(ChangeType.DELETE);
        assertThat(event.oldValue()).isNotNull();
        assertThat(event.oldValue().id()).isEqualTo("a");
        assertThat(event.newValue()).isNull();
    }

    @Test
    void subscribeChanges_SameId_DeliversEventsInCommitOrder() throws InterruptedException {
        // given
        ChangeSubscription subscription = subscribe();
        WireRecord first = TestPolicies.record(TestPolicies.simple("a"));
        WireRecord second = TestPolicies.record(TestPolicies.simple("a").toBuilder().description("v2").build());

        // when
        store.insert(first);
        store.deleteById("a");
        store.insert(second);

        // then
        ChangeEvent e1 = nextEvent(subscription);
        ChangeEvent e2 = nextEvent(subscription);
        ChangeEvent e3 = nextEvent(subscription);
        assertThat(e1.newValue()).isEqualTo(first);
        assertThat(e2.type()).isEqualTo(ChangeType.DELETE);
        assertThat(e3.newValue()).isEqualTo(second);
    }

    @Test
    void poll_NoChanges_ReturnsNullAfterTimeout() throws InterruptedException {
        ChangeSubscription subscription = subscribe();

        assertThat(subscription.poll(50, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    void close_CalledTwice_IsIdempotent() {
        ChangeSubscription subscription = subscribe();

        subscription.close();
        subscription.close();
    }

    @Test
    void poll_AfterClose_ThrowsChangeStreamTerminated() {
        // given
        ChangeSubscription subscription = subscribe();

        // when
        subscription.close();

        // then
        assertThatThrownBy(() -> subscription.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS))
            .isInstanceOf(ChangeStreamTerminatedException.class);
    }

    @Test
    void close_WhilePolling_UnblocksPendingPoll() throws Exception {
        // given
        ChangeSubscription subscription = subscribe();
        CompletableFuture<Throwable> polled = CompletableFuture.supplyAsync(() -> {
            try {
                subscription.poll(30, TimeUnit.SECONDS);
                return null;
            } catch (Throwable t) {
                return t;
            }
        });
        Thread.sleep(100);

        // when
        subscription.close();

        // then
        Throwable failure;
        try {
            failure = polled.get(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            failure = e.getCause();
        }
        assertThat(failure).isInstanceOf(ChangeStreamTerminatedException.class);
    }
}
