package com.ryuqq.policyreplica.adapter.runner;

import com.ryuqq.policyreplica.application.runtime.ReplicaSynchronizer;
import com.ryuqq.policyreplica.application.runtime.WatchHandle;
import com.ryuqq.policyreplica.application.runtime.WatchState;
import com.ryuqq.policyreplica.core.cache.ReplicaCache;
import com.ryuqq.policyreplica.core.codec.PolicyCodec;
import com.ryuqq.policyreplica.core.exception.ChangeStreamTerminatedException;
import com.ryuqq.policyreplica.core.exception.PolicyDecodeException;
import com.ryuqq.policyreplica.core.exception.StoreException;
import com.ryuqq.policyreplica.core.model.PolicyChange;
import com.ryuqq.policyreplica.core.spi.ChangeEvent;
import com.ryuqq.policyreplica.core.spi.ChangeSubscription;
import com.ryuqq.policyreplica.core.spi.PolicyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Change Feed Consumer.
 *
 * <p>저장소 변경 스트림을 구독하여 Replica Cache를 최신 상태로 유지합니다.
 * {@link #start()} 호출마다 전용 daemon 스레드 하나에서 루프가 실행됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. subscription.poll(pollTimeoutMs)로 다음 이벤트 대기
 * 2. PolicyCodec으로 old/new 양쪽 복원
 *    - PolicyDecodeException: WARN 로그 후 이벤트 skip
 * 3. ReplicaCache.apply(change)
 *    - INSERT: upsert / DELETE: remove / UPDATE: remove old → upsert new
 * 4. 스트림 종료 또는 저장소 오류:
 *    - subscription close → backoff 대기 → 재구독
 *    - 재구독 실패도 ERROR 로그 후 backoff를 늘려 재시도 (무한)
 *    - 이벤트를 수신하면 backoff 시도 횟수 초기화
 * </pre>
 *
 * <p><strong>취소:</strong></p>
 * <ul>
 *   <li>이벤트 대기 중: poll이 pollTimeoutMs마다 반환되고,
 *       cancel()이 활성 subscription을 close하여 대기 중인 poll을 즉시 깨움</li>
 *   <li>backoff 대기 중: 대기가 취소 latch와 경쟁하므로 즉시 종료</li>
 * </ul>
 *
 * <p>오류는 로그로만 남기며 start() 호출자에게 전파하지 않습니다.
 * 단, 최초 구독 실패는 start()에서 동기적으로 {@link StoreException}을 던집니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class ChangeFeedConsumer implements ReplicaSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(ChangeFeedConsumer.class);

    static final String THREAD_NAME = "policy-replica-change-feed";

    // 이 이상은 지연이 maxDelayMs에 고정됨
    static final int MAX_ATTEMPT = 64;

    private final PolicyStore store;
    private final PolicyCodec codec;
    private final ReplicaCache cache;
    private final ChangeFeedConfig config;
    private final BackoffCalculator backoffCalculator;

    private final AtomicReference<ConsumerHandle> current = new AtomicReference<>();

    /**
     * 설정의 백오프 값으로 BackoffCalculator를 만들어 생성.
     *
     * @param store 정책 저장소
     * @param codec 정책 코덱
     * @param cache 갱신 대상 Replica Cache
     * @param config 설정
     */
    public ChangeFeedConsumer(PolicyStore store, PolicyCodec codec, ReplicaCache cache, ChangeFeedConfig config) {
        this(store, codec, cache, config, BackoffCalculator.from(config));
    }

    /**
     * 생성자.
     *
     * @param store 정책 저장소
     * @param codec 정책 코덱
     * @param cache 갱신 대상 Replica Cache
     * @param config 설정
     * @param backoffCalculator 재구독 대기 시간 계산기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ChangeFeedConsumer(PolicyStore store, PolicyCodec codec, ReplicaCache cache,
                              ChangeFeedConfig config, BackoffCalculator backoffCalculator) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }

        this.store = store;
        this.codec = codec;
        this.cache = cache;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 최초 구독을 동기적으로 연 뒤 백그라운드 루프 시작.
     *
     * @return 루프 관찰 및 취소용 핸들
     * @throws IllegalStateException 이전에 시작한 루프가 아직 종료되지 않은 경우
     * @throws StoreException 최초 구독 실패 시
     */
    @Override
    public synchronized WatchHandle start() {
        ConsumerHandle previous = current.get();
        if (previous != null && !previous.state().isTerminal()) {
            throw new IllegalStateException("Change feed consumer is already running (state: " + previous.state() + ")");
        }

        ChangeSubscription subscription;
        try {
            subscription = store.subscribeChanges();
        } catch (StoreException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreException("Failed to subscribe to change feed", e);
        }

        ConsumerHandle handle = new ConsumerHandle();
        handle.attach(subscription);
        current.set(handle);

        ExecutorService loopExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        loopExecutor.submit(() -> runLoop(handle, subscription));
        // 제출된 루프는 계속 실행되고, 종료 후 스레드가 정리됨
        loopExecutor.shutdown();

        log.info("Change feed consumer started");
        return handle;
    }

    private void runLoop(ConsumerHandle handle, ChangeSubscription initial) {
        ChangeSubscription subscription = initial;
        int attempt = 0;
        try {
            while (!handle.isCancelled()) {
                if (subscription == null) {
                    attempt = Math.min(attempt + 1, MAX_ATTEMPT);
                    long delayMs = backoffCalculator.calculate(attempt);
                    log.debug("Resubscribing to change feed in {}ms (attempt {})", delayMs, attempt);
                    if (handle.awaitCancellation(delayMs)) {
                        break;
                    }
                    subscription = resubscribe(attempt);
                    if (subscription == null) {
                        continue;
                    }
                    handle.resubscribes.incrementAndGet();
                    if (!handle.attach(subscription)) {
                        break;
                    }
                }

                ChangeEvent event;
                try {
                    event = subscription.poll(config.pollTimeoutMs(), TimeUnit.MILLISECONDS);
                } catch (ChangeStreamTerminatedException e) {
                    if (!handle.isCancelled()) {
                        logTermination(e);
                    }
                    handle.detach(subscription);
                    closeSubscription(subscription);
                    subscription = null;
                    continue;
                } catch (RuntimeException e) {
                    if (!handle.isCancelled()) {
                        log.warn("Change feed failed, resubscribing", e);
                    }
                    handle.detach(subscription);
                    closeSubscription(subscription);
                    subscription = null;
                    continue;
                }

                if (event == null) {
                    continue;
                }
                attempt = 0;
                applyEvent(handle, event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Change feed consumer interrupted");
        } catch (RuntimeException e) {
            log.error("Change feed consumer stopped unexpectedly", e);
        } finally {
            if (subscription != null) {
                handle.detach(subscription);
                closeSubscription(subscription);
            }
            handle.markStopped();
            log.info("Change feed consumer stopped: applied={}, skipped={}, resubscribes={}",
                handle.appliedEvents(), handle.skippedEvents(), handle.resubscribeCount());
        }
    }

    private ChangeSubscription resubscribe(int attempt) {
        try {
            ChangeSubscription subscription = store.subscribeChanges();
            log.info("Change feed resubscribed after {} attempt(s)", attempt);
            return subscription;
        } catch (RuntimeException e) {
            log.error("Failed to resubscribe to change feed (attempt {})", attempt, e);
            return null;
        }
    }

    private void applyEvent(ConsumerHandle handle, ChangeEvent event) {
        PolicyChange change;
        try {
            change = codec.decodeChange(event);
        } catch (PolicyDecodeException e) {
            handle.skipped.incrementAndGet();
            log.warn("Skipping {} event for policy {}: {}", event.type(), e.getPolicyId(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            handle.skipped.incrementAndGet();
            log.error("Skipping {} event that failed to decode", event.type(), e);
            return;
        }

        try {
            cache.apply(change);
        } catch (RuntimeException e) {
            handle.skipped.incrementAndGet();
            log.error("Skipping {} event that failed to apply", change.type(), e);
            return;
        }
        handle.applied.incrementAndGet();
        log.debug("Applied {} event: {} -> {}",
            change.type(),
            change.oldPolicy() == null ? null : change.oldPolicy().getId(),
            change.newPolicy() == null ? null : change.newPolicy().getId());
    }

    private static void logTermination(ChangeStreamTerminatedException e) {
        if (e.isAbnormal()) {
            log.warn("Change stream terminated abnormally, resubscribing", e);
        } else {
            log.warn("Change stream ended, resubscribing: {}", e.getMessage());
        }
    }

    private static void closeSubscription(ChangeSubscription subscription) {
        try {
            subscription.close();
        } catch (RuntimeException e) {
            log.debug("Failed to close change subscription", e);
        }
    }

    /**
     * 루프 하나의 핸들.
     *
     * <p>cancel()과 새 subscription 연결이 경쟁해도 subscription이 열린 채 남지 않도록
     * 양쪽 모두 "기록 후 확인" 순서를 따릅니다.</p>
     */
    private static final class ConsumerHandle implements WatchHandle {

        private final CountDownLatch cancelled = new CountDownLatch(1);
        private final CountDownLatch terminated = new CountDownLatch(1);
        private final AtomicReference<WatchState> state = new AtomicReference<>(WatchState.RUNNING);
        private final AtomicReference<ChangeSubscription> active = new AtomicReference<>();

        private final AtomicLong applied = new AtomicLong();
        private final AtomicLong skipped = new AtomicLong();
        private final AtomicLong resubscribes = new AtomicLong();

        @Override
        public void cancel() {
            if (!state.compareAndSet(WatchState.RUNNING, WatchState.STOPPING)) {
                return;
            }
            log.info("Change feed consumer cancellation requested");
            cancelled.countDown();
            ChangeSubscription subscription = active.get();
            if (subscription != null) {
                closeSubscription(subscription);
            }
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return terminated.await(timeout, unit);
        }

        @Override
        public WatchState state() {
            return state.get();
        }

        @Override
        public long appliedEvents() {
            return applied.get();
        }

        @Override
        public long skippedEvents() {
            return skipped.get();
        }

        @Override
        public long resubscribeCount() {
            return resubscribes.get();
        }

        boolean isCancelled() {
            return cancelled.getCount() == 0;
        }

        /**
         * @return 취소 요청이 들어오면 true, 대기 시간이 지나면 false
         */
        boolean awaitCancellation(long delayMs) throws InterruptedException {
            return cancelled.await(delayMs, TimeUnit.MILLISECONDS);
        }

        /**
         * @return 취소된 상태면 false (subscription은 호출자가 close)
         */
        boolean attach(ChangeSubscription subscription) {
            active.set(subscription);
            return !isCancelled();
        }

        void detach(ChangeSubscription subscription) {
            active.compareAndSet(subscription, null);
        }

        void markStopped() {
            state.set(WatchState.STOPPED);
            terminated.countDown();
        }
    }
}
