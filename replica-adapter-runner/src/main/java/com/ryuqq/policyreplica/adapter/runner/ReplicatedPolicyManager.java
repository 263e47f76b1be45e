package com.ryuqq.policyreplica.adapter.runner;

import com.ryuqq.policyreplica.application.manager.PolicyManager;
import com.ryuqq.policyreplica.application.runtime.ReplicaSynchronizer;
import com.ryuqq.policyreplica.application.runtime.WatchHandle;
import com.ryuqq.policyreplica.core.cache.ReplicaCache;
import com.ryuqq.policyreplica.core.codec.PolicyCodec;
import com.ryuqq.policyreplica.core.codec.WireRecord;
import com.ryuqq.policyreplica.core.exception.PolicyMatchException;
import com.ryuqq.policyreplica.core.exception.PolicyNotFoundException;
import com.ryuqq.policyreplica.core.model.AccessRequest;
import com.ryuqq.policyreplica.core.model.Policy;
import com.ryuqq.policyreplica.core.spi.PolicyStore;
import com.ryuqq.policyreplica.core.spi.SubjectMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * PolicyManager 구현체.
 *
 * <p>Replica Cache를 소유하고, 쓰기는 저장소로만 보내며(write-through),
 * 읽기는 Replica Cache에서만 처리합니다. Replica는 {@link #coldStart()}와
 * Change Feed Consumer를 통해서만 변경됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * PolicyManager manager = new ReplicatedPolicyManager(store, matcher);
 * manager.coldStart();
 * WatchHandle handle = manager.watch();
 *
 * manager.create(policy);           // 즉시 get() 되지 않음
 * List<Policy> candidates = manager.findPoliciesForSubject("user:alice");
 *
 * manager.close();
 * }</pre>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class ReplicatedPolicyManager implements PolicyManager {

    private static final Logger log = LoggerFactory.getLogger(ReplicatedPolicyManager.class);

    private final PolicyStore store;
    private final PolicyCodec codec;
    private final SubjectMatcher matcher;
    private final ReplicaCache cache;
    private final ReplicaSynchronizer synchronizer;
    private final ChangeFeedConfig config;

    private WatchHandle watchHandle;

    /**
     * 기본 코덱과 기본 설정으로 생성.
     *
     * @param store 정책 저장소
     * @param matcher subject 매처
     */
    public ReplicatedPolicyManager(PolicyStore store, SubjectMatcher matcher) {
        this(store, new PolicyCodec(), matcher, new ChangeFeedConfig());
    }

    /**
     * 생성자.
     *
     * @param store 정책 저장소
     * @param codec 정책 코덱
     * @param matcher subject 매처
     * @param config Change Feed 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ReplicatedPolicyManager(PolicyStore store, PolicyCodec codec, SubjectMatcher matcher, ChangeFeedConfig config) {
        this(store, codec, matcher, config, new ReplicaCache());
    }

    private ReplicatedPolicyManager(PolicyStore store, PolicyCodec codec, SubjectMatcher matcher,
                                    ChangeFeedConfig config, ReplicaCache cache) {
        this(store, codec, matcher, config, cache,
            config == null ? null : new ChangeFeedConsumer(store, codec, cache, config));
    }

    /**
     * 캐시와 동기화기를 직접 주입 (테스트용).
     */
    ReplicatedPolicyManager(PolicyStore store, PolicyCodec codec, SubjectMatcher matcher,
                            ChangeFeedConfig config, ReplicaCache cache, ReplicaSynchronizer synchronizer) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (matcher == null) {
            throw new IllegalArgumentException("matcher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (synchronizer == null) {
            throw new IllegalArgumentException("synchronizer cannot be null");
        }

        this.store = store;
        this.codec = codec;
        this.matcher = matcher;
        this.config = config;
        this.cache = cache;
        this.synchronizer = synchronizer;
    }

    @Override
    public void coldStart() {
        List<WireRecord> records = store.scanAll();

        // 전부 복원한 뒤에만 교체 (하나라도 실패하면 기존 replica 유지)
        Map<String, Policy> decoded = new HashMap<>(records.size());
        for (WireRecord record : records) {
            Policy policy = codec.decode(record);
            decoded.put(policy.getId(), policy);
        }

        cache.replaceAll(decoded);
        log.info("Cold start loaded {} policies", decoded.size());
    }

    @Override
    public void create(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        store.insert(codec.encode(policy));
        log.debug("Created policy {}", policy.getId());
    }

    @Override
    public void update(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        WireRecord record = codec.encode(policy);
        // 삽입 실패 시 복구할 이전 레코드 (replica 기준)
        WireRecord previous = cache.get(policy.getId()).map(codec::encode).orElse(null);
        store.deleteById(policy.getId());
        try {
            store.insert(record);
        } catch (RuntimeException e) {
            restore(previous, e);
            throw e;
        }
        log.debug("Updated policy {}", policy.getId());
    }

    private void restore(WireRecord previous, RuntimeException cause) {
        if (previous == null) {
            return;
        }
        try {
            store.insert(previous);
            log.warn("Update of policy {} failed, previous record restored", previous.id());
        } catch (RuntimeException restoreFailure) {
            cause.addSuppressed(restoreFailure);
            log.error("Update of policy {} failed and the previous record could not be restored",
                previous.id(), restoreFailure);
        }
    }

    @Override
    public void delete(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        store.deleteById(id);
        log.debug("Deleted policy {}", id);
    }

    @Override
    public Policy get(String id) {
        return find(id).orElseThrow(() -> new PolicyNotFoundException(id));
    }

    @Override
    public Optional<Policy> find(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return cache.get(id);
    }

    @Override
    public List<Policy> getAll(int limit, int offset) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0 (current: " + offset + ")");
        }
        return cache.snapshot().stream()
            .sorted(Comparator.comparing(Policy::getId))
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public List<Policy> findPoliciesForSubject(String subject) {
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }

        List<Policy> matched = new ArrayList<>();
        for (Policy policy : cache.snapshot()) {
            if (matches(policy, subject)) {
                matched.add(policy);
            }
        }
        return matched;
    }

    private boolean matches(Policy policy, String subject) {
        try {
            return matcher.matches(policy, policy.getSubjects(), subject);
        } catch (PolicyMatchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PolicyMatchException(
                policy.getId(), "Subject matcher failed for policy " + policy.getId() + ": " + e.getMessage(), e
            );
        }
    }

    @Override
    public List<Policy> findRequestCandidates(AccessRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        return findPoliciesForSubject(request.subject());
    }

    @Override
    public synchronized WatchHandle watch() {
        if (watchHandle != null && !watchHandle.state().isTerminal()) {
            throw new IllegalStateException("watch() already running (state: " + watchHandle.state() + ")");
        }
        watchHandle = synchronizer.start();
        return watchHandle;
    }

    /**
     * 실행 중인 Change Feed Consumer를 취소하고 shutdownTimeoutMs 동안 종료를 대기합니다.
     */
    @Override
    public synchronized void close() {
        if (watchHandle == null || watchHandle.state().isTerminal()) {
            return;
        }
        watchHandle.cancel();
        try {
            if (!watchHandle.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Change feed consumer did not stop within {}ms", config.shutdownTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for change feed consumer to stop");
        }
    }
}
