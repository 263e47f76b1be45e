package com.ryuqq.policyreplica.core.cache;

import com.ryuqq.policyreplica.core.model.Policy;
import com.ryuqq.policyreplica.core.model.PolicyChange;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Policy 식별자 → Policy 인메모리 복제본.
 *
 * <p>읽기 경로의 유일한 진실 공급원이며, 전체 스캔으로 언제든 다시 만들 수 있는 파생 뷰입니다.
 * 내부 맵은 외부에 노출되지 않습니다.</p>
 *
 * <p><strong>동시성 규칙 (ReentrantReadWriteLock):</strong></p>
 * <ul>
 *   <li>읽기(get, snapshot, ids, size)는 서로 동시에 진행 가능</li>
 *   <li>변경(replaceAll, upsert, remove, apply)은 모든 읽기/변경과 배타적</li>
 *   <li>변경 완료 후 호출된 get은 항상 그 변경을 관찰 (read-after-write)</li>
 * </ul>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>없는 id에 대한 remove는 no-op</li>
 *   <li>같은 인자로 upsert를 두 번 호출해도 한 번과 같은 상태</li>
 * </ul>
 *
 * <p><strong>변경 진입점:</strong> 부트스트랩은 {@link #replaceAll(Map)},
 * 변경 이벤트는 {@link #apply(PolicyChange)}를 사용합니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public final class ReplicaCache {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Policy> policies = new HashMap<>();

    /**
     * 전체 내용을 원자적으로 교체.
     *
     * @param replacement 식별자 → Policy (복사되어 저장됨)
     * @throws IllegalArgumentException replacement가 null이거나 키와 Policy id가 다른 경우
     */
    public void replaceAll(Map<String, Policy> replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("replacement cannot be null");
        }
        Map<String, Policy> copy = new HashMap<>(replacement.size());
        replacement.forEach((id, policy) -> {
            if (policy == null || !policy.getId().equals(id)) {
                throw new IllegalArgumentException("key " + id + " does not match policy " + policy);
            }
            copy.put(id, policy);
        });

        lock.writeLock().lock();
        try {
            policies.clear();
            policies.putAll(copy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Policy 삽입 또는 교체 (last write wins).
     *
     * @param id 식별자
     * @param policy Policy
     * @throws IllegalArgumentException 인자가 null이거나 id가 Policy id와 다른 경우
     */
    public void upsert(String id, Policy policy) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (!id.equals(policy.getId())) {
            throw new IllegalArgumentException("id " + id + " does not match policy id " + policy.getId());
        }

        lock.writeLock().lock();
        try {
            policies.put(id, policy);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Policy 제거. 없는 id면 no-op.
     *
     * @param id 식별자
     * @return 제거되었으면 true
     */
    public boolean remove(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }

        lock.writeLock().lock();
        try {
            return policies.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 변경 이벤트 적용.
     *
     * <pre>
     * INSERT → upsert(new)
     * DELETE → remove(old.id)
     * UPDATE → remove(old.id) 후 upsert(new)  (하나의 write lock 안에서)
     * NONE   → 무시
     * </pre>
     *
     * @param change 복원된 변경
     */
    public void apply(PolicyChange change) {
        if (change == null) {
            throw new IllegalArgumentException("change cannot be null");
        }

        lock.writeLock().lock();
        try {
            switch (change.type()) {
                case INSERT -> policies.put(change.newPolicy().getId(), change.newPolicy());
                case DELETE -> policies.remove(change.oldPolicy().getId());
                case UPDATE -> {
                    policies.remove(change.oldPolicy().getId());
                    policies.put(change.newPolicy().getId(), change.newPolicy());
                }
                case NONE -> {
                    // 적용할 내용 없음
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Policy 조회.
     *
     * @param id 식별자
     * @return Policy (없으면 empty)
     */
    public Optional<Policy> get(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }

        lock.readLock().lock();
        try {
            return Optional.ofNullable(policies.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 현재 시점 복사본.
     *
     * <p>반환된 목록은 lock 없이 순회해도 안전합니다. 순서는 정의되지 않습니다.</p>
     *
     * @return 모든 Policy의 복사본
     */
    public List<Policy> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(policies.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 현재 식별자 집합의 복사본.
     */
    public Set<String> ids() {
        lock.readLock().lock();
        try {
            return Set.copyOf(policies.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return policies.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
