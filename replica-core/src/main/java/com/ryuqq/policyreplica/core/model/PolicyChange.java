package com.ryuqq.policyreplica.core.model;

/**
 * 복원된 변경 이벤트.
 *
 * <p>저장소의 {@code ChangeEvent} 양쪽을 Policy Codec으로 복원한 결과이며,
 * Replica Cache에 적용되는 단위입니다.</p>
 *
 * @param oldPolicy 변경 전 Policy (없으면 null)
 * @param newPolicy 변경 후 Policy (없으면 null)
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public record PolicyChange(Policy oldPolicy, Policy newPolicy) {

    private static final PolicyChange NONE = new PolicyChange(null, null);

    public static PolicyChange none() {
        return NONE;
    }

    public static PolicyChange insert(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return new PolicyChange(null, policy);
    }

    public static PolicyChange delete(Policy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return new PolicyChange(policy, null);
    }

    public static PolicyChange update(Policy oldPolicy, Policy newPolicy) {
        if (oldPolicy == null || newPolicy == null) {
            throw new IllegalArgumentException("oldPolicy and newPolicy cannot be null");
        }
        return new PolicyChange(oldPolicy, newPolicy);
    }

    /**
     * 변경 형태 조회.
     *
     * @return NONE, INSERT, DELETE, UPDATE 중 하나
     */
    public ChangeType type() {
        return ChangeType.of(oldPolicy != null, newPolicy != null);
    }

    /**
     * 식별자가 바뀌는 UPDATE인지 확인.
     *
     * @return rename이면 true
     */
    public boolean isRename() {
        return type() == ChangeType.UPDATE && !oldPolicy.getId().equals(newPolicy.getId());
    }
}
