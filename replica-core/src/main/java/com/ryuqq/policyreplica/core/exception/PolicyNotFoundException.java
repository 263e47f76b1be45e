package com.ryuqq.policyreplica.core.exception;

/**
 * Replica Cache에 없는 식별자 조회.
 *
 * <p>시스템 오류가 아닌 정상적인 조회 결과입니다. 특히 create 직후에는
 * 변경 이벤트가 반영되기 전까지 이 예외가 발생할 수 있습니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class PolicyNotFoundException extends PolicyReplicaException {

    private final String policyId;

    public PolicyNotFoundException(String policyId) {
        super("Policy not found: " + policyId);
        this.policyId = policyId;
    }

    public String getPolicyId() {
        return policyId;
    }
}
