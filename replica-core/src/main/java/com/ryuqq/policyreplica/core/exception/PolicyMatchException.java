package com.ryuqq.policyreplica.core.exception;

/**
 * 외부 매칭 함수가 특정 Policy에 대해 평가에 실패함.
 *
 * <p>주제(subject) 검색 전체를 즉시 중단시킵니다. 평가할 수 없었던 Policy를
 * 조용히 제외한 부분 결과는 반환하지 않습니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class PolicyMatchException extends PolicyReplicaException {

    private final String policyId;

    public PolicyMatchException(String policyId, String message) {
        super(message);
        this.policyId = policyId;
    }

    public PolicyMatchException(String policyId, String message, Throwable cause) {
        super(message, cause);
        this.policyId = policyId;
    }

    /**
     * 평가에 실패한 Policy의 식별자.
     *
     * @return 식별자 (알 수 없으면 null)
     */
    public String getPolicyId() {
        return policyId;
    }
}
