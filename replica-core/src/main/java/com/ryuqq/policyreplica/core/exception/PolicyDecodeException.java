package com.ryuqq.policyreplica.core.exception;

/**
 * Wire Record 또는 변경 이벤트의 한쪽을 Policy로 복원할 수 없음.
 *
 * <p>스트리밍 중에는 해당 이벤트만 건너뛰고 로그를 남기며,
 * coldStart 중에는 부트스트랩 전체를 중단시킵니다 (fail-closed).</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class PolicyDecodeException extends PolicyReplicaException {

    private final String policyId;

    public PolicyDecodeException(String policyId, String message) {
        super(message);
        this.policyId = policyId;
    }

    public PolicyDecodeException(String policyId, String message, Throwable cause) {
        super(message, cause);
        this.policyId = policyId;
    }

    /**
     * 복원에 실패한 레코드의 식별자.
     *
     * @return 식별자 (레코드에 식별자가 없으면 null)
     */
    public String getPolicyId() {
        return policyId;
    }
}
