package com.ryuqq.policyreplica.core.exception;

/**
 * Policy를 Wire Record로 직렬화할 수 없음.
 *
 * <p>Condition 객체 자체가 직렬화에 실패한 경우에만 발생합니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class PolicyEncodeException extends PolicyReplicaException {

    public PolicyEncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
