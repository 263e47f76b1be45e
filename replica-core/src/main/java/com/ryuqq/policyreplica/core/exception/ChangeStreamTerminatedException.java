package com.ryuqq.policyreplica.core.exception;

/**
 * Change stream 종료.
 *
 * <p>구독 중인 변경 스트림이 끝났음을 알립니다. 원인(cause)이 있으면 오류로 인한 종료이고,
 * 없으면 저장소 측에서 정상적으로 닫힌 것입니다. 어느 경우든 이벤트를 계속 받으려면
 * 재구독해야 합니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class ChangeStreamTerminatedException extends StoreException {

    public ChangeStreamTerminatedException(String message) {
        super(message);
    }

    public ChangeStreamTerminatedException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 오류로 인한 종료인지 확인.
     *
     * @return 원인이 있으면 true
     */
    public boolean isAbnormal() {
        return getCause() != null;
    }
}
