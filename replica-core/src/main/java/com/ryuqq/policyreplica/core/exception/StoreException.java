package com.ryuqq.policyreplica.core.exception;

/**
 * 영속 저장소 작업 실패.
 *
 * <p>전송 오류, 연결 끊김, 저장소 내부 오류 등 로컬에서 복구할 수 없는 실패를 나타냅니다.
 * coldStart/create/update/delete/watch 호출자에게 그대로 전파되며,
 * Change Feed Consumer 내부에서는 로그 후 재구독으로 처리됩니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class StoreException extends PolicyReplicaException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
