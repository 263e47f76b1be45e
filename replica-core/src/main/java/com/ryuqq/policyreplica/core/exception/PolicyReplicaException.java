package com.ryuqq.policyreplica.core.exception;

/**
 * Policy Replica SDK의 최상위 예외.
 *
 * <p>모든 도메인 예외는 unchecked 예외이며, 호출자는 필요한 하위 타입만 선택적으로 처리합니다.</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link StoreException} - 영속 저장소 작업 실패 (전송, 연결, 저장소 내부 오류)</li>
 *   <li>{@link PolicyDecodeException} - Wire Record를 Policy로 복원할 수 없음</li>
 *   <li>{@link PolicyEncodeException} - Policy를 Wire Record로 직렬화할 수 없음</li>
 *   <li>{@link PolicyNotFoundException} - Replica Cache에 식별자가 없음 (정상 결과)</li>
 *   <li>{@link PolicyMatchException} - 외부 매칭 함수 평가 실패</li>
 * </ul>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public class PolicyReplicaException extends RuntimeException {

    /**
     * 메시지로 예외 생성.
     *
     * @param message 오류 메시지
     */
    public PolicyReplicaException(String message) {
        super(message);
    }

    /**
     * 메시지와 원인으로 예외 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인 (null 허용)
     */
    public PolicyReplicaException(String message, Throwable cause) {
        super(message, cause);
    }
}
