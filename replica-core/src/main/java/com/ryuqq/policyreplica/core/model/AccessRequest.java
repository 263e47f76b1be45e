package com.ryuqq.policyreplica.core.model;

import java.util.Map;

/**
 * 인가 요청.
 *
 * <p>Condition 평가와 후보 Policy 조회의 입력입니다. context의 각 항목은
 * 같은 이름의 Condition에 전달되는 값입니다.</p>
 *
 * @param subject 요청 주체 (예: 사용자 ID)
 * @param resource 요청 대상 리소스
 * @param action 요청 동작
 * @param context 조건 평가용 값 (null이면 빈 맵)
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public record AccessRequest(
    String subject,
    String resource,
    String action,
    Map<String, Object> context
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException subject가 null이거나 context에 null 키/값이 있는 경우
     */
    public AccessRequest {
        if (subject == null) {
            throw new IllegalArgumentException("subject cannot be null");
        }
        context = copyOf(context);
    }

    /**
     * context 없이 AccessRequest 생성.
     *
     * @param subject 요청 주체
     * @param resource 요청 대상 리소스
     * @param action 요청 동작
     * @return AccessRequest 인스턴스
     */
    public static AccessRequest of(String subject, String resource, String action) {
        return new AccessRequest(subject, resource, action, Map.of());
    }

    /**
     * context 값 조회.
     *
     * @param key 조건 이름
     * @return 값 (없으면 null)
     */
    public Object contextValue(String key) {
        return context.get(key);
    }

    private static Map<String, Object> copyOf(Map<String, Object> context) {
        if (context == null) {
            return Map.of();
        }
        for (Map.Entry<String, Object> entry : context.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("context cannot contain null");
            }
        }
        return Map.copyOf(context);
    }
}
