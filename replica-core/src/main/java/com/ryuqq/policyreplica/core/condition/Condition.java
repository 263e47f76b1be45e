package com.ryuqq.policyreplica.core.condition;

import com.ryuqq.policyreplica.core.model.AccessRequest;

/**
 * 인가 시점에 평가되는 Policy 조건.
 *
 * <p>구현체는 타입 태그({@link #type()})로 식별되며, 각자 고유한 파라미터(options)를 가집니다.
 * 직렬화 시 options는 구현체의 JSON 프로퍼티로 표현되고, 복원 시
 * {@link ConditionRegistry}에서 타입 태그로 구현 클래스를 찾습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>불변 값 객체 (equals/hashCode가 파라미터 기준)</li>
 *   <li>Jackson으로 직렬화/역직렬화 가능한 프로퍼티</li>
 *   <li>{@link #fulfills(Object, AccessRequest)}는 부작용 없음</li>
 * </ul>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public interface Condition {

    /**
     * 레지스트리 타입 태그.
     *
     * @return 타입 태그 (예: StringEqualCondition)
     */
    String type();

    /**
     * 요청 context의 값이 조건을 만족하는지 평가.
     *
     * @param value 조건 이름에 대응하는 context 값 (null 가능)
     * @param request 인가 요청
     * @return 만족하면 true
     */
    boolean fulfills(Object value, AccessRequest request);
}
