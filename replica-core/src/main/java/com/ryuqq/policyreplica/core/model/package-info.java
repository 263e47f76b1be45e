/**
 * 도메인 모델 패키지.
 *
 * <p>Policy와 인가 요청, 복원된 변경 이벤트를 표현하는 불변 값 객체들을 포함합니다.</p>
 *
 * <h2>주요 타입</h2>
 * <ul>
 *   <li>{@link com.ryuqq.policyreplica.core.model.Policy} - 접근 제어 규칙</li>
 *   <li>{@link com.ryuqq.policyreplica.core.model.Effect} - 허용/거부</li>
 *   <li>{@link com.ryuqq.policyreplica.core.model.AccessRequest} - 조건 평가 입력</li>
 *   <li>{@link com.ryuqq.policyreplica.core.model.PolicyChange} - Replica Cache 적용 단위</li>
 * </ul>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
package com.ryuqq.policyreplica.core.model;
