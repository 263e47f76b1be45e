/**
 * Policy 조건 패키지.
 *
 * <p>조건은 타입 태그로 식별되는 다형 객체이며, {@link com.ryuqq.policyreplica.core.condition.ConditionRegistry}에
 * 등록된 태그만 복원할 수 있습니다. 새 조건 타입은 {@link com.ryuqq.policyreplica.core.condition.Condition}을
 * 구현하고 레지스트리에 등록하면 됩니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
package com.ryuqq.policyreplica.core.condition;
