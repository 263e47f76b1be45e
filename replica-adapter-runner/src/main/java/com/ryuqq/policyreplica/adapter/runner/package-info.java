/**
 * Policy Replica 런타임 구현.
 *
 * <p><strong>구성 요소:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.policyreplica.adapter.runner.ReplicatedPolicyManager}: PolicyManager 구현체</li>
 *   <li>{@link com.ryuqq.policyreplica.adapter.runner.ChangeFeedConsumer}: 변경 스트림 → Replica Cache 반영</li>
 *   <li>{@link com.ryuqq.policyreplica.adapter.runner.BackoffCalculator}: 재구독 대기 시간 계산</li>
 *   <li>{@link com.ryuqq.policyreplica.adapter.runner.ChangeFeedConfig}: Consumer 설정</li>
 * </ul>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
package com.ryuqq.policyreplica.adapter.runner;
