package com.ryuqq.policyreplica.core.condition;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 타입 태그 → {@link Condition} 구현 클래스 레지스트리.
 *
 * <p>Policy Codec이 조건 payload를 복원할 때 타입 태그로 구현 클래스를 찾습니다.
 * 등록되지 않은 태그는 복원 오류이며, 조용히 버려지지 않습니다.</p>
 *
 * <p><strong>기본 등록 타입 ({@link #defaults()}):</strong></p>
 * <ul>
 *   <li>{@link StringEqualCondition}</li>
 *   <li>{@link StringMatchCondition}</li>
 *   <li>{@link CidrCondition}</li>
 *   <li>{@link EqualsSubjectCondition}</li>
 *   <li>{@link StringPairsEqualCondition}</li>
 * </ul>
 *
 * <p>Thread-safe: 등록과 조회를 여러 스레드에서 동시에 호출할 수 있습니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public final class ConditionRegistry {

    private final Map<String, Class<? extends Condition>> types = new ConcurrentHashMap<>();

    /**
     * 빈 레지스트리 생성.
     */
    public ConditionRegistry() {
    }

    /**
     * 기본 조건 타입이 등록된 레지스트리 생성.
     *
     * @return 새 ConditionRegistry 인스턴스
     */
    public static ConditionRegistry defaults() {
        return new ConditionRegistry()
            .register(StringEqualCondition.TYPE, StringEqualCondition.class)
            .register(StringMatchCondition.TYPE, StringMatchCondition.class)
            .register(CidrCondition.TYPE, CidrCondition.class)
            .register(EqualsSubjectCondition.TYPE, EqualsSubjectCondition.class)
            .register(StringPairsEqualCondition.TYPE, StringPairsEqualCondition.class);
    }

    /**
     * 조건 타입 등록.
     *
     * @param type 타입 태그
     * @param conditionClass 구현 클래스
     * @return this
     * @throws IllegalArgumentException 인자가 null/blank이거나 다른 클래스로 이미 등록된 태그인 경우
     */
    public ConditionRegistry register(String type, Class<? extends Condition> conditionClass) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (conditionClass == null) {
            throw new IllegalArgumentException("conditionClass cannot be null");
        }
        Class<? extends Condition> existing = types.putIfAbsent(type, conditionClass);
        if (existing != null && !existing.equals(conditionClass)) {
            throw new IllegalArgumentException(
                "type " + type + " is already registered to " + existing.getName()
            );
        }
        return this;
    }

    /**
     * 타입 태그로 구현 클래스 조회.
     *
     * @param type 타입 태그
     * @return 구현 클래스 (미등록이면 empty)
     */
    public Optional<Class<? extends Condition>> resolve(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(types.get(type));
    }

    public boolean isRegistered(String type) {
        return type != null && types.containsKey(type);
    }

    public Set<String> registeredTypes() {
        return Set.copyOf(types.keySet());
    }
}
