package com.ryuqq.policyreplica.core.condition;

import com.ryuqq.policyreplica.core.model.AccessRequest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 조건 이름 → {@link Condition} 매핑.
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. {@link #with(String, Condition)}는 새 인스턴스를 반환합니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public final class Conditions {

    private static final Conditions EMPTY = new Conditions(Map.of());

    private final Map<String, Condition> entries;

    private Conditions(Map<String, Condition> entries) {
        this.entries = entries;
    }

    public static Conditions empty() {
        return EMPTY;
    }

    /**
     * 매핑에서 Conditions 생성.
     *
     * @param entries 조건 이름 → Condition (null이면 빈 집합)
     * @return Conditions 인스턴스
     * @throws IllegalArgumentException 이름이 비어 있거나 Condition이 null인 경우
     */
    public static Conditions of(Map<String, ? extends Condition> entries) {
        if (entries == null || entries.isEmpty()) {
            return EMPTY;
        }
        Map<String, Condition> copy = new LinkedHashMap<>();
        entries.forEach((name, condition) -> {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("condition name cannot be null or blank");
            }
            if (condition == null) {
                throw new IllegalArgumentException("condition cannot be null: " + name);
            }
            copy.put(name, condition);
        });
        return new Conditions(Collections.unmodifiableMap(copy));
    }

    public static Conditions of(String name, Condition condition) {
        return of(Map.of(name, condition));
    }

    /**
     * 조건을 추가(또는 교체)한 새 인스턴스 생성.
     */
    public Conditions with(String name, Condition condition) {
        Map<String, Condition> copy = new LinkedHashMap<>(entries);
        copy.put(name, condition);
        return of(copy);
    }

    public Condition get(String name) {
        return entries.get(name);
    }

    public Set<String> names() {
        return entries.keySet();
    }

    public Map<String, Condition> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 모든 조건이 요청 context를 만족하는지 평가.
     *
     * <p>각 조건에는 같은 이름의 context 값이 전달됩니다. 빈 집합은 항상 true입니다.</p>
     *
     * @param request 인가 요청
     * @return 모든 조건을 만족하면 true
     */
    public boolean fulfillsAll(AccessRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        for (Map.Entry<String, Condition> entry : entries.entrySet()) {
            if (!entry.getValue().fulfills(request.contextValue(entry.getKey()), request)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return entries.equals(((Conditions) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Conditions" + entries;
    }
}
