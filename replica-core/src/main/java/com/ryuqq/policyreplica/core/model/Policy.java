package com.ryuqq.policyreplica.core.model;

import com.ryuqq.policyreplica.core.condition.Conditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 접근 제어 Policy.
 *
 * <p>subject/resource/action 패턴과 조건(Conditions)을 효과(Effect)에 매핑하는 규칙입니다.
 * Replica Cache의 키는 {@link #getId()}입니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 식별자 변경은 허용되지 않으며,
 * 수정은 항상 delete-then-insert로 표현됩니다.</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>id: null 또는 빈 문자열 불가</li>
 *   <li>effect: null 불가</li>
 *   <li>description: null이면 빈 문자열로 저장</li>
 *   <li>subjects/resources/actions: null이면 빈 목록, 순서 유지</li>
 *   <li>conditions: null이면 빈 조건 집합</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Policy policy = Policy.builder()
 *     .id("p1")
 *     .description("alice may read articles")
 *     .subjects(List.of("alice"))
 *     .resources(List.of("articles:&lt;.*&gt;"))
 *     .actions(List.of("read"))
 *     .effect(Effect.ALLOW)
 *     .build();
 * </pre>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public final class Policy {

    private final String id;
    private final String description;
    private final Effect effect;
    private final List<String> subjects;
    private final List<String> resources;
    private final List<String> actions;
    private final Conditions conditions;

    private Policy(Builder builder) {
        if (builder.id == null || builder.id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (builder.effect == null) {
            throw new IllegalArgumentException("effect cannot be null");
        }
        this.id = builder.id;
        this.description = builder.description == null ? "" : builder.description;
        this.effect = builder.effect;
        this.subjects = copyOf(builder.subjects, "subjects");
        this.resources = copyOf(builder.resources, "resources");
        this.actions = copyOf(builder.actions, "actions");
        this.conditions = builder.conditions == null ? Conditions.empty() : builder.conditions;
    }

    private static List<String> copyOf(List<String> values, String name) {
        if (values == null) {
            return List.of();
        }
        List<String> copy = new ArrayList<>(values);
        if (copy.contains(null)) {
            throw new IllegalArgumentException(name + " cannot contain null");
        }
        return List.copyOf(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 현재 값을 복사한 Builder 생성.
     *
     * @return 값이 채워진 Builder
     */
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .description(description)
            .effect(effect)
            .subjects(subjects)
            .resources(resources)
            .actions(actions)
            .conditions(conditions);
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public Effect getEffect() {
        return effect;
    }

    public List<String> getSubjects() {
        return subjects;
    }

    public List<String> getResources() {
        return resources;
    }

    public List<String> getActions() {
        return actions;
    }

    public Conditions getConditions() {
        return conditions;
    }

    /**
     * 허용 Policy인지 확인.
     *
     * @return effect가 ALLOW이면 true
     */
    public boolean allows() {
        return effect == Effect.ALLOW;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Policy policy = (Policy) o;
        return id.equals(policy.id)
            && description.equals(policy.description)
            && effect == policy.effect
            && subjects.equals(policy.subjects)
            && resources.equals(policy.resources)
            && actions.equals(policy.actions)
            && conditions.equals(policy.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, effect, subjects, resources, actions, conditions);
    }

    @Override
    public String toString() {
        return "Policy{id=" + id + ", effect=" + effect.getValue()
            + ", subjects=" + subjects + ", resources=" + resources
            + ", actions=" + actions + ", conditions=" + conditions.names() + '}';
    }

    /**
     * Policy Builder.
     */
    public static final class Builder {

        private String id;
        private String description;
        private Effect effect;
        private List<String> subjects;
        private List<String> resources;
        private List<String> actions;
        private Conditions conditions;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder effect(Effect effect) {
            this.effect = effect;
            return this;
        }

        public Builder subjects(List<String> subjects) {
            this.subjects = subjects;
            return this;
        }

        public Builder resources(List<String> resources) {
            this.resources = resources;
            return this;
        }

        public Builder actions(List<String> actions) {
            this.actions = actions;
            return this;
        }

        public Builder conditions(Conditions conditions) {
            this.conditions = conditions;
            return this;
        }

        /**
         * Policy 생성.
         *
         * @return Policy 인스턴스
         * @throws IllegalArgumentException id가 비어 있거나 effect가 null인 경우
         */
        public Policy build() {
            return new Policy(this);
        }
    }
}
