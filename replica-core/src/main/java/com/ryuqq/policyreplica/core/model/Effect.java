package com.ryuqq.policyreplica.core.model;

/**
 * Policy의 효과 (허용/거부).
 *
 * <p>Wire Record에는 소문자 문자열({@code "allow"}, {@code "deny"})로 저장됩니다.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public enum Effect {

    ALLOW("allow"),
    DENY("deny");

    private final String value;

    Effect(String value) {
        this.value = value;
    }

    /**
     * Wire 표현 조회.
     *
     * @return 소문자 문자열 값
     */
    public String getValue() {
        return value;
    }

    /**
     * Wire 문자열에서 Effect 복원.
     *
     * <p>대소문자를 구분하지 않습니다.</p>
     *
     * @param value wire 문자열
     * @return Effect
     * @throws IllegalArgumentException null이거나 알 수 없는 값인 경우
     */
    public static Effect fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("effect cannot be null");
        }
        for (Effect effect : values()) {
            if (effect.value.equalsIgnoreCase(value.trim())) {
                return effect;
            }
        }
        throw new IllegalArgumentException("Unknown effect: " + value);
    }
}
