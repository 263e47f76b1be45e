package com.ryuqq.policyreplica.core.condition;

import com.ryuqq.policyreplica.core.model.AccessRequest;

/**
 * 값이 요청 주체(subject)와 같은지 확인하는 조건.
 *
 * <p>options 없음: {@code {}}</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public final class EqualsSubjectCondition implements Condition {

    public static final String TYPE = "EqualsSubjectCondition";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean fulfills(Object value, AccessRequest request) {
        return value instanceof String s && request != null && s.equals(request.subject());
    }

    @Override
    public boolean equals(Object o) {
        return o != null && getClass() == o.getClass();
    }

    @Override
    public int hashCode() {
        return TYPE.hashCode();
    }

    @Override
    public String toString() {
        return TYPE;
    }
}
