package com.ryuqq.policyreplica.core.condition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.policyreplica.core.model.AccessRequest;

/**
 * 값이 지정한 문자열과 정확히 같은지 확인하는 조건.
 *
 * <p>options: {@code {"equals": "..."}}</p>
 *
 * @param expected 기대 값
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public record StringEqualCondition(@JsonProperty("equals") String expected) implements Condition {

    public static final String TYPE = "StringEqualCondition";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean fulfills(Object value, AccessRequest request) {
        return value instanceof String s && s.equals(expected);
    }
}
