package com.ryuqq.policyreplica.core.condition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ryuqq.policyreplica.core.model.AccessRequest;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 값 전체가 정규식과 일치하는지 확인하는 조건.
 *
 * <p>options: {@code {"matches": "..."}}. 잘못된 정규식은 조건 불만족으로 평가됩니다.</p>
 *
 * @param matches 정규식
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public record StringMatchCondition(@JsonProperty("matches") String matches) implements Condition {

    public static final String TYPE = "StringMatchCondition";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean fulfills(Object value, AccessRequest request) {
        if (!(value instanceof String s) || matches == null) {
            return false;
        }
        try {
            return Pattern.matches(matches, s);
        } catch (PatternSyntaxException e) {
            return false;
        }
    }
}
