package com.ryuqq.policyreplica.core.condition;

import com.ryuqq.policyreplica.core.model.AccessRequest;

import java.util.List;

/**
 * 값이 두 원소 문자열 쌍의 목록이고 모든 쌍이 서로 같은지 확인하는 조건.
 *
 * <p>예: {@code [["a", "a"], ["b", "b"]]} 는 만족, {@code [["a", "b"]]} 는 불만족.
 * options 없음: {@code {}}</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public final class StringPairsEqualCondition implements Condition {

    public static final String TYPE = "StringPairsEqualCondition";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public boolean fulfills(Object value, AccessRequest request) {
        if (!(value instanceof List<?> pairs)) {
            return false;
        }
        for (Object pair : pairs) {
            if (!isEqualPair(pair)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isEqualPair(Object pair) {
        Object left;
        Object right;
        if (pair instanceof List<?> list && list.size() == 2) {
            left = list.get(0);
            right = list.get(1);
        } else if (pair instanceof String[] array && array.length == 2) {
            left = array[0];
            right = array[1];
        } else {
            return false;
        }
        return left instanceof String l && right instanceof String r && l.equals(r);
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
