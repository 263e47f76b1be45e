package com.ryuqq.policyreplica.core.model;

/**
 * 변경 이벤트의 형태.
 *
 * <p>(old, new) 쌍의 존재 여부로 결정됩니다.</p>
 *
 * <pre>
 * old    new     형태
 * -----  -----   ------
 * 없음   없음    NONE   (무시)
 * 없음   있음    INSERT
 * 있음   없음    DELETE
 * 있음   있음    UPDATE (old 삭제 후 new 삽입, 식별자가 다르면 rename)
 * </pre>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public enum ChangeType {

    NONE,
    INSERT,
    DELETE,
    UPDATE;

    /**
     * (old, new) 존재 여부로 형태 결정.
     *
     * @param hasOld old 값 존재 여부
     * @param hasNew new 값 존재 여부
     * @return 변경 형태
     */
    public static ChangeType of(boolean hasOld, boolean hasNew) {
        if (hasOld && hasNew) {
            return UPDATE;
        }
        if (hasOld) {
            return DELETE;
        }
        if (hasNew) {
            return INSERT;
        }
        return NONE;
    }
}
