package com.ryuqq.policyreplica.core.spi;

import com.ryuqq.policyreplica.core.codec.WireRecord;
import com.ryuqq.policyreplica.core.model.ChangeType;

/**
 * Store change stream event for a single identifier.
 *
 * <p>Carries the record as it was before and after one committed write. Either side
 * may be absent (null):</p>
 * <ul>
 *   <li>both absent: ignored by consumers</li>
 *   <li>old absent, new present: insert</li>
 *   <li>old present, new absent: delete</li>
 *   <li>both present: update (old and new may carry different ids, which is a rename)</li>
 * </ul>
 *
 * @param oldValue the record before the write, or null
 * @param newValue the record after the write, or null
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public record ChangeEvent(WireRecord oldValue, WireRecord newValue) {

    public static ChangeEvent insert(WireRecord record) {
        return new ChangeEvent(null, record);
    }

    public static ChangeEvent delete(WireRecord record) {
        return new ChangeEvent(record, null);
    }

    public static ChangeEvent update(WireRecord oldValue, WireRecord newValue) {
        return new ChangeEvent(oldValue, newValue);
    }

    /**
     * Returns the shape of this event.
     *
     * @return NONE, INSERT, DELETE or UPDATE
     */
    public ChangeType type() {
        return ChangeType.of(oldValue != null, newValue != null);
    }
}
