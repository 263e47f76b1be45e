package com.ryuqq.policyreplica.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Effect 테스트.
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
class EffectTest {

    @Test
    void getValue_ReturnsWireString() {
        assertEquals("allow", Effect.ALLOW.getValue());
        assertEquals("deny", Effect.DENY.getValue());
    }

    @Test
    void fromValue_IgnoresCase() {
        assertEquals(Effect.ALLOW, Effect.fromValue("ALLOW"));
        assertEquals(Effect.DENY, Effect.fromValue("Deny"));
    }

    @Test
    void fromValue_UnknownValue_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> Effect.fromValue("maybe")
        );

        assertTrue(exception.getMessage().contains("maybe"));
    }

    @Test
    void fromValue_Null_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Effect.fromValue(null));
    }
}
