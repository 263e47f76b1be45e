package com.ryuqq.policyreplica.core.model;

import com.ryuqq.policyreplica.core.condition.Conditions;
import com.ryuqq.policyreplica.core.condition.StringEqualCondition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Policy 테스트.
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
class PolicyTest {

    @Test
    void build_MinimalFields_AppliesDefaults() {
        // When
        Policy policy = Policy.builder()
            .id("p1")
            .effect(Effect.ALLOW)
            .build();

        // Then
        assertEquals("p1", policy.getId());
        assertEquals("", policy.getDescription());
        assertTrue(policy.getSubjects().isEmpty());
        assertTrue(policy.getResources().isEmpty());
        assertTrue(policy.getActions().isEmpty());
        assertTrue(policy.getConditions().isEmpty());
        assertTrue(policy.allows());
    }

    @Test
    void build_BlankId_ThrowsException() {
        Policy.Builder builder = Policy.builder().id("  ").effect(Effect.DENY);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void build_NullEffect_ThrowsException() {
        Policy.Builder builder = Policy.builder().id("p1");

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, builder::build);
        assertEquals("effect cannot be null", exception.getMessage());
    }

    @Test
    void build_NullSubjectElement_ThrowsException() {
        Policy.Builder builder = Policy.builder()
            .id("p1")
            .effect(Effect.ALLOW)
            .subjects(Arrays.asList("user:alice", null));

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void build_CopiesLists() {
        // Given
        List<String> subjects = new ArrayList<>(List.of("user:alice"));

        // When
        Policy policy = Policy.builder().id("p1").effect(Effect.ALLOW).subjects(subjects).build();
        subjects.add("user:bob");

        // Then
        assertEquals(List.of("user:alice"), policy.getSubjects());
        assertThrows(UnsupportedOperationException.class, () -> policy.getSubjects().add("x"));
    }

    @Test
    void build_ImmutableLists_KeepsValues() {
        // When
        Policy policy = Policy.builder()
            .id("p1")
            .effect(Effect.ALLOW)
            .subjects(List.of("user:alice"))
            .resources(List.copyOf(List.of("doc:1", "doc:2")))
            .actions(List.of("read"))
            .build();

        // Then
        assertEquals(List.of("user:alice"), policy.getSubjects());
        assertEquals(List.of("doc:1", "doc:2"), policy.getResources());
        assertEquals(List.of("read"), policy.getActions());
    }

    @Test
    void toBuilder_Unchanged_RebuildsEqualPolicy() {
        // Given
        Policy original = Policy.builder()
            .id("p1")
            .effect(Effect.DENY)
            .subjects(List.of("user:alice"))
            .actions(List.of("write"))
            .build();

        // When
        Policy rebuilt = original.toBuilder().build();

        // Then
        assertEquals(original, rebuilt);
    }

    @Test
    void equals_SameContent_AreEqual() {
        // Given
        Policy a = Policy.builder()
            .id("p1")
            .effect(Effect.DENY)
            .actions(List.of("read"))
            .conditions(Conditions.of("dept", new StringEqualCondition("eng")))
            .build();
        Policy b = Policy.builder()
            .id("p1")
            .effect(Effect.DENY)
            .actions(List.of("read"))
            .conditions(Conditions.of("dept", new StringEqualCondition("eng")))
            .build();

        // Then
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertFalse(a.allows());
    }

    @Test
    void toBuilder_ChangedDescription_NotEqual() {
        Policy original = Policy.builder().id("p1").effect(Effect.ALLOW).build();

        Policy changed = original.toBuilder().description("changed").build();

        assertNotEquals(original, changed);
        assertEquals(original.getId(), changed.getId());
    }
}
