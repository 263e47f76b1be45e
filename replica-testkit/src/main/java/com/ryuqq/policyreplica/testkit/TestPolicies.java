package com.ryuqq.policyreplica.testkit;

import com.ryuqq.policyreplica.core.codec.PolicyCodec;
import com.ryuqq.policyreplica.core.codec.WireRecord;
import com.ryuqq.policyreplica.core.condition.CidrCondition;
import com.ryuqq.policyreplica.core.condition.Conditions;
import com.ryuqq.policyreplica.core.condition.EqualsSubjectCondition;
import com.ryuqq.policyreplica.core.condition.StringEqualCondition;
import com.ryuqq.policyreplica.core.condition.StringMatchCondition;
import com.ryuqq.policyreplica.core.condition.StringPairsEqualCondition;
import com.ryuqq.policyreplica.core.model.Effect;
import com.ryuqq.policyreplica.core.model.Policy;
import com.ryuqq.policyreplica.core.spi.SubjectMatcher;

import java.util.List;
import java.util.Map;

/**
 * Policy fixtures shared by the module test suites.
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
public final class TestPolicies {

    private static final PolicyCodec CODEC = new PolicyCodec();

    private TestPolicies() {
    }

    /**
     * Allow policy for {@code user:<id>} on {@code resource:<id>} with no conditions.
     */
    public static Policy simple(String id) {
        return Policy.builder()
            .id(id)
            .description("policy " + id)
            .effect(Effect.ALLOW)
            .subjects(List.of("user:" + id))
            .resources(List.of("resource:" + id))
            .actions(List.of("read"))
            .build();
    }

    /**
     * Policy granting the given subjects read access, for subject lookups.
     */
    public static Policy forSubjects(String id, String... subjects) {
        return simple(id).toBuilder()
            .subjects(List.of(subjects))
            .build();
    }

    /**
     * Deny policy carrying one condition of every built-in type.
     */
    public static Policy withAllConditions(String id) {
        return Policy.builder()
            .id(id)
            .description("all conditions")
            .effect(Effect.DENY)
            .subjects(List.of("user:<.*>", "group:admins"))
            .resources(List.of("articles:<[0-9]+>"))
            .actions(List.of("create", "update", "delete"))
            .conditions(Conditions.of(Map.of(
                "owner", new EqualsSubjectCondition(),
                "clientIp", new CidrCondition("10.0.0.0/8"),
                "department", new StringEqualCondition("engineering"),
                "userAgent", new StringMatchCondition("^Mozilla.*"),
                "pairs", new StringPairsEqualCondition()
            )))
            .build();
    }

    /**
     * Wire form of a policy, encoded with the default codec.
     */
    public static WireRecord record(Policy policy) {
        return CODEC.encode(policy);
    }

    /**
     * Wire record whose conditions payload references an unregistered condition type.
     */
    public static WireRecord undecodable(String id) {
        return new WireRecord(
            id, "broken", List.of("user:" + id), Effect.ALLOW.getValue(), List.of(), List.of(),
            "{\"c\":{\"type\":\"NoSuchCondition\",\"options\":{}}}"
        );
    }

    /**
     * Matcher comparing the candidate with each pattern literally.
     */
    public static SubjectMatcher exactMatcher() {
        return (policy, patterns, candidate) -> patterns.contains(candidate);
    }
}
