package com.ryuqq.policyreplica.core.spi;

import com.ryuqq.policyreplica.core.exception.PolicyMatchException;
import com.ryuqq.policyreplica.core.model.Policy;

import java.util.List;

/**
 * Matching predicate consumed as an opaque function.
 *
 * <p>Decides whether one of a policy's pattern lists matches a candidate string.
 * The pattern grammar belongs to the implementation.</p>
 *
 * @author Policy Replica Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface SubjectMatcher {

    /**
     * Evaluates the patterns against a candidate.
     *
     * @param policy the policy that owns the patterns
     * @param patterns the pattern list to evaluate (for subject lookup, {@code policy.getSubjects()})
     * @param candidate the string to match
     * @return true if any pattern matches
     * @throws PolicyMatchException if the patterns cannot be evaluated
     */
    boolean matches(Policy policy, List<String> patterns, String candidate);
}
