package com.trustplatform.common.policy;

import com.trustplatform.common.model.Policy;
import com.trustplatform.common.model.PolicyConfig;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Selects the effective policy for an evaluation.
 *
 * <h3>Selection</h3>
 * <ol>
 *   <li>Inactive policies are ignored even if supplied.</li>
 *   <li>Among active policies the earliest {@code createdAt} wins.</li>
 *   <li>Equal {@code createdAt} is broken by the policy id's string form, ascending.</li>
 *   <li>No active policy → the {@link PolicyConfig} defaults, with a {@code null} policy id.</li>
 * </ol>
 *
 * <p>The selection is a total order, so the same policy set always yields the same policy
 * regardless of input order. Weights are returned raw; normalization is the scorer's job.
 */
public final class PolicyResolver {

    static final Comparator<Policy> EFFECTIVE_ORDER =
        Comparator.comparing(Policy::createdAt)
                  .thenComparing(p -> p.id().toString());

    public Optional<Policy> select(List<Policy> activePolicies) {
        if (activePolicies == null || activePolicies.isEmpty()) {
            return Optional.empty();
        }
        return activePolicies.stream()
            .filter(p -> p != null && p.active())
            .min(EFFECTIVE_ORDER);
    }

    public ResolvedPolicy resolve(List<Policy> activePolicies, PolicyConfig config) {
        return select(activePolicies)
            .map(p -> new ResolvedPolicy(p.id(), p.weights(), p.threshold()))
            .orElseGet(() -> new ResolvedPolicy(null, config.defaultWeights(), config.defaultThreshold()));
    }
}
