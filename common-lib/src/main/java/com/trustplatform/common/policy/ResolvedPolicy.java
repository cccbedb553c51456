package com.trustplatform.common.policy;

import java.util.Map;
import java.util.UUID;

/**
 * Effective policy for one evaluation.
 *
 * @param policyId  selected policy, {@code null} when no policy was active
 * @param weights   raw (un-normalized) weights by factor name
 * @param threshold minimum score for ALLOW
 */
public record ResolvedPolicy(UUID policyId, Map<String, Double> weights, double threshold) {

    public ResolvedPolicy {
        weights = Map.copyOf(weights);
    }

    /** {@code true} when no policy was active and the configured defaults apply. */
    public boolean isDefault() {
        return policyId == null;
    }
}
