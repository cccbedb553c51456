package com.trustplatform.common.policy;

import com.trustplatform.common.exception.PolicyValidationException;
import com.trustplatform.common.factor.FactorRegistry;
import com.trustplatform.common.model.Policy;

import java.util.Map;

/**
 * Load-time check of a stored policy before it may take part in resolution.
 *
 * <p>Rules:
 * <ul>
 *   <li>threshold within [0, 100]</li>
 *   <li>every weight finite and non-negative</li>
 *   <li>every weighted factor registered in the {@link FactorRegistry}</li>
 * </ul>
 * A policy whose weights are all zero is valid; the scorer falls back to the defaults for it.
 */
public final class PolicyValidator {

    private PolicyValidator() {}

    public static Policy validate(Policy policy, FactorRegistry registry) {
        double threshold = policy.threshold();
        if (!(threshold >= 0.0 && threshold <= 100.0)) {
            throw new PolicyValidationException(policy.id(),
                "threshold must be within [0, 100], got " + threshold);
        }
        for (Map.Entry<String, Double> e : policy.weights().entrySet()) {
            Double weight = e.getValue();
            if (weight == null || !Double.isFinite(weight) || weight < 0.0) {
                throw new PolicyValidationException(policy.id(),
                    "weight for factor '" + e.getKey() + "' must be a non-negative number, got " + weight);
            }
            if (!registry.contains(e.getKey())) {
                throw new PolicyValidationException(policy.id(),
                    "weight references unregistered factor '" + e.getKey() + "'");
            }
        }
        return policy;
    }
}
