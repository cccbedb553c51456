package com.trustplatform.common.model;

import com.trustplatform.common.factor.FactorRegistry;

import java.util.Map;

/**
 * Fallback weights and threshold used when no policy is effective, and per factor
 * when the effective policy omits a weight.
 *
 * <p>Sourced once at the boundary and passed into the engine per call; never read
 * from process-wide mutable state.
 */
public record PolicyConfig(Map<String, Double> defaultWeights, double defaultThreshold) {

    public static final double DEFAULT_POSTURE_WEIGHT = 0.7;
    public static final double DEFAULT_CONTEXT_WEIGHT = 0.3;
    public static final double DEFAULT_THRESHOLD      = 70.0;

    private static final PolicyConfig DEFAULTS = new PolicyConfig(
        Map.of(FactorRegistry.DEVICE_POSTURE, DEFAULT_POSTURE_WEIGHT,
               FactorRegistry.CONTEXT,        DEFAULT_CONTEXT_WEIGHT),
        DEFAULT_THRESHOLD);

    public PolicyConfig {
        if (defaultWeights == null || defaultWeights.isEmpty()) {
            throw new IllegalArgumentException("defaultWeights must not be empty");
        }
        double sum = 0.0;
        for (Map.Entry<String, Double> e : defaultWeights.entrySet()) {
            double w = e.getValue() == null ? Double.NaN : e.getValue();
            if (!Double.isFinite(w) || w < 0.0) {
                throw new IllegalArgumentException(
                    "default weight for " + e.getKey() + " must be a non-negative number, got " + e.getValue());
            }
            sum += w;
        }
        if (sum <= 0.0) {
            throw new IllegalArgumentException("default weights must have a positive sum");
        }
        if (!(defaultThreshold >= 0.0 && defaultThreshold <= 100.0)) {
            throw new IllegalArgumentException("defaultThreshold must be within [0, 100], got " + defaultThreshold);
        }
        defaultWeights = Map.copyOf(defaultWeights);
    }

    /** {@code {device_posture: 0.7, context: 0.3}} with threshold 70. */
    public static PolicyConfig defaults() {
        return DEFAULTS;
    }
}
