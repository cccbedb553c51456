package com.trustplatform.common.scoring;

import java.util.Map;

/**
 * Output of a {@link TrustScorer} run.
 *
 * @param totalScore       weighted total, rounded half-up to two decimals
 * @param effectiveWeights normalized weight applied to each scored factor; sums to 1 when non-empty
 * @param defaultsApplied  {@code true} when the supplied weights summed to zero and the defaults were used
 */
public record ScoreBreakdown(double totalScore, Map<String, Double> effectiveWeights, boolean defaultsApplied) {

    public ScoreBreakdown {
        effectiveWeights = Map.copyOf(effectiveWeights);
    }
}
