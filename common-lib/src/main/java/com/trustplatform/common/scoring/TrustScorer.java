package com.trustplatform.common.scoring;

import java.util.Map;

/**
 * Strategy contract for combining per-factor scores into one total.
 *
 * <p>Implementations must be stateless, free of side effects, and must always return a
 * valid {@link ScoreBreakdown}.
 */
public interface TrustScorer {

    /**
     * @param scores         factor name → score in [0, 100], iteration order is kept in the result
     * @param weights        factor name → raw weight from the effective policy; may be a subset or
     *                       superset of {@code scores}
     * @param defaultWeights factor name → fallback weight, applied per missing factor
     * @return the combined score, never {@code null}
     */
    ScoreBreakdown score(Map<String, Double> scores,
                         Map<String, Double> weights,
                         Map<String, Double> defaultWeights);
}
