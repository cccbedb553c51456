package com.trustplatform.common.scoring;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default {@link TrustScorer}: weighted mean of factor scores with normalized weights.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>For each scored factor take the policy weight; when the policy has none, take the
 *       default weight for that factor (0.0 when there is no default either). Weights for
 *       factors that were not scored are ignored.</li>
 *   <li>Negative or non-finite weights count as 0.0.</li>
 *   <li>If the weights taken sum to more than 0, divide each by the sum. Otherwise discard them
 *       and repeat with the default weights alone; if those also sum to 0 for the scored
 *       factors, every scored factor gets an equal share.</li>
 *   <li>{@code total = round(Σ weight × score, 2)}, half-up.</li>
 * </ol>
 *
 * <p>With scores in [0, 100] and weights summing to 1 the total stays in [0, 100]; no clamp
 * is applied. An empty score map yields a total of 0.0.
 *
 * <p>This class is stateless and thread-safe.
 */
public class NormalizedWeightedTrustScorer implements TrustScorer {

    static final int SCALE = 2;

    @Override
    public ScoreBreakdown score(Map<String, Double> scores,
                                Map<String, Double> weights,
                                Map<String, Double> defaultWeights) {
        if (scores == null || scores.isEmpty()) {
            return new ScoreBreakdown(0.0, Map.of(), false);
        }
        Map<String, Double> policyWeights  = weights == null ? Map.of() : weights;
        Map<String, Double> fallback       = defaultWeights == null ? Map.of() : defaultWeights;

        Map<String, Double> used = new LinkedHashMap<>();
        for (String factor : scores.keySet()) {
            Double w = policyWeights.containsKey(factor) ? policyWeights.get(factor) : fallback.get(factor);
            used.put(factor, sanitize(w));
        }

        boolean defaultsApplied = false;
        if (sum(used) <= 0.0) {
            defaultsApplied = true;
            used.replaceAll((factor, w) -> sanitize(fallback.get(factor)));
            if (sum(used) <= 0.0) {
                used.replaceAll((factor, w) -> 1.0);
            }
        }

        double total = sum(used);
        Map<String, Double> effective = new LinkedHashMap<>();
        double weighted = 0.0;
        for (Map.Entry<String, Double> e : used.entrySet()) {
            double w = e.getValue() / total;
            effective.put(e.getKey(), w);
            weighted += w * scores.get(e.getKey());
        }

        return new ScoreBreakdown(round(weighted), effective, defaultsApplied);
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    private static double sanitize(Double weight) {
        if (weight == null || !Double.isFinite(weight) || weight < 0.0) {
            return 0.0;
        }
        return weight;
    }

    private static double sum(Map<String, Double> weights) {
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
