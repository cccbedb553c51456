package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Sole output of {@link com.trustplatform.common.engine.TrustEvaluationEngine}.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code totalScore}: weighted total rounded to two decimals, in [0, 100]</li>
 *   <li>{@code decision}: classification of {@code totalScore} against {@code thresholdUsed}</li>
 *   <li>{@code details}: per-factor breakdown, in evaluation order</li>
 *   <li>{@code policyId}: effective policy, {@code null} when defaults were used</li>
 *   <li>{@code thresholdUsed}: threshold the decision was derived from</li>
 *   <li>{@code effectiveWeights}: normalized weights actually applied, summing to 1</li>
 * </ul>
 *
 * <p>Ownership passes to the caller, which may persist or discard it.
 */
public record EvaluationResult(
    @JsonProperty("totalScore")       double totalScore,
    @JsonProperty("decision")         Decision decision,
    @JsonProperty("details")          List<ScoreDetail> details,
    @JsonProperty("policyId")         UUID policyId,
    @JsonProperty("thresholdUsed")    double thresholdUsed,
    @JsonProperty("effectiveWeights") Map<String, Double> effectiveWeights
) {
    public EvaluationResult {
        details = List.copyOf(details);
        effectiveWeights = Map.copyOf(effectiveWeights);
    }
}
