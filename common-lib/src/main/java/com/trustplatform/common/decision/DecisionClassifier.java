package com.trustplatform.common.decision;

import com.trustplatform.common.model.Decision;

import java.math.BigDecimal;

/**
 * Pure stateless classifier mapping a total score and threshold to a {@link Decision}.
 *
 * <pre>
 *   score ≥ threshold                 → ALLOW
 *   threshold × 0.8 ≤ score < threshold → REVIEW
 *   score < threshold × 0.8           → DENY
 * </pre>
 *
 * <p>Both boundaries are inclusive on the upper side. The review floor is computed in decimal
 * arithmetic so that a two-decimal score such as 56.00 compares equal to {@code 70 × 0.8}.
 * The {@value #REVIEW_BAND_RATIO} ratio is fixed for every policy.
 */
public final class DecisionClassifier {

    public static final double REVIEW_BAND_RATIO = 0.8;

    private static final BigDecimal RATIO = BigDecimal.valueOf(REVIEW_BAND_RATIO);

    private DecisionClassifier() {}

    public static Decision classify(double totalScore, double threshold) {
        BigDecimal score = BigDecimal.valueOf(totalScore);
        BigDecimal limit = BigDecimal.valueOf(threshold);
        if (score.compareTo(limit) >= 0) {
            return Decision.ALLOW;
        }
        if (score.compareTo(reviewFloor(limit)) >= 0) {
            return Decision.REVIEW;
        }
        return Decision.DENY;
    }

    /** Lowest score still classified as REVIEW for {@code threshold}. */
    public static double reviewFloor(double threshold) {
        return reviewFloor(BigDecimal.valueOf(threshold)).doubleValue();
    }

    private static BigDecimal reviewFloor(BigDecimal threshold) {
        return threshold.multiply(RATIO);
    }
}
