package com.trustplatform.trust.store;

import com.trustplatform.common.model.EvaluationInput;
import com.trustplatform.common.model.EvaluationResult;

import java.util.UUID;

/**
 * Audit record handed to the store after an evaluation: the attempt facts plus the
 * result exactly as the engine returned it.
 */
public record AccessAttemptRecord(
    UUID attemptId,
    EvaluationInput input,
    EvaluationResult result,
    String traceId
) {
    /** Human-readable summary, e.g. {@code "Total score 59.0, threshold 70.0"}. */
    public String reason() {
        return "Total score " + result.totalScore() + ", threshold " + result.thresholdUsed();
    }
}
