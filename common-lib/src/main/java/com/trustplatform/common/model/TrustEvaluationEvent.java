package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Notification emitted to live subscribers after an attempt has been evaluated.
 */
public record TrustEvaluationEvent(
    @JsonProperty("attemptId")  UUID attemptId,
    @JsonProperty("subjectId")  String subjectId,
    @JsonProperty("deviceId")   String deviceId,
    @JsonProperty("totalScore") double totalScore,
    @JsonProperty("decision")   Decision decision,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("traceId")    String traceId
) {
    public static TrustEvaluationEvent of(UUID attemptId, EvaluationInput input,
                                          EvaluationResult result, String traceId) {
        return new TrustEvaluationEvent(attemptId, input.subjectId(), input.deviceId(),
                                        result.totalScore(), result.decision(),
                                        input.timestamp(), traceId);
    }
}
