package com.trustplatform.trust.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.common.model.ScoreDetail;
import com.trustplatform.trust.service.EvaluatedAttempt;

import java.util.List;
import java.util.UUID;

/** Decision returned to the caller; {@code decision} carries the lower-case wire value. */
public record AttemptResponse(
    @JsonProperty("attemptId")     UUID attemptId,
    @JsonProperty("subjectId")     String subjectId,
    @JsonProperty("totalScore")    double totalScore,
    @JsonProperty("decision")      String decision,
    @JsonProperty("details")       List<ScoreDetail> details,
    @JsonProperty("policyId")      UUID policyId,
    @JsonProperty("thresholdUsed") double thresholdUsed,
    @JsonProperty("traceId")       String traceId
) {
    public static AttemptResponse from(EvaluatedAttempt attempt) {
        return new AttemptResponse(
            attempt.attemptId(),
            attempt.input().subjectId(),
            attempt.result().totalScore(),
            attempt.result().decision().wireValue(),
            attempt.result().details(),
            attempt.result().policyId(),
            attempt.result().thresholdUsed(),
            attempt.traceId());
    }
}
