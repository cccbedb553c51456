package com.trustplatform.trust.service;

import com.trustplatform.common.model.EvaluationInput;
import com.trustplatform.common.model.EvaluationResult;

import java.util.UUID;

/** Decision returned to the boundary together with the generated attempt id. */
public record EvaluatedAttempt(UUID attemptId, EvaluationInput input, EvaluationResult result, String traceId) {}
