package com.trustplatform.trust.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/v1/trust/evaluate}. {@code clientIp} is the address the edge already
 * resolved for the caller; header parsing happens upstream.
 */
public record EvaluationRequest(
    @JsonProperty("subjectId") String subjectId,
    @JsonProperty("deviceId")  String deviceId,
    @JsonProperty("clientIp")  String clientIp
) {}
