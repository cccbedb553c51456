package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-call facts about one access attempt, already extracted at the request boundary.
 *
 * @param subjectId subject (user) attempting access
 * @param deviceId  device identifier, {@code null} when unknown
 * @param clientIp  resolved client IP, {@code null} or {@value #UNDETERMINED_IP} when undetermined
 * @param timestamp instant of the attempt; drives the context time component
 */
public record EvaluationInput(
    @JsonProperty("subjectId") String subjectId,
    @JsonProperty("deviceId")  String deviceId,
    @JsonProperty("clientIp")  String clientIp,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static final String UNDETERMINED_IP = "0.0.0.0";

    public EvaluationInput {
        Objects.requireNonNull(timestamp, "timestamp");
        if (deviceId != null && deviceId.isBlank()) {
            deviceId = null;
        }
        if (clientIp == null || clientIp.isBlank()) {
            clientIp = UNDETERMINED_IP;
        }
    }
}
