package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/** One recorded status of a named posture checkpoint. */
public record CheckpointResult(
    @JsonProperty("checkpoint") String checkpoint,
    @JsonProperty("status")     CheckpointStatus status,
    @JsonProperty("recordedAt") Instant recordedAt
) {
    public CheckpointResult {
        Objects.requireNonNull(checkpoint, "checkpoint");
        if (status == null) status = CheckpointStatus.UNKNOWN;
        if (recordedAt == null) recordedAt = Instant.EPOCH;
    }
}
