package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Administrator-defined factor weights plus the minimum threshold for {@link Decision#ALLOW}.
 *
 * <p>Weights are raw: they need not sum to 1, the scorer normalizes them.
 * The weight map is copied and unmodifiable.
 */
public record Policy(
    @JsonProperty("id")        UUID id,
    @JsonProperty("name")      String name,
    @JsonProperty("owner")     String owner,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("weights")   Map<String, Double> weights,
    @JsonProperty("active")    boolean active,
    @JsonProperty("createdAt") Instant createdAt
) {
    public Policy {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        weights = weights == null ? Map.of() : Map.copyOf(weights);
    }
}
