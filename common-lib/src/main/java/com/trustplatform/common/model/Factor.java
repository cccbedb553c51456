package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;
import java.util.UUID;

/**
 * Named, independently scored input signal of the trust computation.
 * Immutable once referenced by a policy weight or a score detail.
 */
public record Factor(
    @JsonProperty("id")          UUID id,
    @JsonProperty("name")        String name,
    @JsonProperty("description") String description
) {
    public Factor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
    }
}
