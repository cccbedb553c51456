package com.trustplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One factor's contribution to a total score, in [0, 100]. */
public record ScoreDetail(
    @JsonProperty("factor")       String factorName,
    @JsonProperty("contribution") double contribution
) {}
