package com.ospicorp.precorsia.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QualityScore(
    String id,
    long timestamp,
    @JsonProperty("zero_fraction") double zeroFraction
) {}
