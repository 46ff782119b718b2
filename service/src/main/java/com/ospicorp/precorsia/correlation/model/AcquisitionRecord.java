package com.ospicorp.precorsia.correlation.model;

import jakarta.validation.constraints.NotBlank;

// One catalog entry: image id plus its acquisition start time
public record AcquisitionRecord(@NotBlank String id, long timestamp) {}
