package com.ospicorp.precorsia.correlation.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record BandDescriptor(
    @NotBlank String dataset,
    @NotBlank String band,
    @NotNull @Valid BandRange range,
    String unit
) {

  /** Axis label used by plotting front ends, e.g. {@code average mm of precipitation per pixel [X]}. */
  public String axisLabel() {
    String prefix = unit == null || unit.isBlank() ? "average " : "average " + unit + " of ";
    return prefix + band + " per pixel [" + dataset + "]";
  }
}
