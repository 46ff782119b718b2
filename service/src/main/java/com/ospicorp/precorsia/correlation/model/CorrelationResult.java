package com.ospicorp.precorsia.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record CorrelationResult(
    List<CorrelationPoint> points,
    @JsonProperty("pearson_r") double pearsonR,
    int shift,
    @JsonProperty("baseline_r") double baselineR
) {
  public CorrelationResult {
    points = List.copyOf(points);
  }
}
