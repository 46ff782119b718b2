package com.ospicorp.precorsia.correlation.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CorrelationReport(
    @JsonProperty("best_correlation") double bestCorrelation,
    @JsonProperty("best_shift") int bestShift,
    @JsonProperty("baseline_correlation") double baselineCorrelation,
    @JsonProperty("correlation_list") List<BucketPairing> correlationList,
    List<CorrelationPoint> points,
    @JsonProperty("shifted_points") List<CorrelationPoint> shiftedPoints,
    Map<String, String> labels,
    Map<String, Object> quality,
    StudyInfo study,
    @JsonProperty("file_name") String fileName
) {

  public CorrelationReport withFileName(String name) {
    return new CorrelationReport(bestCorrelation, bestShift, baselineCorrelation,
        correlationList, points, shiftedPoints, labels, quality, study, name);
  }
}
