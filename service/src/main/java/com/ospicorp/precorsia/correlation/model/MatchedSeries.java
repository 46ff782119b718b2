package com.ospicorp.precorsia.correlation.model;

import java.util.List;

// Both acquisition lists restricted to the buckets they share, input order preserved
public record MatchedSeries(List<AcquisitionRecord> seriesA, List<AcquisitionRecord> seriesB) {

  public boolean isEmpty() {
    return seriesA.isEmpty() && seriesB.isEmpty();
  }
}
