package com.ospicorp.precorsia.correlation.model;

import java.util.List;

// points.get(i) was reduced from pairings.get(i)
public record ReducedSeries(List<CorrelationPoint> points, List<BucketPairing> pairings) {

  public ReducedSeries {
    if (points.size() != pairings.size()) {
      throw new IllegalArgumentException("points and pairings must align");
    }
    points = List.copyOf(points);
    pairings = List.copyOf(pairings);
  }

  public int size() {
    return points.size();
  }
}
