package com.ospicorp.precorsia.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * All ids of both series that fall into one shared time bucket. Id sets keep the order in
 * which the ids appeared in their series.
 */
public record BucketPairing(
    long bucket,
    @JsonProperty("ids_series_a") Set<String> idsSeriesA,
    @JsonProperty("ids_series_b") Set<String> idsSeriesB
) {
  public BucketPairing {
    idsSeriesA = Collections.unmodifiableSet(new LinkedHashSet<>(idsSeriesA));
    idsSeriesB = Collections.unmodifiableSet(new LinkedHashSet<>(idsSeriesB));
  }
}
