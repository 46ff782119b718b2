package com.ospicorp.precorsia.correlation.service;

import com.ospicorp.precorsia.correlation.model.AcquisitionRecord;
import com.ospicorp.precorsia.correlation.model.BucketPairing;
import com.ospicorp.precorsia.correlation.model.MatchedSeries;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Truncates acquisition timestamps to buckets of width {@code 10^roundFactor} and pairs the
 * acquisitions of two series that share a bucket.
 */
public final class TimeBucketMatcher {
  // 10^18 is the largest power of ten a long holds
  static final int MAX_ROUND_FACTOR = 18;

  private TimeBucketMatcher() {
  }

  public static MatchedSeries match(List<AcquisitionRecord> seriesA,
      List<AcquisitionRecord> seriesB, int roundFactor) {
    long width = bucketWidth(roundFactor);
    Set<Long> shared = buckets(seriesA, width);
    shared.retainAll(buckets(seriesB, width));
    return new MatchedSeries(retain(seriesA, shared, width), retain(seriesB, shared, width));
  }

  public static List<BucketPairing> connectedCorrelation(List<AcquisitionRecord> seriesA,
      List<AcquisitionRecord> seriesB, int roundFactor) {
    long width = bucketWidth(roundFactor);
    SortedMap<Long, Set<String>> groupedA = group(seriesA, width);
    SortedMap<Long, Set<String>> groupedB = group(seriesB, width);

    List<BucketPairing> out = new ArrayList<>();
    for (Map.Entry<Long, Set<String>> e : groupedA.entrySet()) {
      Set<String> idsB = groupedB.get(e.getKey());
      if (idsB != null) {
        out.add(new BucketPairing(e.getKey(), e.getValue(), idsB));
      }
    }
    return out;
  }

  public static long bucket(long timestamp, int roundFactor) {
    return bucketOf(timestamp, bucketWidth(roundFactor));
  }

  /** Groups one series by bucket, ascending, ids in input order. */
  public static SortedMap<Long, List<AcquisitionRecord>> byBucket(
      List<AcquisitionRecord> series, int roundFactor) {
    long width = bucketWidth(roundFactor);
    SortedMap<Long, List<AcquisitionRecord>> out = new TreeMap<>();
    for (AcquisitionRecord r : series) {
      out.computeIfAbsent(bucketOf(r.timestamp(), width), k -> new ArrayList<>()).add(r);
    }
    return out;
  }

  static long bucketWidth(int roundFactor) {
    if (roundFactor < 0 || roundFactor > MAX_ROUND_FACTOR) {
      throw new IllegalArgumentException(
          "round factor must be between 0 and " + MAX_ROUND_FACTOR + ": " + roundFactor);
    }
    long width = 1L;
    for (int i = 0; i < roundFactor; i++) {
      width *= 10L;
    }
    return width;
  }

  private static long bucketOf(long timestamp, long width) {
    return Math.floorDiv(timestamp, width) * width;
  }

  private static Set<Long> buckets(List<AcquisitionRecord> series, long width) {
    Set<Long> out = new HashSet<>();
    for (AcquisitionRecord r : series) {
      out.add(bucketOf(r.timestamp(), width));
    }
    return out;
  }

  private static List<AcquisitionRecord> retain(List<AcquisitionRecord> series, Set<Long> shared,
      long width) {
    List<AcquisitionRecord> out = new ArrayList<>();
    for (AcquisitionRecord r : series) {
      if (shared.contains(bucketOf(r.timestamp(), width))) {
        out.add(r);
      }
    }
    return out;
  }

  private static SortedMap<Long, Set<String>> group(List<AcquisitionRecord> series, long width) {
    SortedMap<Long, Set<String>> out = new TreeMap<>();
    for (AcquisitionRecord r : series) {
      out.computeIfAbsent(bucketOf(r.timestamp(), width), k -> new LinkedHashSet<>()).add(r.id());
    }
    return out;
  }
}
