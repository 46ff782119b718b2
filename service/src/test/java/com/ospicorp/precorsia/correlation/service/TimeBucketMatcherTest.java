package com.ospicorp.precorsia.correlation.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.precorsia.correlation.model.AcquisitionRecord;
import com.ospicorp.precorsia.correlation.model.BucketPairing;
import com.ospicorp.precorsia.correlation.model.MatchedSeries;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TimeBucketMatcherTest {

  private static AcquisitionRecord rec(String id, long t) {
    return new AcquisitionRecord(id, t);
  }

  @Test
  void bucketTruncatesToPowerOfTen() {
    assertEquals(100L, TimeBucketMatcher.bucket(199, 2));
    assertEquals(1_546_300_000_000L, TimeBucketMatcher.bucket(1_546_300_800_000L, 8));
    assertEquals(7L, TimeBucketMatcher.bucket(7, 0));
    assertEquals(-100L, TimeBucketMatcher.bucket(-1, 2));
  }

  @Test
  void invalidRoundFactorIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> TimeBucketMatcher.bucket(1, -1));
    assertThrows(IllegalArgumentException.class, () -> TimeBucketMatcher.bucket(1, 19));
  }

  @Test
  void matchKeepsOnlySharedBucketsInInputOrder() {
    var a = List.of(rec("a3", 305), rec("a1", 101), rec("a2", 250), rec("a4", 110));
    var b = List.of(rec("b1", 199), rec("b2", 390), rec("b3", 999));

    MatchedSeries out = TimeBucketMatcher.match(a, b, 2);

    assertEquals(List.of(rec("a3", 305), rec("a1", 101), rec("a4", 110)), out.seriesA());
    assertEquals(List.of(rec("b1", 199), rec("b2", 390)), out.seriesB());
  }

  @Test
  void disjointBucketsGiveTwoEmptyLists() {
    var a = List.of(rec("a1", 100), rec("a2", 200));
    var b = List.of(rec("b1", 300), rec("b2", 450));

    MatchedSeries out = TimeBucketMatcher.match(a, b, 2);

    assertTrue(out.seriesA().isEmpty());
    assertTrue(out.seriesB().isEmpty());
    assertTrue(out.isEmpty());
    assertTrue(TimeBucketMatcher.connectedCorrelation(a, b, 2).isEmpty());
  }

  @Test
  void emptyInputIsTolerated() {
    MatchedSeries out = TimeBucketMatcher.match(List.of(), List.of(rec("b1", 1)), 1);
    assertTrue(out.isEmpty());
  }

  @Test
  void everyMatchedRecordHasABucketPresentInBothInputs() {
    Random random = new Random(42L);
    for (int round = 0; round < 20; round++) {
      List<AcquisitionRecord> a = new ArrayList<>();
      List<AcquisitionRecord> b = new ArrayList<>();
      for (int i = 0; i < 30; i++) {
        a.add(rec("a" + i, random.nextInt(5_000)));
        b.add(rec("b" + i, random.nextInt(5_000)));
      }
      int factor = 1 + random.nextInt(3);
      Set<Long> bucketsA = new HashSet<>();
      Set<Long> bucketsB = new HashSet<>();
      a.forEach(r -> bucketsA.add(TimeBucketMatcher.bucket(r.timestamp(), factor)));
      b.forEach(r -> bucketsB.add(TimeBucketMatcher.bucket(r.timestamp(), factor)));

      MatchedSeries out = TimeBucketMatcher.match(a, b, factor);

      for (AcquisitionRecord r : out.seriesA()) {
        long bucket = TimeBucketMatcher.bucket(r.timestamp(), factor);
        assertTrue(bucketsA.contains(bucket) && bucketsB.contains(bucket));
      }
      for (AcquisitionRecord r : out.seriesB()) {
        long bucket = TimeBucketMatcher.bucket(r.timestamp(), factor);
        assertTrue(bucketsA.contains(bucket) && bucketsB.contains(bucket));
      }
      long expectedA = a.stream()
          .filter(r -> bucketsB.contains(TimeBucketMatcher.bucket(r.timestamp(), factor)))
          .count();
      assertEquals(expectedA, out.seriesA().size());
    }
  }

  @Test
  void connectedCorrelationGroupsAllIdsOfASharedBucket() {
    var a = List.of(rec("a1", 101), rec("a2", 150), rec("a3", 230), rec("a4", 480));
    var b = List.of(rec("b1", 199), rec("b2", 260), rec("b3", 201), rec("b4", 999));

    List<BucketPairing> pairings = TimeBucketMatcher.connectedCorrelation(a, b, 2);

    assertEquals(2, pairings.size());
    BucketPairing first = pairings.get(0);
    assertEquals(100L, first.bucket());
    assertEquals(List.of("a1", "a2"), List.copyOf(first.idsSeriesA()));
    assertEquals(List.of("b1"), List.copyOf(first.idsSeriesB()));
    BucketPairing second = pairings.get(1);
    assertEquals(200L, second.bucket());
    assertEquals(List.of("a3"), List.copyOf(second.idsSeriesA()));
    assertEquals(List.of("b2", "b3"), List.copyOf(second.idsSeriesB()));
  }

  @Test
  void byBucketGroupsAscending() {
    var series = List.of(rec("x", 320), rec("y", 110), rec("z", 399));

    var grouped = TimeBucketMatcher.byBucket(series, 2);

    assertEquals(List.of(100L, 300L), List.copyOf(grouped.keySet()));
    assertEquals(List.of(rec("x", 320), rec("z", 399)), grouped.get(300L));
  }
}
