package com.ospicorp.precorsia.correlation.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.precorsia.correlation.model.BandRange;
import com.ospicorp.precorsia.correlation.model.BucketPairing;
import com.ospicorp.precorsia.correlation.model.CorrelationPoint;
import com.ospicorp.precorsia.correlation.model.ReducedSeries;
import com.ospicorp.precorsia.raster.InMemoryRasterStore;
import com.ospicorp.precorsia.raster.Raster;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SignalReducerTest {

  private InMemoryRasterStore store;
  private SignalReducer reducer;

  @BeforeEach
  void setUp() {
    store = new InMemoryRasterStore();
    reducer = new SignalReducer(store);
  }

  private void stash(String id, int... samples) {
    store.put(id, new Raster(id, samples.length, 1, samples));
  }

  @Test
  void reduceTakesMeanOfPerRasterMeans() {
    stash("a1", 10, 20);
    stash("a2", 30, 30, 30, 30);
    stash("b1", 0, 255, 255, 0);

    Optional<CorrelationPoint> point = reducer.reduce(
        new BucketPairing(100L, Set.of("a1", "a2"), Set.of("b1")));

    assertTrue(point.isPresent());
    assertEquals(22.5d, point.get().valueA(), 1e-12);
    assertEquals(127.5d, point.get().valueB(), 1e-12);
  }

  @Test
  void reduceSkipsMissingIdsAndDropsEmptySides() {
    stash("a1", 40, 60);
    stash("b1", 10, 10);

    Optional<CorrelationPoint> partial = reducer.reduce(
        new BucketPairing(0L, Set.of("a1", "gone"), Set.of("b1")));
    assertEquals(new CorrelationPoint(50d, 10d), partial.orElseThrow());

    assertTrue(reducer.reduce(new BucketPairing(0L, Set.of("a1"), Set.of("gone"))).isEmpty());
  }

  @Test
  void toPhysicalIsExactAtTheEndsOfTheSampleDomain() {
    BandRange range = new BandRange(0d, 0.7d);
    assertEquals(0d, SignalReducer.toPhysical(0d, range));
    assertEquals(0.7d, SignalReducer.toPhysical(255d, range));
    assertEquals(50d, SignalReducer.toPhysical(255d, new BandRange(0d, 50d)));
  }

  @Test
  void reduceAllKeepsPointsAlignedWithTheirPairings() {
    stash("a1", 51);
    stash("a3", 102);
    stash("b1", 255);
    stash("b3", 0);
    var first = new BucketPairing(10L, Set.of("a1"), Set.of("b1"));
    var dropped = new BucketPairing(20L, Set.of("a2"), Set.of("b2"));
    var third = new BucketPairing(30L, Set.of("a3"), Set.of("b3"));

    ReducedSeries reduced = reducer.reduceAll(List.of(first, dropped, third),
        new BandRange(0d, 255d), new BandRange(0d, 10d));

    assertEquals(2, reduced.size());
    assertEquals(List.of(first, third), reduced.pairings());
    assertEquals(51d, reduced.points().get(0).valueA(), 1e-9);
    assertEquals(10d, reduced.points().get(0).valueB(), 1e-9);
    assertEquals(102d, reduced.points().get(1).valueA(), 1e-9);
    assertEquals(0d, reduced.points().get(1).valueB(), 1e-9);
  }
}
