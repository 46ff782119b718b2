package com.ospicorp.precorsia.correlation.service;

import com.ospicorp.precorsia.correlation.model.BandRange;
import com.ospicorp.precorsia.correlation.model.BucketPairing;
import com.ospicorp.precorsia.correlation.model.CorrelationPoint;
import com.ospicorp.precorsia.correlation.model.ReducedSeries;
import com.ospicorp.precorsia.raster.Raster;
import com.ospicorp.precorsia.raster.RasterStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.apache.commons.math3.stat.StatUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns every bucket pairing into one point: the unweighted mean of the spatial means of the
 * rasters on each side.
 */
public class SignalReducer {
  private static final Logger log = LoggerFactory.getLogger(SignalReducer.class);

  private final RasterStore store;

  public SignalReducer(RasterStore store) {
    this.store = store;
  }

  /**
   * @return the raw 0-255 point, or empty when one side has no readable raster
   */
  public Optional<CorrelationPoint> reduce(BucketPairing pairing) {
    Optional<Double> a = sideMean(pairing.idsSeriesA());
    Optional<Double> b = sideMean(pairing.idsSeriesB());
    if (a.isEmpty() || b.isEmpty()) {
      log.warn("Dropping bucket {}: no readable raster on series {}", pairing.bucket(),
          a.isEmpty() ? "A" : "B");
      return Optional.empty();
    }
    return Optional.of(new CorrelationPoint(a.get(), b.get()));
  }

  public ReducedSeries reduceAll(List<BucketPairing> pairings, BandRange rangeA,
      BandRange rangeB) {
    List<CorrelationPoint> points = new ArrayList<>(pairings.size());
    List<BucketPairing> used = new ArrayList<>(pairings.size());
    for (BucketPairing pairing : pairings) {
      reduce(pairing).ifPresent(raw -> {
        points.add(new CorrelationPoint(toPhysical(raw.valueA(), rangeA),
            toPhysical(raw.valueB(), rangeB)));
        used.add(pairing);
      });
    }
    return new ReducedSeries(points, used);
  }

  /** Linear map from the 0-255 sample domain onto {@code [0, range.max]}. */
  public static double toPhysical(double raw, BandRange range) {
    return raw / Raster.MAX_SAMPLE * range.max();
  }

  public static double spatialMean(Raster raster) {
    if (raster.sampleCount() == 0) {
      throw new MalformedRasterException("Raster " + raster.id() + " has no samples");
    }
    int[] samples = raster.samples();
    double[] values = new double[samples.length];
    for (int i = 0; i < samples.length; i++) {
      values[i] = samples[i];
    }
    return StatUtils.mean(values);
  }

  private Optional<Double> sideMean(Collection<String> ids) {
    List<Double> means = new ArrayList<>(ids.size());
    for (String id : ids) {
      try {
        means.add(spatialMean(store.get(id)));
      } catch (NoSuchElementException | MalformedRasterException e) {
        log.warn("Skipping raster {} during reduction: {}", id, e.getMessage());
      }
    }
    if (means.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(StatUtils.mean(means.stream().mapToDouble(Double::doubleValue).toArray()));
  }
}
