package com.ospicorp.precorsia.correlation.service;

import com.ospicorp.precorsia.correlation.model.CorrelationPoint;
import com.ospicorp.precorsia.correlation.model.CorrelationResult;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the integer lag between two aligned signals that maximizes their Pearson
 * correlation.
 *
 * <p>For a positive shift {@code i} series A is advanced by {@code i} steps and series B is
 * trimmed at its end; for a negative shift series B is advanced and series A trimmed. Shifts
 * run from {@code -(n / 4)} up to, but excluding, {@code n / 4}. A shift replaces the current
 * best only when its coefficient is strictly greater, so the unshifted series wins ties.
 * The unshifted coefficient is returned alongside the best one, with {@code NaN} read as 0.
 */
public final class LaggedCorrelationSearch {
  private static final Logger log = LoggerFactory.getLogger(LaggedCorrelationSearch.class);

  static final int MIN_POINTS = 2;

  private LaggedCorrelationSearch() {
  }

  public static CorrelationResult search(List<CorrelationPoint> points) {
    int n = points.size();
    if (n < MIN_POINTS) {
      throw new InsufficientDataException("Correlation needs at least two points", MIN_POINTS, n);
    }
    double baseline = pearson(points);
    if (Double.isNaN(baseline)) {
      baseline = 0d;
    }
    double bestCorr = baseline;
    int bestShift = 0;
    List<CorrelationPoint> bestPoints = points;

    int bound = n / 4;
    for (int shift = -bound; shift < bound; shift++) {
      if (shift == 0) {
        continue;
      }
      List<CorrelationPoint> aligned = align(points, shift);
      if (aligned.size() < MIN_POINTS) {
        continue;
      }
      double corr = pearson(aligned);
      if (corr > bestCorr) {
        bestCorr = corr;
        bestShift = shift;
        bestPoints = aligned;
      }
    }
    log.debug("Best shift {} of {} points with r={}", bestShift, n, bestCorr);
    return new CorrelationResult(bestPoints, bestCorr, bestShift, baseline);
  }

  /**
   * Pairs {@code a[shift + k]} with {@code b[k]} for positive shifts and {@code a[k]} with
   * {@code b[k - shift]} for negative ones. The result holds {@code n - |shift|} points, or
   * none when the shift is at least as long as the series.
   */
  public static List<CorrelationPoint> align(List<CorrelationPoint> points, int shift) {
    int n = points.size();
    int length = n - Math.abs(shift);
    List<CorrelationPoint> out = new ArrayList<>(Math.max(length, 0));
    for (int k = 0; k < length; k++) {
      CorrelationPoint a = points.get(shift > 0 ? k + shift : k);
      CorrelationPoint b = points.get(shift > 0 ? k : k - shift);
      out.add(new CorrelationPoint(a.valueA(), b.valueB()));
    }
    return out;
  }

  /** Pearson r of the two coordinates; {@code NaN} when either side has no variance. */
  public static double pearson(List<CorrelationPoint> points) {
    if (points.size() < MIN_POINTS) {
      throw new InsufficientDataException("Correlation needs at least two points", MIN_POINTS,
          points.size());
    }
    double[] a = new double[points.size()];
    double[] b = new double[points.size()];
    for (int i = 0; i < points.size(); i++) {
      a[i] = points.get(i).valueA();
      b[i] = points.get(i).valueB();
    }
    return new PearsonsCorrelation().correlation(a, b);
  }
}
