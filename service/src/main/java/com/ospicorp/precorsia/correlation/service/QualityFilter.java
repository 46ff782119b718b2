package com.ospicorp.precorsia.correlation.service;

import com.ospicorp.precorsia.correlation.model.AcquisitionRecord;
import com.ospicorp.precorsia.correlation.model.QualityScore;
import com.ospicorp.precorsia.correlation.model.enums.CompositeWeighting;
import com.ospicorp.precorsia.raster.Raster;
import com.ospicorp.precorsia.raster.RasterStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scores rasters by their share of no-data pixels, drops the incomplete ones from the store
 * and patches the gaps of the best rasters of a group with their weighted composite.
 */
public class QualityFilter {
  private static final Logger log = LoggerFactory.getLogger(QualityFilter.class);

  public static final double DEFAULT_DISCARD_THRESHOLD = 0.33;
  public static final int DEFAULT_BEST_COUNT = 3;

  private final RasterStore store;
  private final double discardThreshold;
  private final int bestCount;
  private final CompositeWeighting weighting;

  public QualityFilter(RasterStore store) {
    this(store, DEFAULT_DISCARD_THRESHOLD, DEFAULT_BEST_COUNT, CompositeWeighting.EXACT);
  }

  public QualityFilter(RasterStore store, double discardThreshold, int bestCount,
      CompositeWeighting weighting) {
    if (discardThreshold < 0d || discardThreshold > 1d) {
      throw new IllegalArgumentException("discard threshold must be within [0, 1]");
    }
    if (bestCount < 1) {
      throw new IllegalArgumentException("best count must be positive");
    }
    this.store = store;
    this.discardThreshold = discardThreshold;
    this.bestCount = bestCount;
    this.weighting = weighting;
  }

  /**
   * Runs scoring, discarding, compositing and gap filling for one group of acquisitions.
   *
   * @return the scores that survived discarding, in input order
   */
  public List<QualityScore> apply(List<AcquisitionRecord> group) {
    List<QualityScore> survivors = discard(score(group));
    List<QualityScore> best = selectBest(survivors);
    if (best.isEmpty()) {
      log.warn("No raster of a {}-image group passed the quality filter", group.size());
      return survivors;
    }
    try {
      double[] composite = composite(best);
      fillAndPersist(best, composite);
    } catch (MalformedRasterException | NoSuchElementException e) {
      log.warn("Skipping gap filling for group {}: {}", ids(best), e.getMessage());
    }
    log.debug("Quality group of {} kept {} rasters, filled {}", group.size(), survivors.size(),
        best.size());
    return survivors;
  }

  /**
   * Scores every stored raster of the group. Rasters that are missing or malformed are
   * dropped from the result, and malformed ones are removed from the store.
   */
  public List<QualityScore> score(List<AcquisitionRecord> group) {
    List<QualityScore> out = new ArrayList<>(group.size());
    for (AcquisitionRecord record : group) {
      try {
        Raster raster = store.get(record.id());
        out.add(new QualityScore(record.id(), record.timestamp(), zeroFraction(raster)));
      } catch (NoSuchElementException e) {
        log.warn("Raster {} is not in the store; dropping it", record.id());
      } catch (MalformedRasterException e) {
        log.warn("Dropping malformed raster {}: {}", record.id(), e.getMessage());
        store.delete(record.id());
      }
    }
    return out;
  }

  public static double zeroFraction(Raster raster) {
    int total = raster.sampleCount();
    if (total == 0) {
      throw new MalformedRasterException("Raster " + raster.id() + " has no samples");
    }
    int zeros = 0;
    for (int s : raster.samples()) {
      if (s == Raster.NO_DATA) {
        zeros++;
      }
    }
    return (double) zeros / total;
  }

  /** Keeps scores at or below the threshold and deletes the stored rasters of the rest. */
  public List<QualityScore> discard(List<QualityScore> scores) {
    List<QualityScore> kept = new ArrayList<>(scores.size());
    for (QualityScore score : scores) {
      if (score.zeroFraction() > discardThreshold) {
        store.delete(score.id());
        log.debug("Discarded raster {} with zero fraction {}", score.id(), score.zeroFraction());
      } else {
        kept.add(score);
      }
    }
    return kept;
  }

  /** Lowest zero fractions first; equal scores keep their input order. */
  public List<QualityScore> selectBest(List<QualityScore> scores) {
    List<QualityScore> sorted = new ArrayList<>(scores);
    sorted.sort(Comparator.comparingDouble(QualityScore::zeroFraction));
    return new ArrayList<>(sorted.subList(0, Math.min(bestCount, sorted.size())));
  }

  public double[] composite(List<QualityScore> best) {
    if (best.isEmpty()) {
      throw new InsufficientDataException("Composite needs at least one raster", 1, 0);
    }
    double weight = weighting.weight(best.size());
    Raster first = store.get(best.get(0).id());
    double[] composite = new double[first.sampleCount()];
    for (QualityScore score : best) {
      Raster raster = score.id().equals(first.id()) ? first : store.get(score.id());
      if (!raster.sameShape(first)) {
        throw new MalformedRasterException("Raster " + raster.id() + " is " + raster.width()
            + "x" + raster.height() + " but the composite is " + first.width() + "x"
            + first.height());
      }
      int[] samples = raster.samples();
      for (int i = 0; i < samples.length; i++) {
        composite[i] += samples[i] * weight;
      }
    }
    return composite;
  }

  /**
   * Replaces the no-data samples of every best raster with the composite. Each raster is read,
   * filled and written back as one store update, so a concurrent write to the same id lands
   * either before the fill or after it.
   */
  public void fillAndPersist(List<QualityScore> best, double[] composite) {
    for (QualityScore score : best) {
      int[] filled = new int[1];
      store.update(score.id(), raster -> {
        if (raster.sampleCount() != composite.length) {
          throw new MalformedRasterException("Raster " + raster.id()
              + " does not match the composite size");
        }
        int[] samples = raster.samples();
        for (int i = 0; i < samples.length; i++) {
          if (samples[i] == Raster.NO_DATA) {
            samples[i] = toSample(composite[i]);
            filled[0]++;
          }
        }
        return raster.withSamples(samples);
      });
      log.debug("Filled {} samples of raster {}", filled[0], score.id());
    }
  }

  public double discardThreshold() {
    return discardThreshold;
  }

  public int bestCount() {
    return bestCount;
  }

  public CompositeWeighting weighting() {
    return weighting;
  }

  static int toSample(double value) {
    long rounded = Math.round(value);
    return (int) Math.max(Raster.NO_DATA, Math.min(Raster.MAX_SAMPLE, rounded));
  }

  private static List<String> ids(List<QualityScore> scores) {
    return scores.stream().map(QualityScore::id).toList();
  }
}
