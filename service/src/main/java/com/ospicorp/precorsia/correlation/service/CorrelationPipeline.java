package com.ospicorp.precorsia.correlation.service;

import com.ospicorp.precorsia.config.PrecorsiaProperties;
import com.ospicorp.precorsia.correlation.model.AcquisitionRecord;
import com.ospicorp.precorsia.correlation.model.BandDescriptor;
import com.ospicorp.precorsia.correlation.model.BucketPairing;
import com.ospicorp.precorsia.correlation.model.CorrelationReport;
import com.ospicorp.precorsia.correlation.model.CorrelationRequest;
import com.ospicorp.precorsia.correlation.model.CorrelationResult;
import com.ospicorp.precorsia.correlation.model.MatchedSeries;
import com.ospicorp.precorsia.correlation.model.QualityScore;
import com.ospicorp.precorsia.correlation.model.ReducedSeries;
import com.ospicorp.precorsia.correlation.model.enums.CompositeWeighting;
import com.ospicorp.precorsia.correlation.model.enums.GapFillScope;
import com.ospicorp.precorsia.raster.RasterStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs a full correlation study: bucket matching, quality filtering with gap filling,
 * reduction to one point per shared bucket and the lag search.
 */
@Service
public class CorrelationPipeline {
  private static final Logger log = LoggerFactory.getLogger(CorrelationPipeline.class);

  private final RasterStore store;
  private final PrecorsiaProperties.Defaults defaults;
  private final CorrelationReportWriter reportWriter;

  public CorrelationPipeline(RasterStore store, PrecorsiaProperties properties,
      CorrelationReportWriter reportWriter) {
    this.store = store;
    this.defaults = properties.defaults();
    this.reportWriter = reportWriter;
  }

  public CorrelationReport run(CorrelationRequest request) {
    List<AcquisitionRecord> reference = request.referenceAcquisitions();
    List<AcquisitionRecord> comparable = request.comparableAcquisitions();
    if (reference == null || reference.isEmpty()) {
      throw new EmptyInputException("reference acquisition list is empty");
    }
    if (comparable == null || comparable.isEmpty()) {
      throw new EmptyInputException("comparable acquisition list is empty");
    }

    int roundFactor = request.roundFactor() != null ? request.roundFactor()
        : defaults.roundFactor();
    MatchedSeries matched = TimeBucketMatcher.match(reference, comparable, roundFactor);
    if (matched.isEmpty()) {
      throw new EmptyInputException("No time bucket of width 10^" + roundFactor
          + " is shared by " + request.reference().dataset() + " and "
          + request.comparable().dataset());
    }
    log.info("Matched {} of {} reference and {} of {} comparable acquisitions (round factor {})",
        matched.seriesA().size(), reference.size(), matched.seriesB().size(), comparable.size(),
        roundFactor);

    QualityFilter filter = qualityFilter(request);
    GapFillScope scope = request.gapFillScope() != null ? request.gapFillScope()
        : defaults.gapFillScope();
    List<QualityScore> keptReference = filterSeries(filter, matched.seriesA(), scope, roundFactor);
    List<QualityScore> keptComparable = filterSeries(filter, matched.seriesB(), scope,
        roundFactor);

    List<BucketPairing> pairings = TimeBucketMatcher.connectedCorrelation(
        toRecords(keptReference), toRecords(keptComparable), roundFactor);
    SignalReducer reducer = new SignalReducer(store);
    ReducedSeries reduced = reducer.reduceAll(pairings, request.reference().range(),
        request.comparable().range());
    if (reduced.size() == 0) {
      throw new InsufficientDataException("No usable time bucket left after quality filtering",
          LaggedCorrelationSearch.MIN_POINTS, 0);
    }

    CorrelationResult result = LaggedCorrelationSearch.search(reduced.points());
    double baseline = result.baselineR();
    log.info("Best shift: {}, best correlation: {} (baseline {}, {} buckets)", result.shift(),
        result.pearsonR(), baseline, reduced.size());

    Map<String, Object> quality = new LinkedHashMap<>();
    quality.put("reference_matched", matched.seriesA().size());
    quality.put("reference_kept", keptReference.size());
    quality.put("comparable_matched", matched.seriesB().size());
    quality.put("comparable_kept", keptComparable.size());
    quality.put("round_factor", roundFactor);
    quality.put("discard_threshold", filter.discardThreshold());
    quality.put("best_count", filter.bestCount());
    quality.put("composite_weighting", filter.weighting().name().toLowerCase(Locale.ROOT));
    quality.put("gap_fill_scope", scope.name().toLowerCase(Locale.ROOT));

    CorrelationReport report = new CorrelationReport(
        result.pearsonR(),
        result.shift(),
        baseline,
        reduced.pairings(),
        reduced.points(),
        result.points(),
        labels(request),
        quality,
        request.study(),
        null);
    if (request.persist()) {
      return reportWriter.write(report, request.comparable().dataset());
    }
    return report;
  }

  private QualityFilter qualityFilter(CorrelationRequest request) {
    double threshold = request.discardThreshold() != null ? request.discardThreshold()
        : defaults.discardThreshold();
    int bestCount = request.bestCount() != null ? request.bestCount() : defaults.bestCount();
    CompositeWeighting weighting = request.compositeWeighting() != null
        ? request.compositeWeighting() : defaults.compositeWeighting();
    return new QualityFilter(store, threshold, bestCount, weighting);
  }

  private List<QualityScore> filterSeries(QualityFilter filter, List<AcquisitionRecord> series,
      GapFillScope scope, int roundFactor) {
    if (scope == GapFillScope.SERIES) {
      return filter.apply(series);
    }
    List<QualityScore> kept = new ArrayList<>();
    for (List<AcquisitionRecord> group : TimeBucketMatcher.byBucket(series, roundFactor)
        .values()) {
      kept.addAll(filter.apply(group));
    }
    // back to input order so bucket grouping sees the same sequence as in series scope
    Map<String, Integer> order = new LinkedHashMap<>();
    for (int i = 0; i < series.size(); i++) {
      order.putIfAbsent(series.get(i).id(), i);
    }
    kept.sort(Comparator.comparingInt(s -> order.getOrDefault(s.id(), Integer.MAX_VALUE)));
    return kept;
  }

  private static List<AcquisitionRecord> toRecords(List<QualityScore> scores) {
    return scores.stream().map(s -> new AcquisitionRecord(s.id(), s.timestamp())).toList();
  }

  private static Map<String, String> labels(CorrelationRequest request) {
    BandDescriptor reference = request.reference();
    BandDescriptor comparable = request.comparable();
    StringBuilder title = new StringBuilder("Correlation between ")
        .append(reference.dataset()).append(" and \n").append(comparable.dataset());
    if (request.study() != null) {
      title.append(" at [").append(request.study().longitude()).append(", ")
          .append(request.study().latitude()).append(']');
    }
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put("title", title.toString());
    labels.put("xlabel", reference.axisLabel());
    labels.put("ylabel", comparable.axisLabel());
    return labels;
  }
}
