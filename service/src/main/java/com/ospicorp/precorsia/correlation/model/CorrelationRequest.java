package com.ospicorp.precorsia.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.precorsia.correlation.model.enums.CompositeWeighting;
import com.ospicorp.precorsia.correlation.model.enums.GapFillScope;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Input of one correlation run. Tuning fields left {@code null} fall back to the configured
 * defaults.
 */
public record CorrelationRequest(
    @NotNull @Valid BandDescriptor reference,
    @NotNull @Valid BandDescriptor comparable,
    @JsonProperty("reference_acquisitions") @NotNull List<@NotNull @Valid AcquisitionRecord> referenceAcquisitions,
    @JsonProperty("comparable_acquisitions") @NotNull List<@NotNull @Valid AcquisitionRecord> comparableAcquisitions,
    @JsonProperty("round_factor") @Min(0) @Max(18) Integer roundFactor,
    @JsonProperty("discard_threshold") @DecimalMin("0.0") @DecimalMax("1.0") Double discardThreshold,
    @JsonProperty("best_count") @Min(1) Integer bestCount,
    @JsonProperty("composite_weighting") CompositeWeighting compositeWeighting,
    @JsonProperty("gap_fill_scope") GapFillScope gapFillScope,
    @Valid StudyInfo study,
    boolean persist
) {}
