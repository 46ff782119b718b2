package com.ospicorp.precorsia.correlation.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDate;

/**
 * Descriptive context of a run: where and when the two series were acquired. Only used to
 * label and name reports.
 */
public record StudyInfo(
    String climate,
    double longitude,
    double latitude,
    @JsonProperty("start_date") LocalDate startDate,
    @PositiveOrZero int days
) {}
