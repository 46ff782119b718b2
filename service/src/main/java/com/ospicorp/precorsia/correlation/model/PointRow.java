package com.ospicorp.precorsia.correlation.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

// Flat CSV row of one reduced bucket
@JsonPropertyOrder({"bucket", "reference", "comparable"})
public record PointRow(long bucket, double reference, double comparable) {}
