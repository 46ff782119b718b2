package com.ospicorp.precorsia.correlation.model;

import com.fasterxml.jackson.annotation.JsonFormat;

// Serialized as a [value_a, value_b] tuple
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
public record CorrelationPoint(double valueA, double valueB) {}
