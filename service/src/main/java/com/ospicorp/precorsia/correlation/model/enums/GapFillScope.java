package com.ospicorp.precorsia.correlation.model.enums;

public enum GapFillScope {
  // one quality group per matched series
  SERIES,
  // one quality group per series and time bucket
  BUCKET
}
