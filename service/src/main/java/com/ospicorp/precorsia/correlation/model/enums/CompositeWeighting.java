package com.ospicorp.precorsia.correlation.model.enums;

public enum CompositeWeighting {
  /** Each selected raster weighs {@code 1 / selected count}. */
  EXACT,
  /** Fixed weight of 0.3332 per raster, kept for parity with older composites. */
  LEGACY;

  public static final double LEGACY_WEIGHT = 0.3332;

  public double weight(int selectedCount) {
    if (selectedCount < 1) {
      throw new IllegalArgumentException("selectedCount must be positive");
    }
    return this == LEGACY ? LEGACY_WEIGHT : 1d / selectedCount;
  }
}
