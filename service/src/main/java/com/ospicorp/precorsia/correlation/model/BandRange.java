package com.ospicorp.precorsia.correlation.model;

import jakarta.validation.constraints.AssertTrue;

/**
 * Physical value range a band was stretched from when it was rendered into 0-255 samples.
 */
public record BandRange(double min, double max) {

  @AssertTrue(message = "max must be greater than or equal to min")
  boolean isOrdered() {
    return max >= min;
  }
}
