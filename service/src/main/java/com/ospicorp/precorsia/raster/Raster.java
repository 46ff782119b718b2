package com.ospicorp.precorsia.raster;

import java.util.Arrays;
import java.util.Objects;

/**
 * Single-channel 8-bit raster. Samples are stored row-major and lie in 0..255; the value 0
 * marks a pixel without data.
 */
public final class Raster {
  public static final int NO_DATA = 0;
  public static final int MAX_SAMPLE = 255;

  private final String id;
  private final int width;
  private final int height;
  private final int[] samples;

  public Raster(String id, int width, int height, int[] samples) {
    this.id = Objects.requireNonNull(id, "id");
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("Raster dimensions must not be negative: "
          + width + "x" + height);
    }
    long expected = (long) width * height;
    if (samples.length != expected) {
      throw new IllegalArgumentException("Raster " + id + " expects " + expected
          + " samples but got " + samples.length);
    }
    for (int s : samples) {
      if (s < NO_DATA || s > MAX_SAMPLE) {
        throw new IllegalArgumentException("Sample out of range 0-255 in raster " + id + ": " + s);
      }
    }
    this.width = width;
    this.height = height;
    this.samples = samples.clone();
  }

  public String id() {
    return id;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int sampleCount() {
    return samples.length;
  }

  public int sample(int x, int y) {
    return samples[y * width + x];
  }

  public int[] samples() {
    return samples.clone();
  }

  public boolean sameShape(Raster other) {
    return width == other.width && height == other.height;
  }

  public Raster withSamples(int[] replacement) {
    return new Raster(id, width, height, replacement);
  }

  public Raster withId(String newId) {
    return new Raster(newId, width, height, samples);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Raster other)) return false;
    return width == other.width && height == other.height && id.equals(other.id)
        && Arrays.equals(samples, other.samples);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, width, height, Arrays.hashCode(samples));
  }

  @Override
  public String toString() {
    return "Raster[" + id + ", " + width + "x" + height + "]";
  }
}
