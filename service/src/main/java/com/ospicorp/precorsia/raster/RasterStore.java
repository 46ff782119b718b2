package com.ospicorp.precorsia.raster;

import java.util.NoSuchElementException;
import java.util.function.UnaryOperator;

/**
 * Keyed access to retrieved rasters. Implementations serialize operations on the same id,
 * so a raster that is being rewritten is never observed half-written.
 */
public interface RasterStore {

  /**
   * @throws NoSuchElementException when no raster is stored under {@code id}
   */
  Raster get(String id);

  void put(String id, Raster raster);

  /**
   * Reads the raster, applies {@code change} and stores the result while holding the id, so
   * no other read or write of the same id runs in between.
   *
   * @return the stored replacement
   * @throws NoSuchElementException when no raster is stored under {@code id}
   */
  Raster update(String id, UnaryOperator<Raster> change);

  /** Removes the raster; returns {@code false} if nothing was stored under {@code id}. */
  boolean delete(String id);

  boolean exists(String id);
}
