package com.ospicorp.precorsia.raster;

import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

public class InMemoryRasterStore implements RasterStore {
  private final ConcurrentMap<String, Raster> rasters = new ConcurrentHashMap<>();
  private final KeyedLocks locks = new KeyedLocks();

  @Override
  public Raster get(String id) {
    return locks.withLock(id, () -> {
      Raster raster = rasters.get(id);
      if (raster == null) {
        throw new NoSuchElementException("Raster not found: " + id);
      }
      return raster;
    });
  }

  @Override
  public void put(String id, Raster raster) {
    Raster keyed = id.equals(raster.id()) ? raster : raster.withId(id);
    locks.withLock(id, () -> {
      rasters.put(id, keyed);
    });
  }

  @Override
  public Raster update(String id, UnaryOperator<Raster> change) {
    return locks.withLock(id, () -> {
      Raster replacement = change.apply(get(id));
      put(id, replacement);
      return rasters.get(id);
    });
  }

  @Override
  public boolean delete(String id) {
    return locks.withLock(id, () -> rasters.remove(id) != null);
  }

  @Override
  public boolean exists(String id) {
    return rasters.containsKey(id);
  }

  public Set<String> ids() {
    return Set.copyOf(rasters.keySet());
  }
}
