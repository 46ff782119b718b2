package com.ospicorp.precorsia.raster;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

// Striped locks shared by the store implementations; equal ids always map to the same stripe
final class KeyedLocks {
  static final int DEFAULT_STRIPES = 64;

  private final ReentrantLock[] stripes;

  KeyedLocks() {
    this(DEFAULT_STRIPES);
  }

  KeyedLocks(int stripeCount) {
    if (stripeCount < 1) {
      throw new IllegalArgumentException("stripe count must be positive");
    }
    stripes = new ReentrantLock[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  <T> T withLock(String key, Supplier<T> action) {
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  void withLock(String key, Runnable action) {
    withLock(key, () -> {
      action.run();
      return null;
    });
  }

  ReentrantLock lockFor(String key) {
    return stripes[Math.floorMod(key.hashCode(), stripes.length)];
  }

  int stripeCount() {
    return stripes.length;
  }
}
