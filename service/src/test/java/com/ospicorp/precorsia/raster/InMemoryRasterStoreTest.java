package com.ospicorp.precorsia.raster;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryRasterStoreTest {

  @Test
  void putKeysRasterUnderTheGivenId() {
    InMemoryRasterStore store = new InMemoryRasterStore();

    store.put("b", new Raster("a", 1, 1, new int[] {3}));

    assertEquals("b", store.get("b").id());
    assertEquals(Set.of("b"), store.ids());
    assertThrows(NoSuchElementException.class, () -> store.get("a"));
  }

  @Test
  void updateAppliesChangeToStoredRaster() {
    InMemoryRasterStore store = new InMemoryRasterStore();
    store.put("u", new Raster("u", 1, 1, new int[] {0}));

    store.update("u", r -> r.withSamples(new int[] {12}));

    assertEquals(12, store.get("u").sample(0, 0));
    assertThrows(NoSuchElementException.class, () -> store.update("absent", r -> r));
  }

  @Test
  void concurrentWritersNeverLeaveAPartialRaster() throws Exception {
    InMemoryRasterStore store = new InMemoryRasterStore();
    store.put("shared", new Raster("shared", 2, 1, new int[] {1, 1}));
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        int value = 1 + i;
        futures.add(pool.submit(() -> {
          store.put("shared", new Raster("shared", 2, 1, new int[] {value, value}));
          int[] seen = store.get("shared").samples();
          assertEquals(seen[0], seen[1]);
        }));
      }
      for (Future<?> f : futures) {
        f.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
  }
}
