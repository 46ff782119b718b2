package com.ospicorp.precorsia.raster;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.precorsia.correlation.service.MalformedRasterException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemRasterStoreTest {

  @TempDir
  Path dir;

  private FileSystemRasterStore store;

  @BeforeEach
  void setUp() {
    store = new FileSystemRasterStore(dir.resolve("buffer"));
  }

  @Test
  void putWritesPngThatGetReadsBack() {
    Raster raster = new Raster("2019_01_01", 2, 2, new int[] {0, 10, 200, 255});

    store.put("2019_01_01", raster);

    assertTrue(Files.isRegularFile(dir.resolve("buffer").resolve("2019_01_01.png")));
    assertTrue(store.exists("2019_01_01"));
    assertEquals(raster, store.get("2019_01_01"));
  }

  @Test
  void putReplacesExistingRaster() {
    store.put("r", new Raster("r", 2, 1, new int[] {0, 0}));
    store.put("r", new Raster("r", 2, 1, new int[] {9, 9}));

    assertArrayEquals(new int[] {9, 9}, store.get("r").samples());
  }

  @Test
  void catalogIdsStayInsideTheBuffer() {
    store.put("LC08/C02/T1/x", new Raster("LC08/C02/T1/x", 1, 1, new int[] {7}));

    assertTrue(Files.isRegularFile(dir.resolve("buffer").resolve("LC08%2FC02%2FT1%2Fx.png")));
    assertEquals(7, store.get("LC08/C02/T1/x").sample(0, 0));
  }

  @Test
  void idsDifferingOnlyBySeparatorUseSeparateFiles() {
    store.put("a/b", new Raster("a/b", 1, 1, new int[] {1}));
    store.put("a_b", new Raster("a_b", 1, 1, new int[] {2}));

    assertTrue(store.delete("a_b"));
    assertTrue(store.exists("a/b"));
    assertEquals(1, store.get("a/b").sample(0, 0));
  }

  @Test
  void updateRewritesTheStoredRaster() {
    store.put("u", new Raster("u", 2, 1, new int[] {0, 4}));

    Raster updated = store.update("u", r -> r.withSamples(new int[] {3, 4}));

    assertArrayEquals(new int[] {3, 4}, updated.samples());
    assertArrayEquals(new int[] {3, 4}, store.get("u").samples());
    assertThrows(NoSuchElementException.class, () -> store.update("none", r -> r));
  }

  @Test
  void deleteReportsWhetherAFileWasRemoved() {
    store.put("d", new Raster("d", 1, 1, new int[] {1}));

    assertTrue(store.delete("d"));
    assertFalse(store.delete("d"));
    assertFalse(store.exists("d"));
  }

  @Test
  void missingRasterIsNoSuchElement() {
    assertThrows(NoSuchElementException.class, () -> store.get("absent"));
  }

  @Test
  void corruptFileIsMalformed() throws Exception {
    Files.write(dir.resolve("buffer").resolve("bad.png"), new byte[] {0, 1, 2});

    assertThrows(MalformedRasterException.class, () -> store.get("bad"));
  }

  @Test
  void dotIdsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> store.get(".."));
    assertThrows(IllegalArgumentException.class, () -> store.get(" "));
  }
}
