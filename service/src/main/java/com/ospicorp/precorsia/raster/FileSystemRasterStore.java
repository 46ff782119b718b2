package com.ospicorp.precorsia.raster;

import com.ospicorp.precorsia.correlation.service.MalformedRasterException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.NoSuchElementException;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps each raster as {@code <id>.png} inside a buffer directory. Writes go to a temporary
 * file first and are moved into place, so readers never see a partial PNG.
 */
public class FileSystemRasterStore implements RasterStore {
  private static final Logger log = LoggerFactory.getLogger(FileSystemRasterStore.class);
  private static final String EXTENSION = ".png";

  private final Path directory;
  private final KeyedLocks locks = new KeyedLocks();

  public FileSystemRasterStore(Path directory) {
    this.directory = directory;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create raster directory " + directory, e);
    }
    log.info("Raster buffer directory: {}", directory.toAbsolutePath());
  }

  @Override
  public Raster get(String id) {
    Path file = pathFor(id);
    return locks.withLock(id, () -> {
      if (!Files.isRegularFile(file)) {
        throw new NoSuchElementException("Raster not found: " + id);
      }
      try (InputStream in = Files.newInputStream(file)) {
        return PngRasterCodec.decode(id, in);
      } catch (IOException e) {
        throw new MalformedRasterException("Unable to read raster " + id + " from " + file, e);
      }
    });
  }

  @Override
  public void put(String id, Raster raster) {
    Path file = pathFor(id);
    locks.withLock(id, () -> {
      Path tmp = null;
      try {
        tmp = Files.createTempFile(directory, ".raster-", ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp)) {
          PngRasterCodec.encode(raster, out);
        }
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (IOException e) {
        deleteQuietly(tmp);
        throw new UncheckedIOException("Unable to write raster " + id + " to " + file, e);
      }
    });
  }

  @Override
  public Raster update(String id, UnaryOperator<Raster> change) {
    return locks.withLock(id, () -> {
      Raster replacement = change.apply(get(id));
      put(id, replacement);
      return replacement.id().equals(id) ? replacement : replacement.withId(id);
    });
  }

  @Override
  public boolean delete(String id) {
    Path file = pathFor(id);
    return locks.withLock(id, () -> {
      try {
        return Files.deleteIfExists(file);
      } catch (IOException e) {
        throw new UncheckedIOException("Unable to delete raster " + id, e);
      }
    });
  }

  @Override
  public boolean exists(String id) {
    return Files.isRegularFile(pathFor(id));
  }

  public Path directory() {
    return directory;
  }

  Path pathFor(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("raster id must be provided");
    }
    // catalog ids look like "2019_01_01" or "LC08/C02/T1/..."; percent-encoding keeps them
    // inside the buffer and keeps distinct ids on distinct files
    String fileName = URLEncoder.encode(id, StandardCharsets.UTF_8);
    if (fileName.equals(".") || fileName.equals("..")) {
      throw new IllegalArgumentException("Invalid raster id: " + id);
    }
    return directory.resolve(fileName + EXTENSION);
  }

  private void deleteQuietly(Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException suppressed) {
      log.warn("Unable to remove temporary raster file {}: {}", tmp, suppressed.getMessage());
    }
  }
}
