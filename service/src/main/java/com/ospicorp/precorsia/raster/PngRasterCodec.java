package com.ospicorp.precorsia.raster;

import com.ospicorp.precorsia.correlation.service.MalformedRasterException;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import javax.imageio.ImageIO;

/**
 * Reads any image format ImageIO understands into an 8-bit grayscale raster and writes
 * rasters back as grayscale PNG.
 */
public final class PngRasterCodec {
  private PngRasterCodec() {
  }

  public static Raster decode(String id, InputStream in) throws IOException {
    BufferedImage image = ImageIO.read(in);
    if (image == null) {
      throw new MalformedRasterException("Unsupported or corrupt image for raster " + id);
    }
    int width = image.getWidth();
    int height = image.getHeight();
    int[] samples;
    try {
      samples = new int[Math.multiplyExact(width, height)];
    } catch (ArithmeticException e) {
      throw new MalformedRasterException("Raster " + id + " is too large: " + width + "x"
          + height, e);
    }
    if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
      image.getRaster().getSamples(0, 0, width, height, 0, samples);
      return new Raster(id, width, height, samples);
    }
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        samples[y * width + x] = luminance(image.getRGB(x, y));
      }
    }
    return new Raster(id, width, height, samples);
  }

  public static Raster decode(String id, byte[] bytes) {
    try {
      return decode(id, new ByteArrayInputStream(bytes));
    } catch (IOException e) {
      throw new MalformedRasterException("Unable to read raster " + id, e);
    }
  }

  public static void encode(Raster raster, OutputStream out) throws IOException {
    if (raster.sampleCount() == 0) {
      throw new MalformedRasterException("Cannot encode empty raster " + raster.id());
    }
    BufferedImage image = new BufferedImage(raster.width(), raster.height(),
        BufferedImage.TYPE_BYTE_GRAY);
    WritableRaster target = image.getRaster();
    target.setSamples(0, 0, raster.width(), raster.height(), 0, raster.samples());
    if (!ImageIO.write(image, "png", out)) {
      throw new IOException("No PNG writer available");
    }
  }

  public static byte[] encode(Raster raster) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      encode(raster, out);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to encode raster " + raster.id(), e);
    }
    return out.toByteArray();
  }

  // ITU-R 601-2 luma transform, integer form
  static int luminance(int argb) {
    int r = (argb >> 16) & 0xff;
    int g = (argb >> 8) & 0xff;
    int b = argb & 0xff;
    return (r * 299 + g * 587 + b * 114) / 1000;
  }
}
