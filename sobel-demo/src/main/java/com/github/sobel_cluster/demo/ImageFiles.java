// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.demo;

import com.github.sobel_cluster.DataException;
import com.github.sobel_cluster.RasterImage;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static java.util.logging.Level.FINE;

/// Reads and writes image files with `javax.imageio`. Colour images are reduced to luma with the ITU-R BT.601
/// weights.
public final class ImageFiles {
  private ImageFiles() {
  }

  /// @throws DataException if the file is missing or not an image ImageIO can decode
  public static RasterImage load(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new DataException("No image file at " + path);
    }
    final BufferedImage image;
    try {
      image = ImageIO.read(path.toFile());
    } catch (IOException e) {
      throw new DataException("Cannot read " + path + ": " + e.getMessage(), e);
    }
    if (image == null) {
      throw new DataException("Unsupported image format: " + path);
    }
    final var raster = toGray(image);
    DemoLogger.LOGGER.log(FINE, () -> "Loaded " + path + " as " + raster);
    return raster;
  }

  public static RasterImage toGray(BufferedImage image) {
    final int width = image.getWidth();
    final int height = image.getHeight();
    final var samples = new byte[width * height];
    if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
      image.getRaster().getDataElements(0, 0, width, height, samples);
      return new RasterImage(width, height, samples);
    }
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        samples[y * width + x] = (byte) luma(image.getRGB(x, y));
      }
    }
    return new RasterImage(width, height, samples);
  }

  static int luma(int rgb) {
    final int r = (rgb >> 16) & 0xFF;
    final int g = (rgb >> 8) & 0xFF;
    final int b = rgb & 0xFF;
    return (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
  }

  public static BufferedImage toBufferedImage(RasterImage raster) {
    final var image = new BufferedImage(raster.width(), raster.height(), BufferedImage.TYPE_BYTE_GRAY);
    image.getRaster().setDataElements(0, 0, raster.width(), raster.height(), raster.pixels());
    return image;
  }

  /// Writes in the format named by the file extension, PNG when there is none.
  public static void save(RasterImage raster, Path path) {
    final var format = formatOf(path);
    try {
      final var parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      if (!ImageIO.write(toBufferedImage(raster), format, path.toFile())) {
        throw new DataException("No ImageIO writer for format " + format);
      }
    } catch (IOException e) {
      throw new DataException("Cannot write " + path + ": " + e.getMessage(), e);
    }
    DemoLogger.LOGGER.log(FINE, () -> "Wrote " + raster + " to " + path);
  }

  static String formatOf(Path path) {
    final var name = path.getFileName().toString();
    final int dot = name.lastIndexOf('.');
    if (dot < 0 || dot == name.length() - 1) {
      return "png";
    }
    final var extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
    return extension.equals("jpeg") ? "jpg" : extension;
  }
}
