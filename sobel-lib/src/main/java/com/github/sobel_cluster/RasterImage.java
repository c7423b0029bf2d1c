// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.util.Arrays;
import java.util.zip.CRC32;

/// An 8-bit single channel image held as row-major samples.
///
/// The canonical constructor takes ownership of the array it is given. The accessor hands out a copy so that
/// nothing outside the record can mutate the samples once the image exists. Sections are always extracted as
/// independent copies.
///
/// @param width  pixels per row
/// @param height number of rows
/// @param pixels `width * height` unsigned samples
public record RasterImage(int width, int height, byte[] pixels) {

  /// Computes the sample for a pixel when generating an image.
  @FunctionalInterface
  public interface PixelFunction {
    int valueAt(int x, int y);
  }

  public RasterImage {
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException("Image dimensions must be positive: %dx%d".formatted(width, height));
    }
    if (pixels == null) {
      throw new IllegalArgumentException("pixels cannot be null");
    }
    if ((long) width * height != pixels.length) {
      throw new IllegalArgumentException("Expected %d pixels for %dx%d but got %d"
          .formatted((long) width * height, width, height, pixels.length));
    }
  }

  /// Builds an image by evaluating `function` at every pixel. Values are clamped to 0-255.
  public static RasterImage generate(int width, int height, PixelFunction function) {
    final var data = new byte[width * height];
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        data[y * width + x] = (byte) Math.max(0, Math.min(255, function.valueAt(x, y)));
      }
    }
    return new RasterImage(width, height, data);
  }

  public static RasterImage filled(int width, int height, int value) {
    return generate(width, height, (x, y) -> value);
  }

  /// A copy of the samples.
  @Override
  public byte[] pixels() {
    return pixels.clone();
  }

  /// The unsigned sample at column `x` of row `y`.
  public int sample(int x, int y) {
    return pixels[y * width + x] & 0xFF;
  }

  public byte[] row(int y) {
    checkRow(y);
    return Arrays.copyOfRange(pixels, y * width, (y + 1) * width);
  }

  /// Copies the rows of a section into a new image of `section.numRows()` rows.
  public RasterImage extractSection(SectionInfo section) {
    if (section.width() != width) {
      throw new IllegalArgumentException("Section width %d does not match image width %d"
          .formatted(section.width(), width));
    }
    if (section.endRow() > height) {
      throw new IllegalArgumentException("Section %s exceeds image height %d".formatted(section, height));
    }
    final var from = section.startRow() * width;
    return new RasterImage(width, section.numRows(),
        Arrays.copyOfRange(pixels, from, from + section.pixelCount()));
  }

  /// Copies every row of this image into `target` starting at row `targetRow` of an image that is `width` wide.
  public void copyRowsInto(byte[] target, int targetRow) {
    System.arraycopy(pixels, 0, target, targetRow * width, pixels.length);
  }

  private void checkRow(int y) {
    if (y < 0 || y >= height) {
      throw new IndexOutOfBoundsException("row " + y + " outside 0-" + (height - 1));
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    RasterImage that = (RasterImage) other;
    return width == that.width && height == that.height && Arrays.equals(pixels, that.pixels);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + height) + Arrays.hashCode(pixels);
  }

  @Override
  public String toString() {
    CRC32 crc32 = new CRC32();
    crc32.update(pixels);
    return String.format("RasterImage[%dx%d, pixels=byte[%d]:CRC32=%d]", width, height, pixels.length,
        crc32.getValue());
  }
}
