// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import com.github.sobel_cluster.Kernel;
import com.github.sobel_cluster.RasterImage;
import com.github.sobel_cluster.SectionInfo;

import java.nio.ByteBuffer;
import java.util.Map;

import static com.github.sobel_cluster.transport.SectionChannel.*;

/// Wire formats of the protocol messages. All integers are big-endian.
///
/// ```
/// Kernel (72 bytes):      gx: 9 x float32, gy: 9 x float32
/// SectionInfo (16 bytes): sectionId, startRow, numRows, width: 4 x int32
/// RasterImage:            width: int32, height: int32, samples: width * height bytes
/// ```
public final class SectionPicklers {

  private SectionPicklers() {
  }

  public static final Pickler<Kernel> KERNEL_PICKLER = new Pickler<>() {
    @Override
    public void serialize(Kernel kernel, ByteBuffer buffer) {
      for (float w : kernel.gx()) {
        buffer.putFloat(w);
      }
      for (float w : kernel.gy()) {
        buffer.putFloat(w);
      }
    }

    @Override
    public Kernel deserialize(ByteBuffer buffer) {
      final var gx = new float[Kernel.WEIGHTS];
      final var gy = new float[Kernel.WEIGHTS];
      for (int i = 0; i < Kernel.WEIGHTS; i++) {
        gx[i] = buffer.getFloat();
      }
      for (int i = 0; i < Kernel.WEIGHTS; i++) {
        gy[i] = buffer.getFloat();
      }
      return new Kernel(gx, gy);
    }

    @Override
    public int sizeOf(Kernel value) {
      return 2 * Kernel.WEIGHTS * Float.BYTES;
    }
  };

  public static final Pickler<SectionInfo> SECTION_INFO_PICKLER = new Pickler<>() {
    @Override
    public void serialize(SectionInfo info, ByteBuffer buffer) {
      buffer.putInt(info.sectionId());
      buffer.putInt(info.startRow());
      buffer.putInt(info.numRows());
      buffer.putInt(info.width());
    }

    @Override
    public SectionInfo deserialize(ByteBuffer buffer) {
      return new SectionInfo(buffer.getInt(), buffer.getInt(), buffer.getInt(), buffer.getInt());
    }

    @Override
    public int sizeOf(SectionInfo value) {
      return 4 * Integer.BYTES;
    }
  };

  public static final Pickler<RasterImage> RASTER_PICKLER = new Pickler<>() {
    @Override
    public void serialize(RasterImage image, ByteBuffer buffer) {
      buffer.putInt(image.width());
      buffer.putInt(image.height());
      buffer.put(image.pixels());
    }

    @Override
    public RasterImage deserialize(ByteBuffer buffer) {
      final int width = buffer.getInt();
      final int height = buffer.getInt();
      if (width < 1 || height < 1) {
        throw new IllegalArgumentException("Invalid image header %dx%d".formatted(width, height));
      }
      final long expected = (long) width * height;
      if (expected > buffer.remaining()) {
        throw new IllegalArgumentException("Image header declares %d samples but only %d bytes follow"
            .formatted(expected, buffer.remaining()));
      }
      final var samples = new byte[(int) expected];
      buffer.get(samples);
      return new RasterImage(width, height, samples);
    }

    @Override
    public int sizeOf(RasterImage value) {
      return 2 * Integer.BYTES + value.width() * value.height();
    }
  };

  /// The pickler for each application channel of the protocol.
  public static Map<Channel, Pickler<?>> protocol() {
    return Map.of(
        KERNEL.value(), KERNEL_PICKLER,
        SECTION_INFO.value(), SECTION_INFO_PICKLER,
        IMAGE_SECTION.value(), RASTER_PICKLER,
        RESULT_INFO.value(), SECTION_INFO_PICKLER,
        RESULT_SECTION.value(), RASTER_PICKLER);
  }
}
