// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import com.github.sobel_cluster.Kernel;
import com.github.sobel_cluster.RasterImage;
import com.github.sobel_cluster.SectionInfo;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SectionPicklersTest {

  @Test
  void kernel() {
    final var kernel = new Kernel(
        new float[]{0.5f, -1, 0, 2, 0, -2, 1, 0, -0.5f},
        new float[]{1, 1, 1, 0, 0, 0, -1, -1, -1});
    final byte[] bytes = SectionPicklers.KERNEL_PICKLER.serialize(kernel);
    assertThat(bytes).hasSize(72);
    assertThat(SectionPicklers.KERNEL_PICKLER.deserialize(bytes)).isEqualTo(kernel);
  }

  @Test
  void sectionInfoIsFourBigEndianInts() {
    final var info = new SectionInfo(3, 300, 75, 640);
    final byte[] bytes = SectionPicklers.SECTION_INFO_PICKLER.serialize(info);
    final var buffer = ByteBuffer.wrap(bytes);
    assertThat(buffer.getInt()).isEqualTo(3);
    assertThat(buffer.getInt()).isEqualTo(300);
    assertThat(buffer.getInt()).isEqualTo(75);
    assertThat(buffer.getInt()).isEqualTo(640);
    assertThat(SectionPicklers.SECTION_INFO_PICKLER.deserialize(bytes)).isEqualTo(info);
  }

  @Test
  void raster() {
    final var image = RasterImage.generate(9, 4, (x, y) -> x * y * 7);
    final byte[] bytes = SectionPicklers.RASTER_PICKLER.serialize(image);
    assertThat(bytes).hasSize(8 + 36);
    assertThat(SectionPicklers.RASTER_PICKLER.deserialize(bytes)).isEqualTo(image);
  }

  @Test
  void truncatedRasterIsRejected() {
    final var bytes = ByteBuffer.allocate(8 + 10).putInt(4).putInt(4).array();
    assertThatThrownBy(() -> SectionPicklers.RASTER_PICKLER.deserialize(bytes))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("16 samples");
  }

  @Test
  void everyApplicationChannelHasAPickler() {
    assertThat(SectionPicklers.protocol().keySet())
        .containsExactlyInAnyOrderElementsOf(SectionChannel.applicationChannels());
  }
}
