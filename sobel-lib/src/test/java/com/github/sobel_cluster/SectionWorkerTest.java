// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import com.github.sobel_cluster.transport.Channel;
import com.github.sobel_cluster.transport.InMemoryCluster;
import com.github.sobel_cluster.transport.Pickler;
import com.github.sobel_cluster.transport.Rank;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.github.sobel_cluster.transport.SectionChannel.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SectionWorkerTest {
  static final Rank WORKER = Rank.of(1);

  InMemoryCluster cluster;
  ConvolutionEngine engine;

  @BeforeEach
  void setup() {
    cluster = new InMemoryCluster(2);
    engine = new ConvolutionEngine(2);
  }

  @AfterEach
  void tearDown() {
    cluster.close();
    engine.close();
  }

  void sendTask(SectionInfo info, RasterImage pixels) {
    final var coordinator = cluster.coordinator();
    coordinator.send(WORKER, KERNEL, Kernel.SOBEL);
    coordinator.send(WORKER, SECTION_INFO, info);
    coordinator.send(WORKER, IMAGE_SECTION, pixels);
  }

  @Test
  void answersWithInfoThenConvolvedPixels() {
    final var info = new SectionInfo(0, 0, 8, 8);
    final var pixels = RasterImage.generate(8, 8, (x, y) -> x > 3 ? 200 : 10);
    sendTask(info, pixels);

    new SectionWorker(cluster.member(WORKER), engine).serveOnce();

    final SectionInfo replyInfo = cluster.coordinator().receive(WORKER, RESULT_INFO);
    final RasterImage replyPixels = cluster.coordinator().receive(WORKER, RESULT_SECTION);
    assertThat(replyInfo).isEqualTo(info);
    assertThat(replyPixels).isEqualTo(engine.convolve(pixels, Kernel.SOBEL));
  }

  @Test
  void pixelsThatDisagreeWithTheInfoAreADataError() {
    sendTask(new SectionInfo(0, 0, 4, 8), RasterImage.filled(8, 3, 0));

    assertThatThrownBy(() -> new SectionWorker(cluster.member(WORKER), engine).receiveTask())
        .isInstanceOfSatisfying(DataException.class, e -> assertThat(e.sectionId()).hasValue(0));
  }

  @Test
  void serveStopsWhenTheCoordinatorGoesAway() throws Exception {
    final var worker = new SectionWorker(cluster.member(WORKER), engine);
    final var served = CompletableFuture.supplyAsync(worker::serve);

    sendTask(new SectionInfo(0, 0, 3, 3), RasterImage.filled(3, 3, 1));
    sendTask(new SectionInfo(0, 0, 3, 3), RasterImage.filled(3, 3, 2));
    cluster.coordinator().receive(WORKER, RESULT_SECTION);
    cluster.coordinator().receive(WORKER, RESULT_SECTION);
    cluster.coordinator().close();

    assertThat(served.get(5, TimeUnit.SECONDS)).isEqualTo(2);
  }

  @Test
  void undecodableTaskClosesTheWorkerInsteadOfLookingLikeAGoodbye() {
    final Pickler<byte[]> garbled = new Pickler<>() {
      @Override
      public void serialize(byte[] object, ByteBuffer buffer) {
        buffer.put(object);
      }

      @Override
      public byte[] deserialize(ByteBuffer buffer) {
        throw new IllegalArgumentException("cannot decode");
      }

      @Override
      public int sizeOf(byte[] value) {
        return value.length;
      }
    };
    try (var broken = new InMemoryCluster(2, Map.<Channel, Pickler<?>>of(KERNEL.value(), garbled))) {
      broken.coordinator().send(WORKER, KERNEL, new byte[]{7, 7, 7});
      final var worker = new SectionWorker(broken.member(WORKER), engine);

      assertThatThrownBy(worker::serve)
          .isInstanceOfSatisfying(TransportException.class, e -> {
            assertThat(e.rank()).hasValue(0);
            assertThat(e.isPeerLost()).isFalse();
          })
          .hasMessageContaining("cannot decode");
      assertThat(broken.member(WORKER).isOpen()).isFalse();
      assertThatThrownBy(() -> broken.coordinator().receive(WORKER, KERNEL))
          .isInstanceOfSatisfying(TransportException.class, e -> assertThat(e.isPeerLost()).isTrue());
    }
  }

  @Test
  void coordinatorRankCannotServe() {
    assertThatThrownBy(() -> new SectionWorker(cluster.coordinator(), engine))
        .isInstanceOf(ConfigurationException.class);
  }
}
