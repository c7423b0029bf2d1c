// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.demo;

import com.github.sobel_cluster.ConvolutionEngine;
import com.github.sobel_cluster.Kernel;
import com.github.sobel_cluster.PartitionPlanner;
import com.github.sobel_cluster.RasterImage;
import com.github.sobel_cluster.ResultSection;
import com.github.sobel_cluster.SeamReconstructor;
import com.github.sobel_cluster.SectionInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SobelClusterCliTest {

  @TempDir
  Path dir;

  final ByteArrayOutputStream out = new ByteArrayOutputStream();
  final ByteArrayOutputStream err = new ByteArrayOutputStream();
  Path input;
  RasterImage image;

  @BeforeEach
  void writeInput() {
    image = RasterImage.generate(40, 30, (x, y) -> (x - 20) * (x - 20) + (y - 15) * (y - 15) < 100 ? 220 : 30);
    input = dir.resolve("disc.png");
    ImageFiles.save(image, input);
  }

  int run(String... args) {
    return SobelClusterCli.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  String stderr() {
    return err.toString(StandardCharsets.UTF_8);
  }

  @Test
  void localRunWritesTheEdgeMap() {
    final var output = dir.resolve("edges.png");

    assertThat(run(input.toString(), "--workers", "3", "--output", output.toString()))
        .isEqualTo(SobelClusterCli.EXIT_OK);

    assertThat(ImageFiles.load(output)).isEqualTo(reference(image, 3, Kernel.SOBEL));
  }

  @Test
  void customKernelIsUsed() throws IOException {
    final var kernel = dir.resolve("prewitt.properties");
    Files.writeString(kernel, "kernel.gx=-1,0,1,-1,0,1,-1,0,1\nkernel.gy=-1,-1,-1,0,0,0,1,1,1\n");
    final var output = dir.resolve("prewitt.png");

    assertThat(run(input.toString(), "--workers", "2", "--kernel", kernel.toString(), "--output", output.toString()))
        .isEqualTo(SobelClusterCli.EXIT_OK);

    final var prewitt = new Kernel(
        new float[]{-1, 0, 1, -1, 0, 1, -1, 0, 1},
        new float[]{-1, -1, -1, 0, 0, 0, 1, 1, 1});
    assertThat(ImageFiles.load(output)).isEqualTo(reference(image, 2, prewitt));
  }

  @Test
  void zeroWorkersFails() {
    assertThat(run(input.toString(), "--workers", "0", "--output", dir.resolve("x.png").toString()))
        .isEqualTo(SobelClusterCli.EXIT_FAILED);
    assertThat(stderr()).contains("ConfigurationException");
    assertThat(dir.resolve("x.png")).doesNotExist();
  }

  @Test
  void unreadableImageFails() {
    assertThat(run(dir.resolve("missing.png").toString())).isEqualTo(SobelClusterCli.EXIT_FAILED);
    assertThat(stderr()).contains("DataException");
  }

  @Test
  void usageErrors() {
    assertThat(run()).isEqualTo(SobelClusterCli.EXIT_USAGE);
    assertThat(run(input.toString(), "--workers", "many")).isEqualTo(SobelClusterCli.EXIT_USAGE);
    assertThat(run("--join", "nowhere")).isEqualTo(SobelClusterCli.EXIT_USAGE);
    assertThat(stderr()).contains("Usage");
  }

  @Test
  void help() {
    assertThat(run("--help")).isEqualTo(SobelClusterCli.EXIT_OK);
    assertThat(out.toString(StandardCharsets.UTF_8)).contains("--workers");
  }

  static RasterImage reference(RasterImage image, int workers, Kernel kernel) {
    final var plan = PartitionPlanner.plan(image.height(), image.width(), workers);
    final List<ResultSection> results = new ArrayList<>();
    try (var engine = new ConvolutionEngine(1)) {
      for (SectionInfo info : plan) {
        results.add(new ResultSection(info, engine.convolve(image.extractSection(info), kernel)));
      }
    }
    return SeamReconstructor.reconstruct(results, plan, image.width(), image.height());
  }
}
