// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClusterConfigTest {

  static ClusterConfig from(Map<String, String> values) {
    return ClusterConfig.from(key -> Optional.ofNullable(values.get(key)));
  }

  @Test
  void defaultsWaitForever() {
    final var config = ClusterConfig.defaults();
    assertThat(config.workerThreads()).isEqualTo(ConvolutionEngine.defaultParallelism());
    assertThat(config.kernelPath()).isEmpty();
    assertThat(config.collectTimeout()).isEmpty();
    assertThat(from(Map.of())).isEqualTo(config);
  }

  @Test
  void readsEverySetting() {
    final var config = from(Map.of(
        ClusterConfig.WORKER_THREADS, " 3 ",
        ClusterConfig.KERNEL, "/etc/sobel/kernel.properties",
        ClusterConfig.COLLECT_TIMEOUT_MS, "2500"));

    assertThat(config.workerThreads()).isEqualTo(3);
    assertThat(config.kernelPath()).contains(Path.of("/etc/sobel/kernel.properties"));
    assertThat(config.collectTimeout()).contains(Duration.ofMillis(2500));
  }

  @Test
  void invalidSettingsAreConfigurationErrors() {
    assertThatThrownBy(() -> from(Map.of(ClusterConfig.WORKER_THREADS, "many")))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> from(Map.of(ClusterConfig.WORKER_THREADS, "0")))
        .isInstanceOf(ConfigurationException.class);
    assertThatThrownBy(() -> from(Map.of(ClusterConfig.COLLECT_TIMEOUT_MS, "-1")))
        .isInstanceOf(ConfigurationException.class);
  }

  @Test
  void environmentNames() {
    assertThat(ClusterConfig.environmentName(ClusterConfig.WORKER_THREADS)).isEqualTo("SOBEL_WORKER_THREADS");
    assertThat(ClusterConfig.environmentName(ClusterConfig.KERNEL)).isEqualTo("SOBEL_KERNEL");
    assertThat(ClusterConfig.environmentName(ClusterConfig.COLLECT_TIMEOUT_MS))
        .isEqualTo("SOBEL_COLLECT_TIMEOUT_MS");
  }

  @Test
  void withersReplaceOneSetting() {
    final var config = ClusterConfig.defaults().withWorkerThreads(2).withCollectTimeout(Duration.ofSeconds(1));
    assertThat(config.workerThreads()).isEqualTo(2);
    assertThat(config.collectTimeout()).contains(Duration.ofSeconds(1));
    assertThat(config.kernelPath()).isEmpty();
  }
}
