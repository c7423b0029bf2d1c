// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/// Run settings.
///
/// @param workerThreads  size of the local pool each worker uses to shard its rows
/// @param kernelPath     optional properties file holding the masks, see [KernelResolver]
/// @param collectTimeout optional bound on how long the coordinator waits for each reply. Empty means wait forever
///                       which is the historical behaviour.
public record ClusterConfig(int workerThreads, Optional<Path> kernelPath, Optional<Duration> collectTimeout) {

  public static final String WORKER_THREADS = "sobel.workerThreads";
  public static final String KERNEL = "sobel.kernel";
  public static final String COLLECT_TIMEOUT_MS = "sobel.collectTimeoutMs";

  public ClusterConfig {
    if (workerThreads < 1) {
      throw new IllegalArgumentException("workerThreads must be positive: " + workerThreads);
    }
    if (kernelPath == null || collectTimeout == null) {
      throw new IllegalArgumentException("Use Optional.empty() rather than null");
    }
    collectTimeout.ifPresent(d -> {
      if (d.isNegative() || d.isZero()) {
        throw new IllegalArgumentException("collectTimeout must be positive: " + d);
      }
    });
  }

  public static ClusterConfig defaults() {
    return new ClusterConfig(ConvolutionEngine.defaultParallelism(), Optional.empty(), Optional.empty());
  }

  /// Reads `sobel.*` system properties, falling back to `SOBEL_*` environment variables, then to the defaults.
  public static ClusterConfig fromSystemProperties() {
    return from(key -> Optional.ofNullable(System.getProperty(key))
        .or(() -> Optional.ofNullable(System.getenv(environmentName(key)))));
  }

  static ClusterConfig from(Function<String, Optional<String>> lookup) {
    final var defaults = defaults();
    try {
      final int threads = lookup.apply(WORKER_THREADS)
          .map(String::trim)
          .map(Integer::parseInt)
          .orElse(defaults.workerThreads());
      final Optional<Path> kernel = lookup.apply(KERNEL)
          .filter(s -> !s.isBlank())
          .map(Path::of);
      final Optional<Duration> timeout = lookup.apply(COLLECT_TIMEOUT_MS)
          .map(String::trim)
          .map(Long::parseLong)
          .map(Duration::ofMillis);
      return new ClusterConfig(threads, kernel, timeout);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid cluster configuration: " + e.getMessage(), e);
    }
  }

  /// `sobel.collectTimeoutMs` becomes `SOBEL_COLLECT_TIMEOUT_MS`.
  static String environmentName(String key) {
    return key.replace('.', '_')
        .replaceAll("([a-z])([A-Z])", "$1_$2")
        .toUpperCase();
  }

  public ClusterConfig withWorkerThreads(int threads) {
    return new ClusterConfig(threads, kernelPath, collectTimeout);
  }

  public ClusterConfig withKernelPath(Path path) {
    return new ClusterConfig(workerThreads, Optional.of(path), collectTimeout);
  }

  public ClusterConfig withCollectTimeout(Duration timeout) {
    return new ClusterConfig(workerThreads, kernelPath, Optional.of(timeout));
  }
}
