// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;

import static com.github.sobel_cluster.ClusterLogger.LOGGER;

/// Resolves the kernel for a run. The coordinator calls this once before dispatch and passes the immutable result
/// to every worker task.
///
/// An external kernel is a properties file with two keys each holding nine comma separated weights in row-major
/// order:
///
/// ```
/// kernel.gx=-1,0,1,-2,0,2,-1,0,1
/// kernel.gy=-1,-2,-1,0,0,0,1,2,1
/// ```
///
/// A missing or unparsable file logs a warning and falls back to [Kernel#SOBEL].
public final class KernelResolver {
  public static final String GX_KEY = "kernel.gx";
  public static final String GY_KEY = "kernel.gy";

  private KernelResolver() {
  }

  public static Kernel resolve(Optional<Path> source) {
    if (source.isEmpty()) {
      LOGGER.fine(() -> "No kernel configured, using Sobel");
      return Kernel.SOBEL;
    }
    final var path = source.get();
    final var properties = new Properties();
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      properties.load(reader);
    } catch (IOException e) {
      LOGGER.warning(() -> "Cannot read kernel file " + path + ", falling back to Sobel: " + e.getMessage());
      return Kernel.SOBEL;
    }
    try {
      final var kernel = parse(properties);
      LOGGER.info(() -> "Loaded kernel from " + path + ": " + kernel);
      return kernel;
    } catch (IllegalArgumentException e) {
      LOGGER.warning(() -> "Invalid kernel in " + path + ", falling back to Sobel: " + e.getMessage());
      return Kernel.SOBEL;
    }
  }

  /// Parses both masks from `properties`.
  ///
  /// @throws IllegalArgumentException if a key is missing or does not hold nine numbers
  public static Kernel parse(Properties properties) {
    return new Kernel(weights(properties, GX_KEY), weights(properties, GY_KEY));
  }

  static float[] weights(Properties properties, String key) {
    final var value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing " + key);
    }
    final var parts = value.trim().split("\\s*,\\s*");
    if (parts.length != Kernel.WEIGHTS) {
      throw new IllegalArgumentException(key + " needs " + Kernel.WEIGHTS + " weights but has " + parts.length);
    }
    final var result = new float[Kernel.WEIGHTS];
    for (int i = 0; i < parts.length; i++) {
      try {
        result[i] = Float.parseFloat(parts[i]);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(key + " weight " + i + " is not a number: '" + parts[i] + "'", e);
      }
    }
    return result;
  }
}
