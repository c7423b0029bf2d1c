// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.github.sobel_cluster.ClusterLogger.LOGGER;

/// Splits an image into one contiguous band of rows per worker. Every band gets `height / workers` rows and the
/// last band also takes the `height % workers` left over, so uneven load always lands on the last worker.
public final class PartitionPlanner {

  private PartitionPlanner() {
  }

  /// @return exactly `workers` sections in section id order that tile `[0, height)` once
  /// @throws ConfigurationException if a dimension is not positive, `workers < 1` or `workers > height`
  public static List<SectionInfo> plan(int height, int width, int workers) {
    if (workers < 1) {
      throw new ConfigurationException("At least one worker is required but got " + workers);
    }
    if (height < 1 || width < 1) {
      throw new ConfigurationException("Image dimensions must be positive: %dx%d".formatted(width, height));
    }
    if (workers > height) {
      throw new ConfigurationException("Cannot split %d rows across %d workers".formatted(height, workers));
    }
    final int baseRows = height / workers;
    final int extraRows = height % workers;

    final List<SectionInfo> sections = new ArrayList<>(workers);
    int currentRow = 0;
    for (int i = 0; i < workers; i++) {
      final int rows = i == workers - 1 ? baseRows + extraRows : baseRows;
      final var section = new SectionInfo(i, currentRow, rows, width);
      LOGGER.finer(() -> "Planned " + section);
      sections.add(section);
      currentRow += rows;
    }
    LOGGER.fine(() -> "Planned %d sections of %d rows (last %d) for %dx%d"
        .formatted(workers, baseRows, baseRows + extraRows, width, height));
    return Collections.unmodifiableList(sections);
  }
}
