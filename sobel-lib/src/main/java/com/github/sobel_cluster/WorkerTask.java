// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.util.Objects;

/// Everything a worker needs to process one section. Built once per worker per run from the three dispatch
/// messages and consumed exactly once.
public record WorkerTask(SectionInfo info, RasterImage pixels, Kernel kernel) {
  public WorkerTask {
    Objects.requireNonNull(info, "info cannot be null");
    Objects.requireNonNull(pixels, "pixels cannot be null");
    Objects.requireNonNull(kernel, "kernel cannot be null");
    if (pixels.width() != info.width() || pixels.height() != info.numRows()) {
      throw new DataException("Section declared %dx%d but pixels are %dx%d".formatted(
          info.width(), info.numRows(), pixels.width(), pixels.height()), info.sectionId(), null);
    }
  }
}
