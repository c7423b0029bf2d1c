// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.util.Objects;

/// The gradient magnitude of one section as returned by a worker.
public record ResultSection(SectionInfo info, RasterImage pixels) {
  public ResultSection {
    Objects.requireNonNull(info, "info cannot be null");
    Objects.requireNonNull(pixels, "pixels cannot be null");
    if (pixels.width() != info.width() || pixels.height() != info.numRows()) {
      throw new DataException("Result declared %dx%d but pixels are %dx%d".formatted(
          info.width(), info.numRows(), pixels.width(), pixels.height()), info.sectionId(), null);
    }
  }

  public int sectionId() {
    return info.sectionId();
  }
}
