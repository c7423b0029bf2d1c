// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

/// The horizontal band of rows assigned to one worker.
///
/// @param sectionId zero based id which is also the index of the section within the plan
/// @param startRow  first row of the band within the full image
/// @param numRows   number of rows in the band
/// @param width     width of every row which is the full image width
public record SectionInfo(int sectionId, int startRow, int numRows, int width) {
  public SectionInfo {
    if (sectionId < 0) {
      throw new IllegalArgumentException("sectionId must be non-negative: " + sectionId);
    }
    if (startRow < 0) {
      throw new IllegalArgumentException("startRow must be non-negative: " + startRow);
    }
    if (numRows < 1) {
      throw new IllegalArgumentException("numRows must be positive: " + numRows);
    }
    if (width < 1) {
      throw new IllegalArgumentException("width must be positive: " + width);
    }
  }

  /// Exclusive end row.
  public int endRow() {
    return startRow + numRows;
  }

  public int lastRow() {
    return endRow() - 1;
  }

  public int pixelCount() {
    return numRows * width;
  }

  @Override
  public String toString() {
    return "SectionInfo[id=%d, rows=%d-%d, width=%d]".formatted(sectionId, startRow, lastRow(), width);
  }
}
