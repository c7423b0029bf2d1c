// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

/// The output image cannot be assembled because a section is missing, duplicated or out of range.
public class ReconstructionException extends ClusterException {
  public ReconstructionException(String message) {
    super(message, null, null, null);
  }

  public ReconstructionException(String message, int sectionId) {
    super(message, sectionId, null, null);
  }

  public ReconstructionException(String message, Integer sectionId, Integer rank, Throwable cause) {
    super(message, sectionId, rank, cause);
  }
}
