// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

/// Pixel data that cannot be used: an unreadable image or a section whose pixels disagree with the size its
/// section info declared.
public class DataException extends ClusterException {
  public DataException(String message) {
    super(message, null, null, null);
  }

  public DataException(String message, Throwable cause) {
    super(message, null, null, cause);
  }

  public DataException(String message, int sectionId, Integer rank) {
    super(message, sectionId, rank, null);
  }
}
