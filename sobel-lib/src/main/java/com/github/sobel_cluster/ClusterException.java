// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.util.OptionalInt;

/// Base of the failure hierarchy. A failure may name the section and the worker rank it concerns so that the
/// diagnostic printed at the end of a run points at the culprit.
public abstract class ClusterException extends RuntimeException {
  private final Integer sectionId;
  private final Integer rank;

  protected ClusterException(String message, Integer sectionId, Integer rank, Throwable cause) {
    super(message, cause);
    this.sectionId = sectionId;
    this.rank = rank;
  }

  public OptionalInt sectionId() {
    return sectionId == null ? OptionalInt.empty() : OptionalInt.of(sectionId);
  }

  public OptionalInt rank() {
    return rank == null ? OptionalInt.empty() : OptionalInt.of(rank);
  }

  /// The message prefixed with the section and rank when they are known.
  public String diagnostic() {
    final var sb = new StringBuilder(getClass().getSimpleName());
    if (sectionId != null) {
      sb.append(" section=").append(sectionId);
    }
    if (rank != null) {
      sb.append(" worker=").append(rank);
    }
    return sb.append(": ").append(getMessage()).toString();
  }
}
