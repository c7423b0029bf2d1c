// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

/// Phases of a [Coordinator] run. A run moves forward through the phases and ends in `DONE` or `FAILED`.
public enum CoordinatorState {
  INIT,
  DISPATCHING,
  COLLECTING,
  RECONSTRUCTING,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}
