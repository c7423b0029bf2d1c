// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.util.logging.Logger;

/// Shared logger for the core library. Classes import `LOGGER` statically.
public final class ClusterLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.sobel_cluster");

  private ClusterLogger() {
  }
}
