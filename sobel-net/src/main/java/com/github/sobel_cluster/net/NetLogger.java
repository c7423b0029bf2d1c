// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.net;

import java.util.logging.Logger;

public final class NetLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.sobel_cluster.net");

  private NetLogger() {
  }
}
