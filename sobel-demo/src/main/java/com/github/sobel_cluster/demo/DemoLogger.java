// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.demo;

import java.util.logging.Logger;

final class DemoLogger {
  static final Logger LOGGER = Logger.getLogger("com.github.sobel_cluster.demo");

  private DemoLogger() {
  }
}
