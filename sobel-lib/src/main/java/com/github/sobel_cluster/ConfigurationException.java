// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

/// Invalid run setup such as zero workers, more workers than rows or a bad image geometry.
public class ConfigurationException extends ClusterException {
  public ConfigurationException(String message) {
    super(message, null, null, null);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, null, null, cause);
  }
}
