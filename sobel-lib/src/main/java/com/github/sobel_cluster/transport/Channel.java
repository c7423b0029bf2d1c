// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

/// A channel is a short value that identifies the type of message being sent.
/// Channels below 100 are reserved for transport control frames.
/// @see SectionChannel
public record Channel(short id) {

  public boolean isControl() {
    return id < 100;
  }
}
