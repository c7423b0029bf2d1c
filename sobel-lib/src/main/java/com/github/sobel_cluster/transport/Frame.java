// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import java.nio.charset.StandardCharsets;

/// A pickled message waiting in a [Mailbox].
public record Frame(Rank from, Channel channel, byte[] payload) {

  /// A control frame recording that the link to `from` failed.
  public static Frame peerLost(Rank from, String reason) {
    return new Frame(from, SectionChannel.PEER_LOST.value(), reason.getBytes(StandardCharsets.UTF_8));
  }

  public boolean isPeerLost() {
    return channel.id() == SectionChannel.PEER_LOST.id();
  }

  public String reason() {
    return new String(payload, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "Frame[from=" + from + ", channel=" + channel.id() + ", bytes=" + payload.length + "]";
  }
}
