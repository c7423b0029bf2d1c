// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

/// A send or receive failed, the peer went away, or a message could not be decoded.
public class TransportException extends ClusterException {
  private final boolean peerLost;

  public TransportException(String message) {
    this(message, null, null, null, false);
  }

  public TransportException(String message, Throwable cause) {
    this(message, null, null, cause, false);
  }

  public TransportException(String message, int rank, Throwable cause) {
    this(message, null, rank, cause, false);
  }

  public TransportException(String message, int sectionId, int rank, Throwable cause) {
    this(message, sectionId, rank, cause, false);
  }

  private TransportException(String message, Integer sectionId, Integer rank, Throwable cause, boolean peerLost) {
    super(message, sectionId, rank, cause);
    this.peerLost = peerLost;
  }

  /// The link to `rank` is gone: it closed, its connection dropped or it can no longer be written to.
  public static TransportException peerLost(String message, int rank, Throwable cause) {
    return new TransportException(message, null, rank, cause, true);
  }

  /// True when the peer named by [#rank()] is unreachable, as opposed to a message that could not be decoded or a
  /// local transport that was closed.
  public boolean isPeerLost() {
    return peerLost;
  }
}
