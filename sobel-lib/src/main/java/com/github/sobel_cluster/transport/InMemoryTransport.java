// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/// One member of an [InMemoryCluster].
public class InMemoryTransport extends PicklingTransport {
  private final InMemoryCluster cluster;
  private final AtomicBoolean closed = new AtomicBoolean();

  InMemoryTransport(InMemoryCluster cluster, Rank self, int size, Map<Channel, Pickler<?>> picklers) {
    super(self, size, picklers);
    this.cluster = cluster;
  }

  @Override
  protected void transmit(Rank to, Channel channel, byte[] payload) {
    cluster.route(self, to, channel, payload);
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      mailbox.close();
      cluster.left(self);
    }
  }
}
