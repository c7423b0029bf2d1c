// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import com.github.sobel_cluster.TransportException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.github.sobel_cluster.ClusterLogger.LOGGER;

/// A process group living in one JVM. Each member gets its own [InMemoryTransport] and every member should be
/// driven by its own thread. Messages are pickled into fresh byte arrays and dropped into the receiver's
/// [Mailbox], so members share no buffers.
///
/// Closing a member tells every other member that the peer was lost which is how a crashed worker looks to the
/// coordinator.
public class InMemoryCluster implements AutoCloseable {
  private final List<InMemoryTransport> members;

  public InMemoryCluster(int size) {
    this(size, SectionPicklers.protocol());
  }

  public InMemoryCluster(int size, Map<Channel, Pickler<?>> picklers) {
    if (size < 1) {
      throw new IllegalArgumentException("A cluster needs at least one member: " + size);
    }
    final List<InMemoryTransport> created = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      created.add(new InMemoryTransport(this, Rank.of(i), size, picklers));
    }
    this.members = Collections.unmodifiableList(created);
    LOGGER.fine(() -> "Created InMemoryCluster of " + size);
  }

  public int size() {
    return members.size();
  }

  public InMemoryTransport member(Rank rank) {
    return members.get(rank.id());
  }

  public InMemoryTransport coordinator() {
    return member(Rank.COORDINATOR);
  }

  /// The transports of ranks `1..size-1`.
  public List<InMemoryTransport> workers() {
    return members.subList(1, members.size());
  }

  void route(Rank from, Rank to, Channel channel, byte[] payload) {
    final var target = member(to);
    if (!target.isOpen()) {
      throw TransportException.peerLost("Cannot send to closed " + to, to.id(), null);
    }
    target.mailbox.deliver(new Frame(from, channel, payload));
  }

  void left(Rank rank) {
    LOGGER.fine(() -> "InMemoryCluster member " + rank + " left");
    members.stream()
        .filter(m -> !m.self().equals(rank))
        .filter(InMemoryTransport::isOpen)
        .forEach(m -> m.mailbox.deliver(Frame.peerLost(rank, "peer closed")));
  }

  @Override
  public void close() {
    LOGGER.fine(() -> "InMemoryCluster stopping");
    members.forEach(InMemoryTransport::close);
  }
}
