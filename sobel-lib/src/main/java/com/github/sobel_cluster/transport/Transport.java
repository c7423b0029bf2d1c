// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import org.jetbrains.annotations.NotNull;

import java.io.Closeable;
import java.time.Duration;
import java.util.Optional;

/// The cluster is agnostic to the underlying messaging substrate. This interface abstracts it.
///
/// Contract:
/// - `send` blocks until the message is handed to the substrate. Messages sent by one rank to another are
///   received in the order they were sent. There is no ordering between different senders.
/// - `receive` blocks until a message from the named peer arrives on the channel.
/// - `receiveAny` blocks until a message from any peer arrives on the channel and reports the real sender.
/// - No call times out unless a timeout is passed.
///
/// All failures are reported as [com.github.sobel_cluster.TransportException]. When the failure concerns one peer
/// the exception carries its rank.
public interface Transport extends Closeable {

  /// The rank of this process.
  Rank self();

  /// The number of processes in the group including the coordinator.
  int size();

  <T> void send(@NotNull Rank to, @NotNull Channel channel, @NotNull T message);

  <T> T receive(Rank from, Channel channel);

  <T> Envelope<T> receiveAny(Channel channel);

  /// @return the next message or empty if `timeout` elapsed first
  <T> Optional<Envelope<T>> receiveAny(Channel channel, Duration timeout);

  default <T> void send(Rank to, SectionChannel channel, T message) {
    send(to, channel.value(), message);
  }

  default <T> T receive(Rank from, SectionChannel channel) {
    return receive(from, channel.value());
  }

  default <T> Envelope<T> receiveAny(SectionChannel channel) {
    return receiveAny(channel.value());
  }

  default <T> Optional<Envelope<T>> receiveAny(SectionChannel channel, Duration timeout) {
    return receiveAny(channel.value(), timeout);
  }

  boolean isOpen();

  @Override
  void close();
}
