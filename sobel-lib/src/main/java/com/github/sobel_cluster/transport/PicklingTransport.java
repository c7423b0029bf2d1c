// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import com.github.sobel_cluster.TransportException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.github.sobel_cluster.ClusterLogger.LOGGER;

/// Common half of every backend. Messages are pickled with the pickler registered for their channel, handed to
/// [#transmit] as bytes, and inbound frames are matched out of a local [Mailbox]. A backend only has to move bytes
/// and feed the mailbox.
public abstract class PicklingTransport implements Transport {
  protected final Rank self;
  protected final int size;
  protected final Mailbox mailbox = new Mailbox();
  private final Map<Channel, Pickler<?>> picklers;

  protected PicklingTransport(Rank self, int size, Map<Channel, Pickler<?>> picklers) {
    Objects.requireNonNull(self, "self cannot be null");
    if (size < 1 || self.id() >= size) {
      throw new IllegalArgumentException("Rank %s is outside a group of %d".formatted(self, size));
    }
    this.self = self;
    this.size = size;
    this.picklers = Map.copyOf(picklers);
  }

  /// Moves an already pickled message to `to`.
  protected abstract void transmit(Rank to, Channel channel, byte[] payload);

  @Override
  public Rank self() {
    return self;
  }

  @Override
  public int size() {
    return size;
  }

  @Override
  public <T> void send(Rank to, Channel channel, T message) {
    if (!isOpen()) {
      throw new TransportException(self + " is closed", to.id(), null);
    }
    if (to.id() >= size) {
      throw new TransportException("No such rank %s in a group of %d".formatted(to, size), to.id(), null);
    }
    if (to.equals(self)) {
      throw new TransportException(self + " cannot send to itself", to.id(), null);
    }
    final Pickler<T> pickler = picklerFor(channel);
    final byte[] payload = pickler.serialize(message);
    LOGGER.finest(() -> "%s sending %d bytes on channel %d to %s".formatted(self, payload.length, channel.id(), to));
    transmit(to, channel, payload);
  }

  @Override
  public <T> T receive(Rank from, Channel channel) {
    final var frame = await(Optional.of(from), channel, Optional.empty())
        .orElseThrow(() -> new IllegalStateException("Untimed receive returned nothing"));
    return decode(frame);
  }

  @Override
  public <T> Envelope<T> receiveAny(Channel channel) {
    final var frame = await(Optional.empty(), channel, Optional.empty())
        .orElseThrow(() -> new IllegalStateException("Untimed receive returned nothing"));
    return new Envelope<>(frame.from(), channel, decode(frame));
  }

  @Override
  public <T> Optional<Envelope<T>> receiveAny(Channel channel, Duration timeout) {
    return await(Optional.empty(), channel, Optional.of(timeout))
        .map(frame -> new Envelope<T>(frame.from(), channel, this.<T>decode(frame)));
  }

  private Optional<Frame> await(Optional<Rank> from, Channel channel, Optional<Duration> timeout) {
    try {
      return mailbox.take(from, channel, timeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException(self + " interrupted while receiving on channel " + channel.id(), e);
    }
  }

  private <T> T decode(Frame frame) {
    if (frame.isPeerLost()) {
      throw TransportException.peerLost("Lost connection to " + frame.from() + ": " + frame.reason(),
          frame.from().id(), null);
    }
    final Pickler<T> pickler = picklerFor(frame.channel());
    try {
      return pickler.deserialize(frame.payload());
    } catch (RuntimeException e) {
      LOGGER.warning(() -> "%s could not decode %s: %s".formatted(self, frame, e.getMessage()));
      throw new TransportException("Malformed message on channel %d from %s: %s"
          .formatted(frame.channel().id(), frame.from(), e.getMessage()), frame.from().id(), e);
    }
  }

  private <T> Pickler<T> picklerFor(Channel channel) {
    @SuppressWarnings("unchecked")
    Pickler<T> pickler = (Pickler<T>) picklers.get(channel);
    if (pickler == null) {
      throw new TransportException("No pickler registered for channel: " + channel.id());
    }
    return pickler;
  }

  @Override
  public boolean isOpen() {
    return !mailbox.isClosed();
  }
}
