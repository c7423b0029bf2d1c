// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import com.github.sobel_cluster.TransportException;
import org.jetbrains.annotations.TestOnly;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.github.sobel_cluster.ClusterLogger.LOGGER;

/// The inbound queue of one process. Frames are kept in arrival order and a receive takes the first frame that
/// matches its source and channel, so frames from a single peer are always seen in the order that peer sent them.
///
/// A [Frame#peerLost] frame for a peer matches any receive aimed at that peer. It stays queued for directed
/// receives so every later receive from the dead peer fails fast. An any-source receive consumes it so that the
/// failure is reported once.
public class Mailbox {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final LinkedList<Frame> frames = new LinkedList<>();
  private boolean closed;

  public void deliver(Frame frame) {
    lock.lock();
    try {
      if (closed) {
        LOGGER.finest(() -> "Mailbox closed, dropping " + frame);
        return;
      }
      frames.addLast(frame);
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  /// Blocks until a frame from `from` (or any peer when `from` is empty) on `channel` arrives.
  ///
  /// @param timeout how long to wait, empty for no limit
  /// @return the frame, or empty if the timeout elapsed first
  /// @throws TransportException if the mailbox is closed
  /// @throws InterruptedException if the waiting thread is interrupted
  public Optional<Frame> take(Optional<Rank> from, Channel channel, Optional<Duration> timeout)
      throws InterruptedException {
    long remainingNanos = timeout.map(Duration::toNanos).orElse(Long.MAX_VALUE);
    lock.lock();
    try {
      while (true) {
        final var match = removeFirstMatch(from, channel);
        if (match.isPresent()) {
          return match;
        }
        if (closed) {
          throw new TransportException("Transport closed while waiting on channel " + channel.id());
        }
        if (timeout.isEmpty()) {
          changed.await();
        } else {
          if (remainingNanos <= 0L) {
            return Optional.empty();
          }
          remainingNanos = changed.awaitNanos(remainingNanos);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  private Optional<Frame> removeFirstMatch(Optional<Rank> from, Channel channel) {
    final Iterator<Frame> it = frames.iterator();
    while (it.hasNext()) {
      final var frame = it.next();
      if (from.isPresent() && !from.get().equals(frame.from())) {
        continue;
      }
      if (frame.isPeerLost()) {
        if (from.isEmpty()) {
          it.remove();
        }
        return Optional.of(frame);
      }
      if (frame.channel().equals(channel)) {
        it.remove();
        return Optional.of(frame);
      }
    }
    return Optional.empty();
  }

  @TestOnly
  public int pending() {
    lock.lock();
    try {
      return frames.size();
    } finally {
      lock.unlock();
    }
  }

  /// Wakes every waiting receiver which then fails with a [TransportException].
  public void close() {
    lock.lock();
    try {
      closed = true;
      frames.clear();
      changed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }
}
