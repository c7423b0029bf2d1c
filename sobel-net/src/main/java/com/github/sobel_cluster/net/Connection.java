// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.net;

import com.github.sobel_cluster.transport.Channel;
import com.github.sobel_cluster.transport.Frame;
import com.github.sobel_cluster.transport.Rank;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.Socket;
import java.util.function.Consumer;
import java.util.logging.Level;

import static com.github.sobel_cluster.net.NetLogger.LOGGER;

/// One socket to one peer. Writes are serialised on the output stream and a daemon thread reads frames and hands
/// them to the owner. When the stream ends or fails the reader hands over a [Frame#peerLost] and exits.
final class Connection implements Closeable {
  static final int BUFFER_SIZE = 64 * 1024;
  static final int MAX_PAYLOAD = 256 * 1024 * 1024;

  private final Rank self;
  private final Rank peer;
  private final Socket socket;
  private final DataInputStream in;
  private final DataOutputStream out;
  private volatile boolean closing;

  Connection(Rank self, Rank peer, Socket socket, DataInputStream in, DataOutputStream out) {
    this.self = self;
    this.peer = peer;
    this.socket = socket;
    this.in = in;
    this.out = out;
  }

  static DataInputStream input(Socket socket) throws IOException {
    return new DataInputStream(new BufferedInputStream(socket.getInputStream(), BUFFER_SIZE));
  }

  static DataOutputStream output(Socket socket) throws IOException {
    return new DataOutputStream(new BufferedOutputStream(socket.getOutputStream(), BUFFER_SIZE));
  }

  static void configure(Socket socket) throws IOException {
    socket.setTcpNoDelay(true);
    socket.setKeepAlive(true);
  }

  Rank peer() {
    return peer;
  }

  void write(Rank to, Channel channel, byte[] payload) throws IOException {
    synchronized (out) {
      out.writeShort(self.id());
      out.writeShort(to.id());
      out.writeShort(channel.id());
      out.writeInt(payload.length);
      out.write(payload);
      out.flush();
    }
  }

  /// Starts the reader thread.
  void start(Consumer<Frame> inbound) {
    final var reader = new Thread(() -> readLoop(inbound), "tcp-" + self + "-from-" + peer);
    reader.setDaemon(true);
    reader.start();
  }

  private void readLoop(Consumer<Frame> inbound) {
    try {
      while (true) {
        final var from = Rank.of(in.readShort());
        final var to = Rank.of(in.readShort());
        final var channel = new Channel(in.readShort());
        final int length = in.readInt();
        if (length < 0 || length > MAX_PAYLOAD) {
          throw new IOException("Invalid frame length: " + length);
        }
        if (!to.equals(self)) {
          throw new IOException("Frame addressed to " + to + " arrived at " + self);
        }
        if (!from.equals(peer)) {
          throw new IOException("Frame claiming to be from " + from + " arrived on the link to " + peer);
        }
        final var payload = new byte[length];
        in.readFully(payload);
        inbound.accept(new Frame(from, channel, payload));
      }
    } catch (EOFException e) {
      LOGGER.fine(() -> self + " link to " + peer + " closed by peer");
      inbound.accept(Frame.peerLost(peer, "connection closed"));
    } catch (IOException e) {
      if (closing) {
        LOGGER.finer(() -> self + " link to " + peer + " closed locally");
      } else {
        LOGGER.log(Level.WARNING, self + " link to " + peer + " failed", e);
      }
      inbound.accept(Frame.peerLost(peer, String.valueOf(e.getMessage())));
    } catch (RuntimeException e) {
      LOGGER.log(Level.WARNING, self + " link to " + peer + " sent a bad frame", e);
      inbound.accept(Frame.peerLost(peer, "bad frame: " + e.getMessage()));
    }
  }

  @Override
  public void close() {
    closing = true;
    try {
      socket.close();
    } catch (IOException e) {
      LOGGER.finer(() -> "Error closing link to " + peer + ": " + e.getMessage());
    }
  }
}
