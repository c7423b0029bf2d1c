// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.net;

import com.github.sobel_cluster.TransportException;
import com.github.sobel_cluster.transport.Channel;
import com.github.sobel_cluster.transport.Pickler;
import com.github.sobel_cluster.transport.PicklingTransport;
import com.github.sobel_cluster.transport.Rank;
import com.github.sobel_cluster.transport.SectionPicklers;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.github.sobel_cluster.net.NetLogger.LOGGER;

/// A [com.github.sobel_cluster.transport.Transport] over TCP sockets. Each peer link is one socket so frames from a
/// peer arrive in the order they were written.
public class TcpTransport extends PicklingTransport {
  private final Map<Rank, Connection> links;
  private final AtomicBoolean closed = new AtomicBoolean();

  TcpTransport(Rank self, int size, Map<Rank, Connection> links, Map<Channel, Pickler<?>> picklers) {
    super(self, size, picklers);
    this.links = Map.copyOf(links);
    this.links.values().forEach(link -> link.start(mailbox::deliver));
    LOGGER.info(() -> "%s joined a group of %d".formatted(self, size));
  }

  /// Joins the group of the coordinator at `host:port` as a worker.
  ///
  /// @throws TransportException if the coordinator cannot be reached or rejects the handshake
  public static TcpTransport connect(String host, int port, Duration timeout) {
    return connect(host, port, timeout, SectionPicklers.protocol());
  }

  public static TcpTransport connect(String host, int port, Duration timeout, Map<Channel, Pickler<?>> picklers) {
    final var socket = new Socket();
    try {
      Connection.configure(socket);
      socket.connect(new InetSocketAddress(host, port), Math.toIntExact(timeout.toMillis()));
      final var in = Connection.input(socket);
      final var out = Connection.output(socket);
      Handshake.writeHello(out);
      socket.setSoTimeout(Math.toIntExact(timeout.toMillis()));
      final var handshake = Handshake.read(in);
      socket.setSoTimeout(0);
      LOGGER.fine(() -> "Coordinator at %s:%d assigned %s".formatted(host, port, handshake.rank()));
      final var link = new Connection(handshake.rank(), Rank.COORDINATOR, socket, in, out);
      return new TcpTransport(handshake.rank(), handshake.size(), Map.of(Rank.COORDINATOR, link), picklers);
    } catch (IOException e) {
      closeOnFailure(socket, e);
      throw new TransportException("Cannot join coordinator at %s:%d: %s".formatted(host, port, e.getMessage()),
          Rank.COORDINATOR.id(), e);
    }
  }

  private static void closeOnFailure(Socket socket, IOException failure) {
    try {
      socket.close();
    } catch (IOException e) {
      failure.addSuppressed(e);
    }
  }

  @Override
  protected void transmit(Rank to, Channel channel, byte[] payload) {
    final var link = links.get(to);
    if (link == null) {
      throw new TransportException("No route from %s to %s, workers only talk to the coordinator"
          .formatted(self, to), to.id(), null);
    }
    try {
      link.write(to, channel, payload);
    } catch (IOException e) {
      throw TransportException.peerLost("Send to %s failed: %s".formatted(to, e.getMessage()), to.id(), e);
    }
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      LOGGER.fine(() -> self + " closing " + links.size() + " links");
      mailbox.close();
      links.values().forEach(Connection::close);
    }
  }
}
