// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.net;

import com.github.sobel_cluster.ConfigurationException;
import com.github.sobel_cluster.TransportException;
import com.github.sobel_cluster.transport.Channel;
import com.github.sobel_cluster.transport.Pickler;
import com.github.sobel_cluster.transport.Rank;
import com.github.sobel_cluster.transport.SectionPicklers;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.github.sobel_cluster.net.NetLogger.LOGGER;

/// The coordinator's server socket. Workers are ranked in the order they are accepted.
public class TcpListener implements AutoCloseable {
  private final ServerSocket serverSocket;

  /// @param port the port to bind, zero for an ephemeral one
  public TcpListener(int port) {
    try {
      this.serverSocket = new ServerSocket(port);
    } catch (IOException e) {
      throw new TransportException("Cannot listen on port " + port + ": " + e.getMessage(), e);
    }
    LOGGER.info(() -> "Coordinator listening on port " + port());
  }

  public int port() {
    return serverSocket.getLocalPort();
  }

  /// Waits for `workers` workers to join and returns the coordinator's transport. Peers that connect but fail the
  /// handshake are dropped without using up a rank.
  ///
  /// @param timeout how long to wait for all workers to join
  /// @throws TransportException if they do not all join in time
  public TcpTransport accept(int workers, Duration timeout) {
    return accept(workers, timeout, SectionPicklers.protocol());
  }

  public TcpTransport accept(int workers, Duration timeout, Map<Channel, Pickler<?>> picklers) {
    if (workers < 1) {
      throw new ConfigurationException("At least one worker is required but got " + workers);
    }
    final int size = workers + 1;
    final long deadline = System.nanoTime() + timeout.toNanos();
    final List<Socket> accepted = new ArrayList<>(workers);
    final Map<Rank, Connection> links = new HashMap<>();
    try {
      while (links.size() < workers) {
        final int remainingMillis = remainingMillis(deadline);
        serverSocket.setSoTimeout(remainingMillis);
        final Socket socket = serverSocket.accept();
        final var rank = Rank.of(links.size() + 1);
        final var link = handshake(socket, rank, size, remainingMillis);
        if (link.isPresent()) {
          accepted.add(socket);
          links.put(rank, link.get());
          LOGGER.fine(() -> "Accepted %s from %s".formatted(rank, socket.getRemoteSocketAddress()));
        }
      }
      serverSocket.setSoTimeout(0);
    } catch (SocketTimeoutException e) {
      closeAll(accepted, e);
      throw new TransportException("Only %d of %d workers joined within %s".formatted(links.size(), workers,
          timeout), e);
    } catch (IOException e) {
      closeAll(accepted, e);
      throw new TransportException("Failed while accepting workers: " + e.getMessage(), e);
    }
    return new TcpTransport(Rank.COORDINATOR, size, links, picklers);
  }

  private static int remainingMillis(long deadline) {
    final long remaining = Math.max(1L, (deadline - System.nanoTime()) / 1_000_000L);
    return Math.toIntExact(Math.min(Integer.MAX_VALUE, remaining));
  }

  /// Runs the joining handshake on a freshly accepted socket. A peer that does not complete it within
  /// `timeoutMillis` or that is not a worker is dropped and accepting carries on.
  private static Optional<Connection> handshake(Socket socket, Rank rank, int size, int timeoutMillis) {
    try {
      Connection.configure(socket);
      socket.setSoTimeout(timeoutMillis);
      final var in = Connection.input(socket);
      final var out = Connection.output(socket);
      Handshake.readHello(in);
      new Handshake(rank, size).write(out);
      socket.setSoTimeout(0);
      return Optional.of(new Connection(Rank.COORDINATOR, rank, socket, in, out));
    } catch (IOException e) {
      LOGGER.warning(() -> "Rejected peer %s: %s".formatted(socket.getRemoteSocketAddress(), e.getMessage()));
      closeAll(List.of(socket), e);
      return Optional.empty();
    }
  }

  private static void closeAll(List<Socket> sockets, IOException failure) {
    for (Socket socket : sockets) {
      try {
        socket.close();
      } catch (IOException e) {
        failure.addSuppressed(e);
      }
    }
  }

  @Override
  public void close() {
    try {
      serverSocket.close();
    } catch (IOException e) {
      throw new TransportException("Error closing listener: " + e.getMessage(), e);
    }
  }
}
