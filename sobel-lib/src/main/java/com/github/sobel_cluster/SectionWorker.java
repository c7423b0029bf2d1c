// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import com.github.sobel_cluster.transport.Rank;
import com.github.sobel_cluster.transport.Transport;

import java.util.Objects;
import java.util.logging.Level;

import static com.github.sobel_cluster.ClusterLogger.LOGGER;
import static com.github.sobel_cluster.transport.SectionChannel.*;

/// The worker side of the protocol. A task is three messages from the coordinator, `KERNEL`, `SECTION_INFO` and
/// `IMAGE_SECTION`, and the answer is `RESULT_INFO` followed by `RESULT_SECTION`. Nothing is kept between tasks.
public class SectionWorker implements AutoCloseable {
  private final Transport transport;
  private final ConvolutionEngine engine;
  private volatile SectionInfo current;

  public SectionWorker(Transport transport, ClusterConfig config) {
    this(transport, new ConvolutionEngine(config.workerThreads()));
  }

  public SectionWorker(Transport transport, ConvolutionEngine engine) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
    this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    if (transport.self().isCoordinator()) {
      throw new ConfigurationException("Rank 0 is the coordinator and cannot serve sections");
    }
  }

  /// Blocks until the next task has fully arrived.
  ///
  /// @throws DataException if the pixel block does not match the declared section size
  public WorkerTask receiveTask() {
    final Kernel kernel = transport.receive(Rank.COORDINATOR, KERNEL);
    final SectionInfo info = transport.receive(Rank.COORDINATOR, SECTION_INFO);
    final RasterImage pixels = transport.receive(Rank.COORDINATOR, IMAGE_SECTION);
    LOGGER.fine(() -> transport.self() + " received " + info);
    return new WorkerTask(info, pixels, kernel);
  }

  public ResultSection process(WorkerTask task) {
    final long start = System.nanoTime();
    final var output = engine.convolve(task.pixels(), task.kernel());
    LOGGER.fine(() -> "%s convolved %s in %dms".formatted(transport.self(), task.info(),
        (System.nanoTime() - start) / 1_000_000));
    return new ResultSection(task.info(), output);
  }

  /// Receives, processes and answers one task.
  public void serveOnce() {
    final var task = receiveTask();
    current = task.info();
    final var result = process(task);
    transport.send(Rank.COORDINATOR, RESULT_INFO, result.info());
    transport.send(Rank.COORDINATOR, RESULT_SECTION, result.pixels());
    current = null;
  }

  /// Serves tasks until the transport is closed or the coordinator goes away.
  ///
  /// Any other failure closes the transport before it is rethrown, so the coordinator sees this worker as lost
  /// rather than waiting for a reply that will never come.
  ///
  /// @return the number of tasks served
  public int serve() {
    int served = 0;
    LOGGER.info(() -> transport.self() + " serving sections");
    while (transport.isOpen()) {
      try {
        serveOnce();
        served++;
      } catch (TransportException e) {
        if (transport.isOpen() && !lostCoordinator(e)) {
          throw abandon(e);
        }
        final int count = served;
        LOGGER.fine(() -> "%s stopping after %d tasks: %s".formatted(transport.self(), count, e.getMessage()));
        break;
      } catch (RuntimeException e) {
        throw abandon(e);
      }
    }
    return served;
  }

  private RuntimeException abandon(RuntimeException failure) {
    final var section = sectionOf(failure);
    LOGGER.log(Level.WARNING, failure, () -> "%s abandoning section %s: %s".formatted(transport.self(),
        section, failure.getMessage()));
    current = null;
    transport.close();
    return failure;
  }

  private String sectionOf(RuntimeException failure) {
    if (failure instanceof ClusterException && ((ClusterException) failure).sectionId().isPresent()) {
      return String.valueOf(((ClusterException) failure).sectionId().getAsInt());
    }
    final var info = current;
    return info == null ? "unknown" : String.valueOf(info.sectionId());
  }

  private static boolean lostCoordinator(TransportException e) {
    return e.isPeerLost() && e.rank().isPresent() && e.rank().getAsInt() == Rank.COORDINATOR.id();
  }

  @Override
  public void close() {
    engine.close();
  }
}
