// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import com.github.sobel_cluster.transport.Envelope;
import com.github.sobel_cluster.transport.Rank;
import com.github.sobel_cluster.transport.Transport;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static com.github.sobel_cluster.ClusterLogger.LOGGER;
import static com.github.sobel_cluster.transport.SectionChannel.*;

/// Drives one edge detection run from rank zero.
///
/// The image is split by [PartitionPlanner] into one section per worker and section `i` is sent to rank `i + 1`.
/// Results are then collected in whatever order they arrive and keyed by section id, so arrival order never changes
/// the output. Replies for unknown or already completed sections are logged and ignored. A section whose worker
/// cannot be reached, goes away or answers with the wrong amount of data is recorded as failed, and any failed
/// section fails the whole run. There is no retry.
///
/// Without a collect timeout a worker that never answers blocks the run forever.
public class Coordinator {
  private final Transport transport;
  private final ClusterConfig config;
  private final Supplier<Kernel> kernelSource;

  private volatile CoordinatorState state = CoordinatorState.INIT;
  private volatile RunReport report;

  public Coordinator(Transport transport, ClusterConfig config) {
    this(transport, config, () -> KernelResolver.resolve(config.kernelPath()));
  }

  public Coordinator(Transport transport, ClusterConfig config, Supplier<Kernel> kernelSource) {
    this.transport = Objects.requireNonNull(transport, "transport cannot be null");
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.kernelSource = Objects.requireNonNull(kernelSource, "kernelSource cannot be null");
    if (!transport.self().isCoordinator()) {
      throw new ConfigurationException("Coordinator must run on rank 0 but this is " + transport.self());
    }
  }

  public CoordinatorState state() {
    return state;
  }

  /// The outcome of the last completed run.
  public Optional<RunReport> report() {
    return Optional.ofNullable(report);
  }

  /// Computes the gradient magnitude of `image` across the workers of the transport.
  ///
  /// Every worker must get at least one row. A group with more workers than the image has rows is refused before
  /// anything is sent, rather than planning empty sections for the surplus workers and leaving them idle.
  ///
  /// @return the reconstructed image, never a partial one
  /// @throws ConfigurationException  if there are no workers or more workers than rows
  /// @throws ReconstructionException if any section failed
  /// @throws TransportException      if the coordinator's own transport failed
  public RasterImage run(@NotNull RasterImage image) {
    Objects.requireNonNull(image, "image cannot be null");
    state = CoordinatorState.INIT;
    final long start = System.nanoTime();
    long dispatchNanos = 0L;
    long collectNanos = 0L;
    final int workers = transport.size() - 1;
    final Map<Integer, ClusterException> failures = new TreeMap<>();
    try {
      if (workers < 1) {
        throw new ConfigurationException("No workers available, the group has size " + transport.size());
      }
      final var plan = PartitionPlanner.plan(image.height(), image.width(), workers);
      final var kernel = kernelSource.get();
      LOGGER.info(() -> "Processing %dx%d image with %d workers".formatted(image.width(), image.height(), workers));

      transition(CoordinatorState.DISPATCHING);
      final Set<Integer> dispatched = dispatch(image, plan, kernel, failures);
      dispatchNanos = System.nanoTime() - start;

      transition(CoordinatorState.COLLECTING);
      final Map<Integer, ResultSection> results = collect(plan, dispatched, failures);
      collectNanos = System.nanoTime() - start - dispatchNanos;

      final var missing = new TreeSet<Integer>();
      plan.stream().map(SectionInfo::sectionId).filter(id -> !results.containsKey(id)).forEach(missing::add);
      if (!missing.isEmpty()) {
        final int first = missing.first();
        final var cause = failures.get(first);
        throw new ReconstructionException("Cannot reconstruct, missing sections %s: %s".formatted(missing,
            failures.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue().getMessage())
                .collect(Collectors.joining("; "))),
            first, (int) Rank.ofWorker(first).id(), cause);
      }

      transition(CoordinatorState.RECONSTRUCTING);
      final var output = SeamReconstructor.reconstruct(results.values(), plan, image.width(), image.height());
      transition(CoordinatorState.DONE);
      return output;
    } catch (ClusterException e) {
      transition(CoordinatorState.FAILED);
      LOGGER.severe(() -> "Run failed: " + e.diagnostic());
      throw e;
    } finally {
      final var finished = RunReport.of(state.isTerminal() ? state : CoordinatorState.FAILED, Math.max(workers, 0),
          failures, dispatchNanos, collectNanos, System.nanoTime() - start);
      report = finished;
      LOGGER.fine(finished::toString);
    }
  }

  /// Sends each worker its kernel, section info and pixels in that order.
  ///
  /// @return the ids of the sections that were handed to their worker
  private Set<Integer> dispatch(RasterImage image, List<SectionInfo> plan, Kernel kernel,
                                Map<Integer, ClusterException> failures) {
    final Set<Integer> dispatched = new TreeSet<>();
    for (SectionInfo info : plan) {
      final var worker = Rank.ofWorker(info.sectionId());
      try {
        transport.send(worker, KERNEL, kernel);
        transport.send(worker, SECTION_INFO, info);
        transport.send(worker, IMAGE_SECTION, image.extractSection(info));
        dispatched.add(info.sectionId());
        LOGGER.fine(() -> "Dispatched " + info + " to " + worker);
      } catch (TransportException e) {
        LOGGER.warning(() -> "Failed to dispatch section %d to %s: %s".formatted(info.sectionId(), worker,
            e.getMessage()));
        failures.put(info.sectionId(),
            new TransportException("Dispatch failed: " + e.getMessage(), info.sectionId(), worker.id(), e));
      }
    }
    return dispatched;
  }

  private Map<Integer, ResultSection> collect(List<SectionInfo> plan, Set<Integer> dispatched,
                                              Map<Integer, ClusterException> failures) {
    final Map<Integer, ResultSection> results = new HashMap<>();
    final Set<Integer> awaiting = new TreeSet<>(dispatched);
    final Optional<Duration> timeout = config.collectTimeout();
    while (!awaiting.isEmpty()) {
      final Optional<Envelope<SectionInfo>> next;
      try {
        next = timeout.isPresent()
            ? transport.receiveAny(RESULT_INFO, timeout.get())
            : Optional.of(transport.receiveAny(RESULT_INFO));
      } catch (TransportException e) {
        if (e.rank().isEmpty()) {
          throw e;
        }
        workerLost(e, awaiting, failures);
        continue;
      }
      if (next.isEmpty()) {
        LOGGER.warning(() -> "Timed out after %s waiting for sections %s".formatted(timeout.get(), awaiting));
        for (Integer id : awaiting) {
          failures.put(id, new TransportException("No reply within " + timeout.get(), id,
              Rank.ofWorker(id).id(), null));
        }
        break;
      }
      final var from = next.get().from();
      final var info = next.get().message();
      final RasterImage pixels;
      try {
        pixels = transport.receive(from, RESULT_SECTION);
      } catch (TransportException e) {
        workerLost(e, awaiting, failures);
        continue;
      }
      accept(plan, from, info, pixels, awaiting, results, failures);
    }
    return results;
  }

  private void accept(List<SectionInfo> plan, Rank from, SectionInfo info, RasterImage pixels,
                      Set<Integer> awaiting, Map<Integer, ResultSection> results,
                      Map<Integer, ClusterException> failures) {
    final int id = info.sectionId();
    if (id >= plan.size() || !Rank.ofWorker(id).equals(from)) {
      LOGGER.warning(() -> "Ignoring out of range section %d from %s".formatted(id, from));
      return;
    }
    if (results.containsKey(id) || failures.containsKey(id)) {
      LOGGER.warning(() -> "Ignoring duplicate section %d from %s".formatted(id, from));
      return;
    }
    if (!awaiting.contains(id)) {
      LOGGER.warning(() -> "Ignoring section %d from %s which was not dispatched".formatted(id, from));
      return;
    }
    awaiting.remove(id);
    final var planned = plan.get(id);
    try {
      if (!info.equals(planned)) {
        throw new DataException("Reply declared " + info + " but " + planned + " was sent", id, (int) from.id());
      }
      results.put(id, new ResultSection(info, pixels));
      LOGGER.fine(() -> "Collected section %d from %s, %d outstanding".formatted(id, from, awaiting.size()));
    } catch (DataException e) {
      LOGGER.warning(() -> "Section %d from %s is unusable: %s".formatted(id, from, e.getMessage()));
      failures.put(id, new DataException(e.getMessage(), id, (int) from.id()));
    }
  }

  private void workerLost(TransportException e, Set<Integer> awaiting, Map<Integer, ClusterException> failures) {
    final int rank = e.rank().getAsInt();
    final int id = rank - 1;
    if (awaiting.remove(id)) {
      LOGGER.warning(() -> "Lost worker rank-%d serving section %d: %s".formatted(rank, id, e.getMessage()));
      failures.put(id, new TransportException(e.getMessage(), id, rank, e));
    } else {
      LOGGER.fine(() -> "Ignoring loss of rank-" + rank + " which owes no section");
    }
  }

  private void transition(CoordinatorState next) {
    final var previous = state;
    state = next;
    LOGGER.fine(() -> "Coordinator " + previous + " -> " + next);
  }
}
