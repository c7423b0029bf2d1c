// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.time.Duration;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/// What happened during the last [Coordinator#run].
///
/// @param state       the terminal state
/// @param workers     number of workers the image was split across
/// @param failures    diagnostic of each section that failed, by section id
/// @param dispatching time spent sending tasks
/// @param collecting  time spent waiting for results
/// @param elapsed     wall clock time of the whole run
public record RunReport(CoordinatorState state,
                        int workers,
                        SortedMap<Integer, String> failures,
                        Duration dispatching,
                        Duration collecting,
                        Duration elapsed) {

  public RunReport {
    failures = new TreeMap<>(failures);
  }

  public boolean succeeded() {
    return state == CoordinatorState.DONE;
  }

  @Override
  public SortedMap<Integer, String> failures() {
    return new TreeMap<>(failures);
  }

  static RunReport of(CoordinatorState state, int workers, Map<Integer, ClusterException> failures,
                      long dispatchNanos, long collectNanos, long elapsedNanos) {
    final var diagnostics = new TreeMap<Integer, String>();
    failures.forEach((id, e) -> diagnostics.put(id, e.diagnostic()));
    return new RunReport(state, workers, diagnostics, Duration.ofNanos(dispatchNanos),
        Duration.ofNanos(collectNanos), Duration.ofNanos(elapsedNanos));
  }

  @Override
  public String toString() {
    return "RunReport[state=%s, workers=%d, failed=%s, dispatch=%dms, collect=%dms, total=%dms]".formatted(
        state, workers, failures.keySet(), dispatching.toMillis(), collecting.toMillis(), elapsed.toMillis());
  }
}
