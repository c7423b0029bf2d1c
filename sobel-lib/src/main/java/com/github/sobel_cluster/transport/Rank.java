// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

/// Identity of a process in the group. Rank zero is the coordinator and ranks `1..size-1` are workers.
public record Rank(short id) implements Comparable<Rank> {
  public static final Rank COORDINATOR = new Rank((short) 0);

  public Rank {
    if (id < 0) throw new IllegalArgumentException("Rank must be non-negative");
  }

  public static Rank of(int id) {
    if (id > Short.MAX_VALUE) {
      throw new IllegalArgumentException("Rank too large: " + id);
    }
    return new Rank((short) id);
  }

  /// The rank that serves section `sectionId`.
  public static Rank ofWorker(int sectionId) {
    return of(sectionId + 1);
  }

  public boolean isCoordinator() {
    return id == 0;
  }

  @Override
  public int compareTo(Rank other) {
    return Short.compare(id, other.id);
  }

  @Override
  public String toString() {
    return "rank-" + id;
  }
}
