// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.IntStream;

import static com.github.sobel_cluster.ClusterLogger.LOGGER;

/// Assembles the output image from the result sections.
///
/// A worker leaves the first and last row of its section black because it never sees the rows of its neighbours.
/// After the sections are placed, each seam is hidden by copying the nearest computed row over it: the last row of
/// section `i` takes a copy of the row above it and the first row of section `i + 1` takes a copy of the row below
/// it. Seams are patched in section order. The copy is approximate and no attempt is made to recompute the true
/// gradient at a seam.
public final class SeamReconstructor {

  private SeamReconstructor() {
  }

  /// Places every section by its section id, whatever order the results arrived in, then patches the seams.
  ///
  /// @throws ReconstructionException if a section is missing, duplicated, out of range or differs from the plan
  public static RasterImage reconstruct(Collection<ResultSection> results, List<SectionInfo> plan,
                                        int width, int height) {
    final int sections = plan.size();
    if (sections == 0) {
      throw new ReconstructionException("Plan has no sections");
    }
    final var last = plan.get(sections - 1);
    if (last.endRow() != height || plan.get(0).width() != width) {
      throw new ReconstructionException("Plan does not cover a %dx%d image".formatted(width, height));
    }

    final Map<Integer, ResultSection> byId = new TreeMap<>();
    for (ResultSection result : results) {
      final int id = result.sectionId();
      if (id < 0 || id >= sections) {
        throw new ReconstructionException("Section id out of range 0-%d".formatted(sections - 1), id);
      }
      if (byId.putIfAbsent(id, result) != null) {
        throw new ReconstructionException("Duplicate result", id);
      }
      if (!result.info().equals(plan.get(id))) {
        throw new ReconstructionException("Result " + result.info() + " does not match planned " + plan.get(id),
            id);
      }
    }
    final var missing = new TreeSet<Integer>();
    IntStream.range(0, sections).filter(id -> !byId.containsKey(id)).forEach(missing::add);
    if (!missing.isEmpty()) {
      throw new ReconstructionException("Missing sections " + missing, missing.first());
    }

    final byte[] output = new byte[width * height];
    byId.values().forEach(r -> r.pixels().copyRowsInto(output, r.info().startRow()));

    for (int i = 0; i < sections - 1; i++) {
      final int bottom = plan.get(i).lastRow();
      final int top = plan.get(i + 1).startRow();
      if (bottom > 0) {
        copyRow(output, width, bottom - 1, bottom);
      }
      if (top < height - 1) {
        copyRow(output, width, top + 1, top);
      }
    }
    LOGGER.fine(() -> "Reconstructed %dx%d from %d sections".formatted(width, height, sections));
    return new RasterImage(width, height, output);
  }

  private static void copyRow(byte[] image, int width, int from, int to) {
    System.arraycopy(image, from * width, image, to * width, width);
  }
}
