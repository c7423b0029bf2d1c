// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeamReconstructorTest {

  /// Each result row is filled with its own global row number so the seam copies can be read off directly.
  static List<ResultSection> labelledResults(List<SectionInfo> plan) {
    final List<ResultSection> results = new ArrayList<>();
    for (SectionInfo info : plan) {
      results.add(new ResultSection(info,
          RasterImage.generate(info.width(), info.numRows(), (x, y) -> 10 * (info.startRow() + y))));
    }
    return results;
  }

  @Test
  void seamRowsTakeTheirInnerNeighbour() {
    final var plan = PartitionPlanner.plan(10, 4, 2);
    final var image = SeamReconstructor.reconstruct(labelledResults(plan), plan, 4, 10);

    assertThat(image.row(4)).isEqualTo(image.row(3));
    assertThat(image.row(5)).isEqualTo(image.row(6));
    assertThat(image.sample(0, 4)).isEqualTo(30);
    assertThat(image.sample(0, 5)).isEqualTo(60);
    for (int y : new int[]{0, 1, 2, 3, 6, 7, 8, 9}) {
      assertThat(image.sample(2, y)).as("row %d", y).isEqualTo(10 * y);
    }
  }

  @Test
  void arrivalOrderDoesNotMatter() {
    final var plan = PartitionPlanner.plan(23, 5, 4);
    final var inOrder = labelledResults(plan);
    final var reversed = new ArrayList<>(inOrder);
    Collections.reverse(reversed);
    final var shuffled = new ArrayList<>(inOrder);
    Collections.swap(shuffled, 0, 2);

    final var expected = SeamReconstructor.reconstruct(inOrder, plan, 5, 23);
    assertThat(SeamReconstructor.reconstruct(reversed, plan, 5, 23)).isEqualTo(expected);
    assertThat(SeamReconstructor.reconstruct(shuffled, plan, 5, 23)).isEqualTo(expected);
  }

  @Test
  void singleSectionHasNoSeams() {
    final var plan = PartitionPlanner.plan(6, 3, 1);
    final var results = labelledResults(plan);
    assertThat(SeamReconstructor.reconstruct(results, plan, 3, 6)).isEqualTo(results.get(0).pixels());
  }

  @Test
  void missingSectionIsNamed() {
    final var plan = PartitionPlanner.plan(12, 4, 3);
    final var results = labelledResults(plan);
    results.remove(1);

    assertThatThrownBy(() -> SeamReconstructor.reconstruct(results, plan, 4, 12))
        .isInstanceOfSatisfying(ReconstructionException.class, e -> {
          assertThat(e.sectionId()).hasValue(1);
          assertThat(e.getMessage()).contains("[1]");
        });
  }

  @Test
  void duplicateSectionIsRejected() {
    final var plan = PartitionPlanner.plan(12, 4, 3);
    final var results = labelledResults(plan);
    results.add(results.get(2));

    assertThatThrownBy(() -> SeamReconstructor.reconstruct(results, plan, 4, 12))
        .isInstanceOf(ReconstructionException.class)
        .hasMessageContaining("Duplicate");
  }

  @Test
  void outOfRangeSectionIsRejected() {
    final var plan = PartitionPlanner.plan(12, 4, 3);
    final var results = labelledResults(plan);
    results.add(new ResultSection(new SectionInfo(3, 0, 1, 4), RasterImage.filled(4, 1, 0)));

    assertThatThrownBy(() -> SeamReconstructor.reconstruct(results, plan, 4, 12))
        .isInstanceOfSatisfying(ReconstructionException.class, e -> assertThat(e.sectionId()).hasValue(3));
  }

  @Test
  void resultThatDisagreesWithThePlanIsRejected() {
    final var plan = PartitionPlanner.plan(12, 4, 3);
    final var results = labelledResults(plan);
    results.set(0, new ResultSection(new SectionInfo(0, 1, 4, 4), RasterImage.filled(4, 4, 0)));

    assertThatThrownBy(() -> SeamReconstructor.reconstruct(results, plan, 4, 12))
        .isInstanceOf(ReconstructionException.class)
        .hasMessageContaining("does not match");
  }
}
