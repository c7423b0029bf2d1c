// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.util.Arrays;

/// The pair of 3x3 gradient masks applied by every worker in a run. Weights are stored flattened in row-major
/// order so `gx[ky * 3 + kx]` is the weight for the neighbour at offset `(kx - 1, ky - 1)`.
public record Kernel(float[] gx, float[] gy) {

  public static final int SIZE = 3;
  public static final int WEIGHTS = SIZE * SIZE;

  /// The canonical Sobel operator.
  public static final Kernel SOBEL = new Kernel(
      new float[]{
          -1, 0, 1,
          -2, 0, 2,
          -1, 0, 1},
      new float[]{
          -1, -2, -1,
          0, 0, 0,
          1, 2, 1});

  public Kernel {
    gx = checked("gx", gx);
    gy = checked("gy", gy);
  }

  public static Kernel of(float[][] gx, float[][] gy) {
    return new Kernel(flatten("gx", gx), flatten("gy", gy));
  }

  private static float[] checked(String name, float[] weights) {
    if (weights == null || weights.length != WEIGHTS) {
      throw new IllegalArgumentException(name + " must have exactly " + WEIGHTS + " weights");
    }
    for (float w : weights) {
      if (!Float.isFinite(w)) {
        throw new IllegalArgumentException(name + " contains a non-finite weight: " + Arrays.toString(weights));
      }
    }
    return weights.clone();
  }

  private static float[] flatten(String name, float[][] matrix) {
    if (matrix == null || matrix.length != SIZE) {
      throw new IllegalArgumentException(name + " must have " + SIZE + " rows");
    }
    final var flat = new float[WEIGHTS];
    for (int row = 0; row < SIZE; row++) {
      if (matrix[row] == null || matrix[row].length != SIZE) {
        throw new IllegalArgumentException(name + " row " + row + " must have " + SIZE + " columns");
      }
      System.arraycopy(matrix[row], 0, flat, row * SIZE, SIZE);
    }
    return flat;
  }

  @Override
  public float[] gx() {
    return gx.clone();
  }

  @Override
  public float[] gy() {
    return gy.clone();
  }

  /// Weight of the horizontal mask at `row`, `column` in 0-2.
  public float gx(int row, int column) {
    return gx[row * SIZE + column];
  }

  public float gy(int row, int column) {
    return gy[row * SIZE + column];
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other == null || getClass() != other.getClass()) {
      return false;
    }
    Kernel that = (Kernel) other;
    return Arrays.equals(gx, that.gx) && Arrays.equals(gy, that.gy);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(gx) + Arrays.hashCode(gy);
  }

  @Override
  public String toString() {
    return "Kernel[gx=" + Arrays.toString(gx) + ", gy=" + Arrays.toString(gy) + "]";
  }
}
