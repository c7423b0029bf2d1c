// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.sobel_cluster.ClusterLogger.LOGGER;

/// Computes the gradient magnitude `sqrt(Gx² + Gy²)` of one section.
///
/// Only interior pixels are computed. The outermost row and column on every side of the section stay zero even
/// when that row is really an internal seam of the full image, because a worker never sees its neighbours' rows.
/// Neighbour samples outside the section contribute nothing to the sums.
///
/// Each output row depends only on the input rows either side of it, so the interior rows are split into
/// contiguous shards that run on a fixed pool. Shards write disjoint ranges of the output and the result is
/// byte-identical whatever the shard count.
public class ConvolutionEngine implements AutoCloseable {

  static final int CORE_SHARE_PERCENT = 75;

  private final int parallelism;
  private final ExecutorService pool;

  public ConvolutionEngine() {
    this(defaultParallelism());
  }

  public ConvolutionEngine(int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
    }
    this.parallelism = parallelism;
    this.pool = parallelism == 1 ? null : Executors.newFixedThreadPool(parallelism, new ShardThreadFactory());
    LOGGER.fine(() -> "Convolution engine using " + parallelism + " threads");
  }

  /// Three quarters of the logical cores and never less than one, leaving headroom on the host.
  public static int defaultParallelism() {
    return parallelismFor(Runtime.getRuntime().availableProcessors());
  }

  static int parallelismFor(int cores) {
    return Math.max(1, cores * CORE_SHARE_PERCENT / 100);
  }

  public int parallelism() {
    return parallelism;
  }

  public RasterImage convolve(RasterImage section, Kernel kernel) {
    return convolve(section, kernel, parallelism);
  }

  /// Convolves with the interior rows split into at most `shards` ranges.
  public RasterImage convolve(RasterImage section, Kernel kernel, int shards) {
    if (shards < 1) {
      throw new IllegalArgumentException("shards must be positive: " + shards);
    }
    final int width = section.width();
    final int height = section.height();
    final byte[] source = section.pixels();
    final byte[] output = new byte[source.length];

    final int firstRow = 1;
    final int endRow = height - 1;
    final int interiorRows = endRow - firstRow;
    if (interiorRows <= 0 || width < 3) {
      LOGGER.finer(() -> "Section %dx%d has no interior pixels".formatted(width, height));
      return new RasterImage(width, height, output);
    }

    final int effectiveShards = Math.min(shards, interiorRows);
    if (effectiveShards == 1 || pool == null) {
      convolveRows(source, width, height, kernel, output, firstRow, endRow);
    } else {
      runSharded(source, width, height, kernel, output, firstRow, interiorRows, effectiveShards);
    }
    return new RasterImage(width, height, output);
  }

  private void runSharded(byte[] source, int width, int height, Kernel kernel, byte[] output,
                          int firstRow, int interiorRows, int shards) {
    final int base = interiorRows / shards;
    final int extra = interiorRows % shards;
    final List<Future<?>> futures = new ArrayList<>(shards);
    int from = firstRow;
    for (int shard = 0; shard < shards; shard++) {
      final int rows = base + (shard < extra ? 1 : 0);
      final int shardFrom = from;
      final int shardTo = from + rows;
      futures.add(pool.submit(() -> convolveRows(source, width, height, kernel, output, shardFrom, shardTo)));
      from = shardTo;
    }
    LOGGER.finest(() -> "Submitted " + shards + " shards over " + interiorRows + " rows");
    try {
      for (Future<?> future : futures) {
        future.get();
      }
    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while convolving", e);
    } catch (ExecutionException e) {
      throw new IllegalStateException("Convolution shard failed: " + e.getCause(), e.getCause());
    }
  }

  /// Writes output rows `[fromRow, toRow)` for interior columns only.
  static void convolveRows(byte[] source, int width, int height, Kernel kernel, byte[] output,
                           int fromRow, int toRow) {
    for (int y = fromRow; y < toRow; y++) {
      for (int x = 1; x < width - 1; x++) {
        float gx = 0.0f;
        float gy = 0.0f;
        for (int ky = -1; ky <= 1; ky++) {
          final int sy = y + ky;
          if (sy < 0 || sy >= height) {
            continue;
          }
          for (int kx = -1; kx <= 1; kx++) {
            final int sx = x + kx;
            if (sx < 0 || sx >= width) {
              continue;
            }
            final float value = source[sy * width + sx] & 0xFF;
            gx += value * kernel.gx(ky + 1, kx + 1);
            gy += value * kernel.gy(ky + 1, kx + 1);
          }
        }
        output[y * width + x] = magnitude(gx, gy);
      }
    }
  }

  /// `clamp(round(sqrt(gx² + gy²)), 0, 255)`
  static byte magnitude(float gx, float gy) {
    final long rounded = Math.round(Math.sqrt((double) gx * gx + (double) gy * gy));
    return (byte) Math.max(0, Math.min(255, rounded));
  }

  @Override
  public void close() {
    if (pool == null) {
      return;
    }
    pool.shutdown();
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class ShardThreadFactory implements ThreadFactory {
    private static final AtomicInteger ENGINES = new AtomicInteger();
    private final int engine = ENGINES.incrementAndGet();
    private final AtomicInteger count = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      final var thread = new Thread(runnable, "convolve-" + engine + "-" + count.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
