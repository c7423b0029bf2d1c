// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// This package contains the core classes for distributed edge detection over a row partitioned image.
///
/// A single [com.github.sobel_cluster.Coordinator] at rank zero plans the partition of a
/// [com.github.sobel_cluster.RasterImage] into horizontal sections, dispatches one section to each worker
/// over a [com.github.sobel_cluster.transport.Transport], collects the results in any order and reassembles the
/// output image. Workers are stateless: each runs a [com.github.sobel_cluster.SectionWorker] that convolves only
/// the rows it was sent.
///
/// Supporting classes:
/// - [com.github.sobel_cluster.PartitionPlanner]: splits the image height into contiguous sections where the last
///   section absorbs the remainder rows.
/// - [com.github.sobel_cluster.Kernel] and [com.github.sobel_cluster.KernelResolver]: the immutable pair of 3x3
///   gradient masks resolved once per run.
/// - [com.github.sobel_cluster.ConvolutionEngine]: computes gradient magnitude for one section, sharding rows over
///   a bounded local thread pool.
/// - [com.github.sobel_cluster.SeamReconstructor]: stitches the sections back together and overwrites the two rows
///   either side of each seam with their inner neighbours. Workers never exchange halo rows so each one leaves a
///   black border at its own edges. The nearest row copy hides that border. It is an approximation and not the
///   true gradient at the seam.
/// - [com.github.sobel_cluster.ClusterException]: the unchecked failure hierarchy. Any missing section fails the
///   whole run. No partial image is ever produced.
package com.github.sobel_cluster;
