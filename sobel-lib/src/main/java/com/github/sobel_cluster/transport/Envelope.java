// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

/// A received message together with the rank that really sent it.
public record Envelope<T>(Rank from, Channel channel, T message) {
}
