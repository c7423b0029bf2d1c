// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// A TCP backend for [com.github.sobel_cluster.transport.Transport].
///
/// The coordinator listens with a [com.github.sobel_cluster.net.TcpListener] and workers join with
/// [com.github.sobel_cluster.net.TcpTransport#connect]. The group is a star: every worker holds a single connection
/// to rank zero and workers never talk to each other, which is all the section protocol needs.
///
/// Every frame on a connection has the same header:
///
/// ```
/// from: int16, to: int16, channel: int16, length: int32, payload: length bytes
/// ```
package com.github.sobel_cluster.net;
