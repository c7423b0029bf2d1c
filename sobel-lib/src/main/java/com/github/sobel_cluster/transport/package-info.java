// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The transport package abstracts the point to point messaging between the coordinator and its workers.
///
/// Key types:
/// - `Transport`: blocking send and receive with per-peer ordering, an any-source receive and rank/size discovery
/// - `Rank`: identity of a process in the group where rank zero is the coordinator
/// - `Channel`: tags the kind of message, see `SectionChannel`
/// - `Pickler`: serialises the value sent on one channel
/// - `InMemoryCluster`: an in-process group for tests and single host runs
///
/// Design characteristics:
/// 1. Every message is pickled on send so a receiver never shares a buffer with its sender
/// 2. Messages from one peer are received in the order they were sent
/// 3. There is no ordering between different peers
/// 4. Blocking calls have no timeout unless the caller passes one
package com.github.sobel_cluster.transport;
