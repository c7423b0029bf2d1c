// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.net;

import com.github.sobel_cluster.transport.Rank;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/// Joining the group. The worker sends the magic number and protocol version. The coordinator answers with the
/// rank it assigned, which follows accept order, and the size of the group.
record Handshake(Rank rank, int size) {
  static final int MAGIC = 0x534F424C;
  static final short VERSION = 1;

  static void writeHello(DataOutputStream out) throws IOException {
    out.writeInt(MAGIC);
    out.writeShort(VERSION);
    out.flush();
  }

  static void readHello(DataInputStream in) throws IOException {
    final int magic = in.readInt();
    if (magic != MAGIC) {
      throw new IOException("Not a sobel-cluster peer, magic was 0x" + Integer.toHexString(magic));
    }
    final short version = in.readShort();
    if (version != VERSION) {
      throw new IOException("Unsupported protocol version " + version + ", expected " + VERSION);
    }
  }

  void write(DataOutputStream out) throws IOException {
    out.writeShort(rank.id());
    out.writeShort(size);
    out.flush();
  }

  static Handshake read(DataInputStream in) throws IOException {
    final short rank = in.readShort();
    final short size = in.readShort();
    if (rank < 1 || rank >= size) {
      throw new IOException("Coordinator assigned rank " + rank + " in a group of " + size);
    }
    return new Handshake(Rank.of(rank), size);
  }
}
