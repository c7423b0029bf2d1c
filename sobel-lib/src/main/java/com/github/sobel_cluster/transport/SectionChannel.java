// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import java.util.List;

/// The message kinds of the coordinator/worker protocol.
///
/// The coordinator sends `KERNEL`, `SECTION_INFO` then `IMAGE_SECTION` to each worker. The worker answers with
/// `RESULT_INFO` then `RESULT_SECTION`. The receiver relies on that sequence as well as on the channel.
/// `PEER_LOST` is never sent by the application. A backend delivers it when the connection to a peer fails.
public enum SectionChannel {
  PEER_LOST((short) 1),
  IMAGE_SECTION((short) 100),
  KERNEL((short) 101),
  SECTION_INFO((short) 102),
  RESULT_INFO((short) 200),
  RESULT_SECTION((short) 201);

  final Channel channel;

  SectionChannel(short id) {
    this.channel = new Channel(id);
  }

  public Channel value() {
    return channel;
  }

  public short id() {
    return channel.id();
  }

  public static List<Channel> applicationChannels() {
    return List.of(IMAGE_SECTION.channel, KERNEL.channel, SECTION_INFO.channel, RESULT_INFO.channel,
        RESULT_SECTION.channel);
  }
}
