// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import com.github.sobel_cluster.TransportException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static com.github.sobel_cluster.transport.SectionChannel.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MailboxTest {
  static final Rank ONE = Rank.of(1);
  static final Rank TWO = Rank.of(2);

  static Frame frame(Rank from, SectionChannel channel, int marker) {
    return new Frame(from, channel.value(), new byte[]{(byte) marker});
  }

  static Optional<Frame> take(Mailbox mailbox, Rank from, SectionChannel channel) throws InterruptedException {
    return mailbox.take(Optional.ofNullable(from), channel.value(), Optional.of(Duration.ofMillis(50)));
  }

  @Test
  void framesFromOnePeerStayInOrder() throws InterruptedException {
    final var mailbox = new Mailbox();
    mailbox.deliver(frame(ONE, RESULT_INFO, 1));
    mailbox.deliver(frame(TWO, RESULT_INFO, 9));
    mailbox.deliver(frame(ONE, RESULT_INFO, 2));

    assertThat(take(mailbox, ONE, RESULT_INFO).orElseThrow().payload()).containsExactly(1);
    assertThat(take(mailbox, ONE, RESULT_INFO).orElseThrow().payload()).containsExactly(2);
    assertThat(take(mailbox, null, RESULT_INFO).orElseThrow().from()).isEqualTo(TWO);
    assertThat(mailbox.pending()).isZero();
  }

  @Test
  void receiveMatchesOnChannel() throws InterruptedException {
    final var mailbox = new Mailbox();
    mailbox.deliver(frame(ONE, RESULT_SECTION, 5));
    mailbox.deliver(frame(ONE, RESULT_INFO, 4));

    assertThat(take(mailbox, null, RESULT_INFO).orElseThrow().payload()).containsExactly(4);
    assertThat(take(mailbox, ONE, RESULT_SECTION).orElseThrow().payload()).containsExactly(5);
  }

  @Test
  void timeoutReturnsEmpty() throws InterruptedException {
    final var mailbox = new Mailbox();
    mailbox.deliver(frame(ONE, RESULT_SECTION, 5));
    assertThat(take(mailbox, null, RESULT_INFO)).isEmpty();
    assertThat(take(mailbox, TWO, RESULT_SECTION)).isEmpty();
  }

  @Test
  void lostPeerFailsEveryDirectedReceiveButOnlyOneAnySourceReceive() throws InterruptedException {
    final var mailbox = new Mailbox();
    mailbox.deliver(Frame.peerLost(ONE, "gone"));

    assertThat(take(mailbox, ONE, KERNEL).orElseThrow().isPeerLost()).isTrue();
    assertThat(take(mailbox, ONE, SECTION_INFO).orElseThrow().isPeerLost()).isTrue();
    assertThat(take(mailbox, TWO, KERNEL)).isEmpty();

    final var any = take(mailbox, null, RESULT_INFO).orElseThrow();
    assertThat(any.isPeerLost()).isTrue();
    assertThat(any.reason()).isEqualTo("gone");
    assertThat(take(mailbox, null, RESULT_INFO)).isEmpty();
  }

  @Test
  void blockedReceiverWakesOnDelivery() throws Exception {
    final var mailbox = new Mailbox();
    final var received = CompletableFuture.supplyAsync(() -> {
      try {
        return mailbox.take(Optional.of(ONE), KERNEL.value(), Optional.empty()).orElseThrow();
      } catch (InterruptedException e) {
        throw new IllegalStateException(e);
      }
    });
    Thread.sleep(20);
    mailbox.deliver(frame(ONE, KERNEL, 7));
    assertThat(received.get(5, TimeUnit.SECONDS).payload()).containsExactly(7);
  }

  @Test
  void closeFailsBlockedReceiver() throws Exception {
    final var mailbox = new Mailbox();
    final var received = CompletableFuture.runAsync(() -> {
      try {
        mailbox.take(Optional.empty(), KERNEL.value(), Optional.empty());
      } catch (InterruptedException e) {
        throw new IllegalStateException(e);
      }
    });
    Thread.sleep(20);
    mailbox.close();
    assertThatThrownBy(() -> received.get(5, TimeUnit.SECONDS))
        .hasCauseInstanceOf(TransportException.class);
    assertThat(mailbox.isClosed()).isTrue();
  }
}
