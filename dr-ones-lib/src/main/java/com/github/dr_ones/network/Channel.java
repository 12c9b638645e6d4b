// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.network;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/// An unbounded in process channel with many producers and one consumer. The [Sender] may be handed to any number
/// of neighbours while only the owning node drains the [Receiver]. Once the receiver is closed every send fails with
/// a [ChannelClosedException].
public final class Channel<T> {
  private final Sender<T> sender;
  private final Receiver<T> receiver;

  private Channel(String name) {
    final var queue = new LinkedBlockingQueue<T>();
    final var closed = new AtomicBoolean(false);
    this.sender = new Sender<>(name, queue, closed);
    this.receiver = new Receiver<>(name, queue, closed);
  }

  public static <T> Channel<T> unbounded(String name) {
    return new Channel<>(name);
  }

  public static <T> Channel<T> unbounded() {
    return new Channel<>("channel");
  }

  public Sender<T> sender() {
    return sender;
  }

  public Receiver<T> receiver() {
    return receiver;
  }
}
