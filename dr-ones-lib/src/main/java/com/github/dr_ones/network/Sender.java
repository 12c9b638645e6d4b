// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.network;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/// The sending side of a [Channel]. It is safe to share between threads.
public final class Sender<T> {
  private final String name;
  private final BlockingQueue<T> queue;
  private final AtomicBoolean closed;

  Sender(String name, BlockingQueue<T> queue, AtomicBoolean closed) {
    this.name = name;
    this.queue = queue;
    this.closed = closed;
  }

  /// Enqueues the message. This never blocks as the channel is unbounded.
  ///
  /// @throws ChannelClosedException if the receiving side has been closed.
  public void send(T msg) throws ChannelClosedException {
    Objects.requireNonNull(msg, "msg cannot be null");
    if (closed.get()) {
      throw new ChannelClosedException(name);
    }
    queue.add(msg);
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public String toString() {
    return "Sender[" + name + "]";
  }
}
