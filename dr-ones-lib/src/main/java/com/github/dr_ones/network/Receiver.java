// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.network;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/// The receiving side of a [Channel]. Only the owning node reads from it.
public final class Receiver<T> {
  private final String name;
  private final BlockingQueue<T> queue;
  private final AtomicBoolean closed;

  Receiver(String name, BlockingQueue<T> queue, AtomicBoolean closed) {
    this.name = name;
    this.queue = queue;
    this.closed = closed;
  }

  /// Waits up to the timeout for a message.
  public Optional<T> poll(long timeout, TimeUnit unit) throws InterruptedException {
    return Optional.ofNullable(queue.poll(timeout, unit));
  }

  public Optional<T> tryReceive() {
    return Optional.ofNullable(queue.poll());
  }

  /// Removes and returns everything currently queued.
  public List<T> drain() {
    final var drained = new ArrayList<T>(queue.size());
    queue.drainTo(drained);
    return drained;
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  /// After this every [Sender#send(Object)] fails. Messages already queued may still be read.
  public void close() {
    closed.set(true);
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public String toString() {
    return "Receiver[" + name + "]";
  }
}
