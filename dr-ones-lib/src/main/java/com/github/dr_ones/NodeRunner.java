// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.Command;
import com.github.dr_ones.network.Receiver;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;

import static com.github.dr_ones.DrOnesLogger.LOGGER;

/// Drives one [NetworkNode] on its own thread. This is the only thread that ever calls the node so the node needs no
/// locking. Each turn of the loop first applies any pending commands and then waits a short while for a packet.
///
/// The loop stops when:
/// - [#close()] is called,
/// - the node returns true from [NetworkNode#handlePacket(com.github.dr_ones.msg.Packet)],
/// - the packet receiver has been closed and is empty,
/// - the node throws. The failure is logged and [#isFailed()] becomes true. Other nodes keep running.
public class NodeRunner implements AutoCloseable {
  static final Duration POLL_INTERVAL = Duration.ofMillis(20);

  private final NetworkNode node;
  private final Receiver<Command> commands;
  private final Thread thread;

  private volatile boolean running = true;
  private volatile boolean failed = false;

  public NodeRunner(NetworkNode node, Receiver<Command> commands) {
    this.node = Objects.requireNonNull(node, "node cannot be null");
    this.commands = Objects.requireNonNull(commands, "commands cannot be null");
    this.thread = new Thread(this::loop, "node-" + node.id());
    this.thread.setDaemon(true);
  }

  public NodeRunner start() {
    thread.start();
    LOGGER.fine(() -> "Started " + thread.getName() + " as " + node.nodeType());
    return this;
  }

  private void loop() {
    final var packets = node.packetReceiver();
    try {
      while (running) {
        var command = commands.tryReceive();
        while (running && command.isPresent()) {
          node.handleCommand(command.get());
          command = commands.tryReceive();
        }
        final var packet = packets.poll(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
        if (packet.isPresent()) {
          if (node.handlePacket(packet.get())) {
            LOGGER.fine(() -> node.id() + " finished");
            running = false;
          }
        } else if (packets.isClosed()) {
          LOGGER.fine(() -> node.id() + " packet channel closed");
          running = false;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.fine(() -> node.id() + " interrupted while waiting for packets");
    } catch (RuntimeException e) {
      failed = true;
      LOGGER.log(Level.SEVERE, "Node " + node.id() + " failed and has stopped: " + e, e);
    } finally {
      running = false;
    }
  }

  public NetworkNode node() {
    return node;
  }

  public boolean isRunning() {
    return thread.isAlive();
  }

  /// @return true if the node threw out of the loop.
  public boolean isFailed() {
    return failed;
  }

  /// Waits for the loop to finish by itself.
  ///
  /// @return true if it finished within the timeout.
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    thread.join(timeout.toMillis());
    return !thread.isAlive();
  }

  @Override
  public void close() {
    running = false;
    thread.interrupt();
    try {
      thread.join(POLL_INTERVAL.multipliedBy(50).toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
