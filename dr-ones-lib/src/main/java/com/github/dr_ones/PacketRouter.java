// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.NodeEvent;
import com.github.dr_ones.msg.Packet;
import com.github.dr_ones.network.ChannelClosedException;

import static com.github.dr_ones.DrOnesLogger.LOGGER;

/// Puts packets onto neighbour channels and tells the simulation controller about every send.
public final class PacketRouter {
  private PacketRouter() {
  }

  /// Delivers the packet to the hop at the cursor of its routing header. The cursor must already point at that hop.
  ///
  /// If the hop is not a neighbour the packet is dropped and only a status line is logged. Otherwise a
  /// [NodeEvent.PacketSent] is emitted, where failing to emit it is logged and ignored, and the packet is sent.
  ///
  /// @throws IllegalStateException if the neighbour channel is closed.
  public static void forward(NetworkNode node, Packet packet) {
    final var nextHop = packet.routingHeader().nextHop();
    final var sender = node.neighbors().sender(nextHop);
    if (sender.isEmpty()) {
      node.log().status(node.id(), "No channel found for next hop: " + nextHop);
      return;
    }
    emitPacketSent(node, packet);
    try {
      sender.get().send(packet);
    } catch (ChannelClosedException e) {
      throw new IllegalStateException("Failed to forward the packet to " + nextHop + ": " + packet, e);
    }
    LOGGER.finer(() -> node.id() + " ~> " + nextHop + " " + packet);
  }

  /// Sends a copy of the packet to every neighbour except `receivedFrom`. Each copy gets its own direct header
  /// `[self, neighbour]` with the cursor on the neighbour. A closed neighbour channel is logged and the remaining
  /// neighbours are still served.
  public static void broadcast(NetworkNode node, Packet packet, NodeId receivedFrom) {
    final var self = node.id();
    node.neighbors().excluding(receivedFrom).forEach((neighbour, sender) -> {
      final var copy = packet.withRoutingHeader(RoutingHeader.direct(self, neighbour));
      emitPacketSent(node, copy);
      try {
        sender.send(copy);
        LOGGER.finer(() -> self + " ~> " + neighbour + " " + copy);
      } catch (ChannelClosedException e) {
        node.log().error(self, "Failed to send packet to NodeId " + neighbour + ": " + e.getMessage());
      }
    });
  }

  static void emitPacketSent(NetworkNode node, Packet packet) {
    emit(node, new NodeEvent.PacketSent(packet));
  }

  /// Sends the event to the simulation controller. A closed event channel is logged and otherwise ignored.
  static void emit(NetworkNode node, NodeEvent event) {
    try {
      node.eventSender().send(event);
    } catch (ChannelClosedException e) {
      node.log().error(node.id(), "Failed to send " + event.getClass().getSimpleName() + " event: " + e.getMessage());
    }
  }
}
