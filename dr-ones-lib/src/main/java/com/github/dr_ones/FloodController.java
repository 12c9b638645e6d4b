// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.FloodRequest;
import com.github.dr_ones.msg.Packet;

import static com.github.dr_ones.DrOnesLogger.LOGGER;

/// Network discovery by controlled flooding. Each node decides locally, on every flood request it receives, to either
/// answer or pass the request on:
///
/// 1. The node that sent us the request is the last entry of the path trace.
/// 2. We append ourselves to the trace.
/// 3. If we have already fanned out this flood, or our only neighbour is the one that sent it, we answer with a
///    flood response routed back along the reversed trace.
/// 4. Otherwise we remember the flood and fan the extended request out to every other neighbour.
///
/// A flood is remembered by its [FloodKey] of initiator and flood id for the life of the node. Two initiators that
/// happen to use the same flood id are separate floods.
public final class FloodController {
  private FloodController() {
  }

  /// @throws IllegalArgumentException if the packet is not a flood request or its path trace is empty.
  public static void handle(NetworkNode node, Packet packet, NodeType nodeType) {
    if (!(packet.packType() instanceof FloodRequest request)) {
      throw new IllegalArgumentException("not a flood request: " + packet);
    }
    final var self = node.id();
    final var receivedFrom = request.lastHop();
    final var extended = request.withHop(self, nodeType);
    final var key = FloodKey.of(request);

    final var alreadySeen = node.seenFloods().contains(key);
    final var deadEnd = node.neighbors().size() == 1;

    if (alreadySeen || deadEnd) {
      final var response = ControlPackets.floodResponse(extended, node.random().nextLong());
      LOGGER.fine(() -> self + " answering flood " + key + " seen=" + alreadySeen + " deadEnd=" + deadEnd
          + " trace=" + extended.pathTrace());
      node.forwardPacket(response);
    } else {
      node.seenFloods().add(key);
      if (node.neighbors().isEmpty()) {
        node.log().status(self, "no neighbours to pass flood " + key + " on to");
      }
      LOGGER.fine(() -> self + " fanning out flood " + key + " to " + node.neighbors().excluding(receivedFrom).keySet());
      node.broadcastPacket(packet.withPackType(extended), receivedFrom);
    }
  }
}
