// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.Ack;
import com.github.dr_ones.msg.FloodRequest;
import com.github.dr_ones.msg.FloodResponse;
import com.github.dr_ones.msg.MsgFragment;
import com.github.dr_ones.msg.Nack;
import com.github.dr_ones.msg.NackType;
import com.github.dr_ones.msg.Packet;
import com.github.dr_ones.msg.PathEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Objects;

/// Builds the replies a node sends back towards the source of a packet. None of these methods send anything.
public final class ControlPackets {
  private ControlPackets() {
  }

  /// Acknowledge a fragment. The ack keeps the session id and is addressed back along the travelled route.
  ///
  /// @param packet a packet whose payload is a [MsgFragment].
  /// @throws IllegalArgumentException if the payload is not a fragment. Callers must classify the packet first.
  public static Packet ack(Packet packet) {
    final var fragment = fragmentOf(packet, "Ack");
    return new Packet(new Ack(fragment.fragmentIndex()), packet.routingHeader().reverse(), packet.sessionId());
  }

  /// Report a failed fragment. The nack keeps the session id and is addressed back along the travelled route.
  ///
  /// @param packet   a packet whose payload is a [MsgFragment].
  /// @param nackType why the fragment failed.
  /// @throws IllegalArgumentException if the payload is not a fragment. Callers must classify the packet first.
  public static Packet nack(Packet packet, NackType nackType) {
    Objects.requireNonNull(nackType, "nackType cannot be null");
    final var fragment = fragmentOf(packet, "Nack");
    return new Packet(new Nack(fragment.fragmentIndex(), nackType), packet.routingHeader().reverse(), packet.sessionId());
  }

  /// Answer a flood. The route back is the path trace reversed with the cursor on the node that sent us the
  /// request. The header of the inbound request is not used as it only ever names the last hop.
  ///
  /// @param request   the request already extended with the answering node.
  /// @param sessionId the session of the response.
  public static Packet floodResponse(FloodRequest request, long sessionId) {
    final var trace = request.pathTrace();
    if (trace.isEmpty()) {
      throw new IllegalArgumentException("cannot answer flood " + request.floodId() + " with an empty path trace");
    }
    final var routeBack = new ArrayList<NodeId>(trace.size());
    for (PathEntry entry : trace) {
      routeBack.add(entry.nodeId());
    }
    Collections.reverse(routeBack);
    final var header = new RoutingHeader(routeBack.size() == 1 ? 0 : 1, routeBack);
    return new Packet(new FloodResponse(request.floodId(), trace), header, sessionId);
  }

  private static MsgFragment fragmentOf(Packet packet, String reply) {
    if (packet.packType() instanceof MsgFragment fragment) {
      return fragment;
    }
    throw new IllegalArgumentException("cannot build " + reply + " for a non-fragment packet: " + packet);
  }
}
