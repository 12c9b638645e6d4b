// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

import com.github.dr_ones.RoutingHeader;

import java.util.Objects;

/// The envelope that travels between nodes.
///
/// @param packType      the payload.
/// @param routingHeader where the packet is going and where it is now.
/// @param sessionId     correlates related packets such as the fragments of one message and their acks.
public record Packet(PacketType packType, RoutingHeader routingHeader, long sessionId) {
  public Packet {
    Objects.requireNonNull(packType, "packType cannot be null");
    Objects.requireNonNull(routingHeader, "routingHeader cannot be null");
  }

  public static Packet fragment(RoutingHeader routingHeader, long sessionId, MsgFragment fragment) {
    return new Packet(fragment, routingHeader, sessionId);
  }

  public static Packet floodRequest(RoutingHeader routingHeader, long sessionId, FloodRequest floodRequest) {
    return new Packet(floodRequest, routingHeader, sessionId);
  }

  public Packet withRoutingHeader(RoutingHeader header) {
    return new Packet(packType, header, sessionId);
  }

  public Packet withPackType(PacketType type) {
    return new Packet(type, routingHeader, sessionId);
  }
}
