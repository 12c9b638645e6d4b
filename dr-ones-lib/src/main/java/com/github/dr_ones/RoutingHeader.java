// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// A source route. The `hops` are every node the packet visits from its source to its destination and the
/// `hopIndex` is the cursor into that list. While a packet is in flight `0 <= hopIndex < hops.size()`.
///
/// The header is only read while forwarding. The node specific code advances the cursor with [#advance()]
/// before handing a packet to the router, and replies are addressed with [#reverse()].
///
/// @param hopIndex the position of the hop the packet is to be delivered to next.
/// @param hops     the node identifiers of the whole path in travel order.
public record RoutingHeader(int hopIndex, List<NodeId> hops) {
  public RoutingHeader {
    Objects.requireNonNull(hops, "hops cannot be null");
    if (hopIndex < 0) {
      throw new IllegalArgumentException("hopIndex must be non-negative but was " + hopIndex);
    }
    hops = List.copyOf(hops);
  }

  public static RoutingHeader of(int hopIndex, int... hops) {
    final var ids = new ArrayList<NodeId>(hops.length);
    for (int hop : hops) {
      ids.add(NodeId.of(hop));
    }
    return new RoutingHeader(hopIndex, ids);
  }

  /// The single hop header used when a node sends straight to one of its neighbours.
  public static RoutingHeader direct(NodeId self, NodeId neighbour) {
    return new RoutingHeader(1, List.of(self, neighbour));
  }

  /// @return the hop at the cursor. This does not move the cursor.
  /// @throws IllegalStateException if the cursor is outside the hop list.
  public NodeId nextHop() {
    if (hopIndex >= hops.size()) {
      throw new IllegalStateException("hopIndex " + hopIndex + " is outside of hops " + hops);
    }
    return hops.get(hopIndex);
  }

  /// Same as [#nextHop()]. Reads better on the receiving side where the cursor names the node itself.
  public NodeId currentHop() {
    return nextHop();
  }

  /// @return a copy with the cursor moved one hop towards the destination.
  public RoutingHeader advance() {
    return new RoutingHeader(hopIndex + 1, hops);
  }

  public boolean isLastHop() {
    return hopIndex == hops.size() - 1;
  }

  public int length() {
    return hops.size();
  }

  public NodeId source() {
    if (hops.isEmpty()) {
      throw new IllegalStateException("empty route has no source");
    }
    return hops.get(0);
  }

  public NodeId destination() {
    if (hops.isEmpty()) {
      throw new IllegalStateException("empty route has no destination");
    }
    return hops.get(hops.size() - 1);
  }

  /// Turns the route around so that a reply goes back to where the packet came from. The hops past the cursor were
  /// never travelled so they are dropped. What remains is reversed and the cursor is put on index 1 as index 0 is
  /// the replying node itself. A route that has shrunk to a single node reverses to itself with the cursor at 0.
  public RoutingHeader reverse() {
    if (hopIndex >= hops.size()) {
      throw new IllegalStateException("cannot reverse with hopIndex " + hopIndex + " outside of hops " + hops);
    }
    final var travelled = new ArrayList<>(hops.subList(0, hopIndex + 1));
    Collections.reverse(travelled);
    return new RoutingHeader(travelled.size() == 1 ? 0 : 1, travelled);
  }

  @Override
  public String toString() {
    return "[" + hopIndex + "@" + hops + "]";
  }
}
