// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

import com.github.dr_ones.NodeId;
import com.github.dr_ones.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Network discovery request. Every node that sees it appends itself to the path trace before it either fans it
/// out or answers with a [FloodResponse]. A flood is identified by the initiator together with the flood id as
/// different initiators pick their flood ids independently.
///
/// @param floodId     chosen by the initiator.
/// @param initiatorId the node that started the flood.
/// @param pathTrace   the nodes visited so far in visiting order. The initiator puts itself first.
public record FloodRequest(long floodId, NodeId initiatorId, List<PathEntry> pathTrace) implements PacketType {
  public FloodRequest {
    Objects.requireNonNull(initiatorId, "initiatorId cannot be null");
    pathTrace = List.copyOf(pathTrace);
  }

  /// The request an initiator sends out. Its trace holds only the initiator.
  public static FloodRequest initiate(long floodId, NodeId initiatorId, NodeType initiatorType) {
    return new FloodRequest(floodId, initiatorId, List.of(new PathEntry(initiatorId, initiatorType)));
  }

  /// @return a copy of this request with the given node appended to the trace.
  public FloodRequest withHop(NodeId nodeId, NodeType nodeType) {
    final var extended = new ArrayList<PathEntry>(pathTrace.size() + 1);
    extended.addAll(pathTrace);
    extended.add(new PathEntry(nodeId, nodeType));
    return new FloodRequest(floodId, initiatorId, extended);
  }

  /// @return the last node in the trace which is the one that sent us the request.
  /// @throws IllegalArgumentException if the trace is empty.
  public NodeId lastHop() {
    if (pathTrace.isEmpty()) {
      throw new IllegalArgumentException("flood request " + floodId + " from " + initiatorId + " has an empty path trace");
    }
    return pathTrace.get(pathTrace.size() - 1).nodeId();
  }
}
