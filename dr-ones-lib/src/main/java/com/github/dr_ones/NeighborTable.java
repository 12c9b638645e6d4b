// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.Packet;
import com.github.dr_ones.network.Sender;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/// The outbound channels of a node keyed by the neighbour they lead to. It is owned by a single node and only
/// touched from that node's thread so it is not thread safe. Iteration is in ascending node id order.
public class NeighborTable {
  private final NavigableMap<NodeId, Sender<Packet>> senders = new TreeMap<>();

  public NeighborTable() {
  }

  public NeighborTable(Map<NodeId, Sender<Packet>> initial) {
    senders.putAll(initial);
  }

  /// Adds the neighbour or replaces its channel.
  public void add(NodeId id, Sender<Packet> sender) {
    senders.put(Objects.requireNonNull(id), Objects.requireNonNull(sender));
  }

  /// @return whether there was a neighbour to remove.
  public boolean remove(NodeId id) {
    return senders.remove(id) != null;
  }

  public Optional<Sender<Packet>> sender(NodeId id) {
    return Optional.ofNullable(senders.get(id));
  }

  public boolean contains(NodeId id) {
    return senders.containsKey(id);
  }

  public int size() {
    return senders.size();
  }

  public boolean isEmpty() {
    return senders.isEmpty();
  }

  public List<NodeId> ids() {
    return List.copyOf(senders.keySet());
  }

  /// @return a snapshot of every neighbour other than `excluded`.
  public NavigableMap<NodeId, Sender<Packet>> excluding(NodeId excluded) {
    final var others = new TreeMap<>(senders);
    others.remove(excluded);
    return Collections.unmodifiableNavigableMap(others);
  }

  @Override
  public String toString() {
    return "NeighborTable" + senders.keySet();
  }
}
