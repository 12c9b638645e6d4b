// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

/// The identifier of a drone, client or server. It is unique within one simulated network and fits in an unsigned byte.
public record NodeId(short id) implements Comparable<NodeId> {
  public static final short MAX_ID = 255;

  public NodeId {
    if (id < 0 || id > MAX_ID) throw new IllegalArgumentException("Node ID must be in [0, " + MAX_ID + "] but was " + id);
  }

  public static NodeId of(int id) {
    if (id < 0 || id > MAX_ID) throw new IllegalArgumentException("Node ID must be in [0, " + MAX_ID + "] but was " + id);
    return new NodeId((short) id);
  }

  @Override
  public int compareTo(NodeId other) {
    return Short.compare(id, other.id);
  }

  @Override
  public String toString() {
    return Short.toString(id);
  }
}
