// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.Packet;
import com.github.dr_ones.network.Channel;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class NeighborTableTest {

  @Test
  public void removeOfUnknownIdDoesNothing() {
    final var table = new NeighborTable(Map.of(
        NodeId.of(1), Channel.<Packet>unbounded().sender(),
        NodeId.of(2), Channel.<Packet>unbounded().sender()));

    assertThat(table.remove(NodeId.of(3))).isFalse();
    assertThat(table.size()).isEqualTo(2);
    assertThat(table.remove(NodeId.of(1))).isTrue();
    assertThat(table.ids()).containsExactly(NodeId.of(2));
  }

  @Test
  public void excludingIsASortedSnapshot() {
    final var table = new NeighborTable();
    table.add(NodeId.of(9), Channel.<Packet>unbounded().sender());
    table.add(NodeId.of(3), Channel.<Packet>unbounded().sender());
    table.add(NodeId.of(5), Channel.<Packet>unbounded().sender());

    final var others = table.excluding(NodeId.of(5));
    table.remove(NodeId.of(9));

    assertThat(others.keySet()).containsExactly(NodeId.of(3), NodeId.of(9));
    assertThat(table.contains(NodeId.of(9))).isFalse();
  }

  @Test
  public void excludingAStrangerKeepsEveryone() {
    final var table = new NeighborTable();
    table.add(NodeId.of(1), Channel.<Packet>unbounded().sender());
    assertThat(table.excluding(NodeId.of(7)).keySet()).containsExactly(NodeId.of(1));
  }
}
