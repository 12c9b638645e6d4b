// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.*;
import com.github.dr_ones.network.Channel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PacketRouterTest {
  static {
    LoggerConfig.initialize();
  }

  Channel<NodeEvent> controller;
  RecordingNodeLog log;
  TestNode node;

  @BeforeEach
  void setUp() {
    controller = Channel.unbounded("controller");
    log = new RecordingNodeLog();
    node = new TestNode(1, NodeType.DRONE, controller.sender(), log);
  }

  @Test
  public void forwardSendsToTheHopAtTheCursorAndReportsTheSamePacket() {
    final var neighbour = Channel.<Packet>unbounded("node-2");
    node.addChannel(NodeId.of(2), neighbour.sender());
    final var packet = new Packet(new Ack(0), RoutingHeader.of(1, 1, 2), 42L);

    node.forwardPacket(packet);

    assertThat(neighbour.receiver().tryReceive()).contains(packet);
    assertThat(controller.receiver().tryReceive()).contains(new NodeEvent.PacketSent(packet));
    assertThat(log.errorLines).isEmpty();
  }

  @Test
  public void forwardToUnknownHopDropsAndLogs() {
    final var neighbour = Channel.<Packet>unbounded("node-2");
    node.addChannel(NodeId.of(2), neighbour.sender());
    final var packet = new Packet(new Ack(0), RoutingHeader.of(1, 1, 5), 42L);

    node.forwardPacket(packet);

    assertThat(neighbour.receiver().isEmpty()).isTrue();
    assertThat(controller.receiver().isEmpty()).isTrue();
    assertThat(log.statusLines).containsExactly("1: No channel found for next hop: 5");
  }

  @Test
  public void forwardStillDeliversWhenTheControllerIsGone() {
    final var neighbour = Channel.<Packet>unbounded("node-2");
    node.addChannel(NodeId.of(2), neighbour.sender());
    controller.receiver().close();
    final var packet = new Packet(new Ack(0), RoutingHeader.of(1, 1, 2), 42L);

    node.forwardPacket(packet);

    assertThat(neighbour.receiver().tryReceive()).contains(packet);
    assertThat(log.errorLines).singleElement().asString().contains("Failed to send PacketSent event");
  }

  @Test
  public void forwardToClosedNeighbourIsFatal() {
    final var neighbour = Channel.<Packet>unbounded("node-2");
    node.addChannel(NodeId.of(2), neighbour.sender());
    neighbour.receiver().close();
    final var packet = new Packet(new Ack(0), RoutingHeader.of(1, 1, 2), 42L);

    assertThatThrownBy(() -> node.forwardPacket(packet))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Failed to forward the packet");
  }

  @Test
  public void broadcastSendsDirectCopiesToEveryoneButTheSender() {
    final var two = Channel.<Packet>unbounded("node-2");
    final var three = Channel.<Packet>unbounded("node-3");
    final var four = Channel.<Packet>unbounded("node-4");
    node.addChannel(NodeId.of(2), two.sender());
    node.addChannel(NodeId.of(3), three.sender());
    node.addChannel(NodeId.of(4), four.sender());
    final var request = FloodRequest.initiate(5, NodeId.of(2), NodeType.CLIENT);
    final var packet = Packet.floodRequest(RoutingHeader.of(1, 2, 1), 9L, request);

    node.broadcastPacket(packet, NodeId.of(2));

    assertThat(two.receiver().isEmpty()).isTrue();
    assertThat(three.receiver().tryReceive()).contains(
        Packet.floodRequest(RoutingHeader.of(1, 1, 3), 9L, request));
    assertThat(four.receiver().tryReceive()).contains(
        Packet.floodRequest(RoutingHeader.of(1, 1, 4), 9L, request));
    assertThat(controller.receiver().drain()).map(NodeEvent::packet)
        .map(Packet::routingHeader)
        .containsExactly(RoutingHeader.of(1, 1, 3), RoutingHeader.of(1, 1, 4));
  }

  @Test
  public void broadcastCarriesOnPastAClosedNeighbour() {
    final var three = Channel.<Packet>unbounded("node-3");
    final var four = Channel.<Packet>unbounded("node-4");
    node.addChannel(NodeId.of(3), three.sender());
    node.addChannel(NodeId.of(4), four.sender());
    three.receiver().close();
    final var packet = Packet.floodRequest(RoutingHeader.of(1, 2, 1), 9L,
        FloodRequest.initiate(5, NodeId.of(2), NodeType.CLIENT));

    node.broadcastPacket(packet, NodeId.of(2));

    assertThat(four.receiver().tryReceive()).isPresent();
    assertThat(log.errorLines).singleElement().asString().contains("Failed to send packet to NodeId 3");
  }
}
