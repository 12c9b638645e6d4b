// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.*;
import com.github.dr_ones.network.Channel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NetworkNodeTest {
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
    node = new TestNode(2, NodeType.DRONE, controller.sender(), log);
  }

  @Test
  public void routedPacketsGoToTheNodeSpecificHandler() {
    final var ack = new Packet(new Ack(3), RoutingHeader.of(2, 4, 3, 2), 5L);

    final var stop = node.handlePacket(ack);

    assertThat(stop).isFalse();
    assertThat(node.delivered).containsExactly(ack);
  }

  @Test
  public void floodRequestsNeverReachTheNodeSpecificHandler() {
    final var one = Channel.<Packet>unbounded();
    node.addChannel(NodeId.of(1), one.sender());

    node.handlePacket(Packet.floodRequest(RoutingHeader.of(1, 1, 2), 0L,
        FloodRequest.initiate(1, NodeId.of(1), NodeType.CLIENT)));

    assertThat(node.delivered).isEmpty();
    assertThat(one.receiver().drain()).hasSize(1);
  }

  @Test
  public void crashingNodeDropsFloodRequests() {
    final var one = Channel.<Packet>unbounded();
    node.addChannel(NodeId.of(1), one.sender());
    node.handleCommand(new Command.Crash());

    final var stop = node.handlePacket(Packet.floodRequest(RoutingHeader.of(1, 1, 2), 0L,
        FloodRequest.initiate(1, NodeId.of(1), NodeType.CLIENT)));

    assertThat(stop).isFalse();
    assertThat(one.receiver().isEmpty()).isTrue();
    assertThat(node.seenFloods()).isEmpty();
    assertThat(log.statusLines).singleElement().asString().contains("dropping flood request");
  }

  @Test
  public void addSenderAndRemoveSenderEditTheNeighbourTable() {
    final var three = Channel.<Packet>unbounded();
    node.handleCommand(new Command.AddSender(NodeId.of(3), three.sender()));
    assertThat(node.neighbors().ids()).containsExactly(NodeId.of(3));

    node.handleCommand(new Command.RemoveSender(NodeId.of(3)));
    assertThat(node.neighbors().isEmpty()).isTrue();
    assertThat(log.errorLines).isEmpty();
  }

  @Test
  public void addChannelReplacesAnExistingNeighbour() {
    final var first = Channel.<Packet>unbounded();
    final var second = Channel.<Packet>unbounded();
    node.addChannel(NodeId.of(3), first.sender());
    node.addChannel(NodeId.of(3), second.sender());

    assertThat(node.neighbors().size()).isEqualTo(1);
    assertThat(node.neighbors().sender(NodeId.of(3))).containsSame(second.sender());
  }

  @Test
  public void removingAnUnknownNeighbourIsLoggedNotThrown() {
    node.addChannel(NodeId.of(3), Channel.<Packet>unbounded().sender());

    node.removeChannel(NodeId.of(9));

    assertThat(node.neighbors().size()).isEqualTo(1);
    assertThat(log.errorLines).containsExactly("2: the current node 2 has no neighbour node 9.");
  }

  @Test
  public void otherCommandsAreLeftToTheNode() {
    final var packet = new Packet(new Ack(1), RoutingHeader.of(1, 2, 3), 1L);
    final var three = Channel.<Packet>unbounded();
    node.addChannel(NodeId.of(3), three.sender());

    assertThat(node.applyTopologyCommand(new Command.SendPacket(packet))).isFalse();
    node.handleCommand(new Command.SendPacket(packet));

    assertThat(three.receiver().drain()).containsExactly(packet);
  }

  @Test
  public void buildAckAndNackUseTheControlPacketBuilder() {
    final var fragment = Packet.fragment(RoutingHeader.of(1, 1, 2, 3), 11L, new MsgFragment(4, 5, new byte[]{1, 2}));

    assertThat(node.buildAck(fragment)).isEqualTo(new Packet(new Ack(4), RoutingHeader.of(1, 2, 1), 11L));
    assertThat(node.buildNack(fragment, NackType.DROPPED))
        .isEqualTo(new Packet(new Nack(4, NackType.DROPPED), RoutingHeader.of(1, 2, 1), 11L));
  }

  @Test
  public void relayAdvancesTheCursorBeforeForwarding() {
    final var three = Channel.<Packet>unbounded();
    node.addChannel(NodeId.of(3), three.sender());
    final var fragment = Packet.fragment(RoutingHeader.of(1, 1, 2, 3), 11L, new MsgFragment(0, 1, new byte[]{9}));

    node.handlePacket(fragment);

    assertThat(three.receiver().drain()).singleElement()
        .extracting(Packet::routingHeader)
        .isEqualTo(RoutingHeader.of(2, 1, 2, 3));
    assertThat(controller.receiver().drain()).hasSize(1);
  }

  @Test
  public void crashingNodeReportsDroppedFragments() {
    final var three = Channel.<Packet>unbounded();
    node.addChannel(NodeId.of(3), three.sender());
    node.handleCommand(new Command.Crash());
    final var fragment = Packet.fragment(RoutingHeader.of(1, 1, 2, 3), 11L, new MsgFragment(0, 1, new byte[]{9}));

    node.handlePacket(fragment);

    assertThat(three.receiver().isEmpty()).isTrue();
    assertThat(controller.receiver().drain()).containsExactly(new NodeEvent.PacketDropped(fragment));
    assertThat(log.statusLines).singleElement().asString().startsWith("2: dropping ");
  }

  @Test
  public void controlPacketWithNoNextHopGoesToTheController() {
    final var ack = new Packet(new Ack(0), RoutingHeader.of(1, 3, 2, 1), 11L);

    node.handlePacket(ack);

    assertThat(controller.receiver().drain())
        .containsExactly(new NodeEvent.ControllerShortcut(ack.withRoutingHeader(RoutingHeader.of(2, 3, 2, 1))));
    assertThat(log.statusLines).isEmpty();
  }

  @Test
  public void onlyFragmentsAreReportedDroppedAndOnlyControlPacketsShortcut() {
    final var ack = new Packet(new Ack(0), RoutingHeader.of(1, 3, 2, 1), 11L);
    final var fragment = Packet.fragment(RoutingHeader.of(1, 1, 2, 3), 11L, new MsgFragment(0, 1, new byte[]{9}));

    assertThatThrownBy(() -> node.reportDropped(ack)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> node.shortcutToController(fragment)).isInstanceOf(IllegalArgumentException.class);
    assertThat(controller.receiver().isEmpty()).isTrue();
  }

  @Test
  public void closedControllerChannelIsLoggedForEveryEventKind() {
    controller.receiver().close();
    final var ack = new Packet(new Ack(0), RoutingHeader.of(1, 3, 2, 1), 11L);

    node.shortcutToController(ack);

    assertThat(log.errorLines).singleElement().asString().contains("Failed to send ControllerShortcut event");
  }
}
