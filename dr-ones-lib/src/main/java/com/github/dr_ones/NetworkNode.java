// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.Ack;
import com.github.dr_ones.msg.Command;
import com.github.dr_ones.msg.FloodRequest;
import com.github.dr_ones.msg.FloodResponse;
import com.github.dr_ones.msg.MsgFragment;
import com.github.dr_ones.msg.Nack;
import com.github.dr_ones.msg.NackType;
import com.github.dr_ones.msg.NodeEvent;
import com.github.dr_ones.msg.Packet;
import com.github.dr_ones.network.Receiver;
import com.github.dr_ones.network.Sender;

import java.util.Set;
import java.util.random.RandomGenerator;

import static com.github.dr_ones.DrOnesLogger.LOGGER;

/// The contract every drone, client and server implements to take part in the network. A node exposes its state
/// through the accessors and supplies the two kind specific handlers. Forwarding, flooding, acks and nacks are
/// shared and provided as default methods.
///
/// A node is not thread safe. Exactly one thread, usually a [NodeRunner], calls into it.
public interface NetworkNode {

  NodeId id();

  /// How this node describes itself in flood path traces.
  NodeType nodeType();

  /// A crashing node is draining its queue before it stops.
  default boolean isCrashing() {
    return false;
  }

  /// The floods this node has already fanned out. It only ever grows.
  Set<FloodKey> seenFloods();

  NeighborTable neighbors();

  /// Only used to draw session ids.
  RandomGenerator random();

  Receiver<Packet> packetReceiver();

  /// The events channel to the simulation controller.
  Sender<NodeEvent> eventSender();

  NodeLog log();

  /// Handles every packet that is not a flood request.
  ///
  /// @return true when the node has finished and its loop should stop.
  boolean handleRoutedPacket(Packet packet);

  /// Applies a command from the simulation controller. Implementations will usually start with
  /// [#applyTopologyCommand(Command)].
  void handleCommand(Command command);

  /// Dispatches on the payload. Flood requests go to the [FloodController] and everything else to
  /// [#handleRoutedPacket(Packet)].
  ///
  /// @return true when the node has finished and its loop should stop.
  default boolean handlePacket(Packet packet, NodeType nodeType) {
    if (packet.packType() instanceof FloodRequest) {
      if (isCrashing()) {
        log().status(id(), "crashing so dropping flood request " + packet);
        return false;
      }
      handleFloodRequest(packet, nodeType);
      return false;
    }
    return handleRoutedPacket(packet);
  }

  default boolean handlePacket(Packet packet) {
    return handlePacket(packet, nodeType());
  }

  default void handleFloodRequest(Packet packet, NodeType nodeType) {
    FloodController.handle(this, packet, nodeType);
  }

  /// See [PacketRouter#forward(NetworkNode, Packet)].
  default void forwardPacket(Packet packet) {
    PacketRouter.forward(this, packet);
  }

  /// See [PacketRouter#broadcast(NetworkNode, Packet, NodeId)].
  default void broadcastPacket(Packet packet, NodeId receivedFrom) {
    PacketRouter.broadcast(this, packet, receivedFrom);
  }

  /// Tells the simulation controller that this node dropped the fragment.
  ///
  /// @throws IllegalArgumentException if the payload is not a fragment.
  default void reportDropped(Packet packet) {
    if (!(packet.packType() instanceof MsgFragment)) {
      throw new IllegalArgumentException("only fragments are dropped but got " + packet);
    }
    log().status(id(), "dropping " + packet);
    PacketRouter.emit(this, new NodeEvent.PacketDropped(packet));
  }

  /// Hands an ack, nack or flood response that cannot reach its next hop to the simulation controller to deliver.
  ///
  /// @throws IllegalArgumentException for any other payload. Those are dropped or nacked instead.
  default void shortcutToController(Packet packet) {
    final var type = packet.packType();
    if (!(type instanceof Ack || type instanceof Nack || type instanceof FloodResponse)) {
      throw new IllegalArgumentException("only acks, nacks and flood responses can be shortcut but got " + packet);
    }
    LOGGER.fine(() -> id() + " shortcut to controller " + packet);
    PacketRouter.emit(this, new NodeEvent.ControllerShortcut(packet));
  }

  default Packet buildAck(Packet packet) {
    return ControlPackets.ack(packet);
  }

  default Packet buildNack(Packet packet, NackType nackType) {
    return ControlPackets.nack(packet, nackType);
  }

  default void addChannel(NodeId id, Sender<Packet> sender) {
    neighbors().add(id, sender);
  }

  /// Removing a neighbour we do not have is logged and otherwise ignored.
  default void removeChannel(NodeId id) {
    if (!neighbors().remove(id)) {
      log().error(id(), "the current node " + id() + " has no neighbour node " + id + ".");
    }
  }

  /// Applies the commands every node kind understands.
  ///
  /// @return true if the command was a topology edit and has been applied.
  default boolean applyTopologyCommand(Command command) {
    if (command instanceof Command.AddSender add) {
      addChannel(add.nodeId(), add.sender());
      return true;
    }
    if (command instanceof Command.RemoveSender remove) {
      removeChannel(remove.nodeId());
      return true;
    }
    return false;
  }
}
