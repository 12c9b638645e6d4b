// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

import com.github.dr_ones.NodeId;
import com.github.dr_ones.network.Sender;

import java.util.Objects;

/// Runtime reconfiguration sent by the simulation controller. Only the topology edits are understood by every node
/// kind. Sending a packet on request and crashing are interpreted by the node specific code.
public sealed interface Command {

  /// Connect to a neighbour.
  record AddSender(NodeId nodeId, Sender<Packet> sender) implements Command {
    public AddSender {
      Objects.requireNonNull(nodeId);
      Objects.requireNonNull(sender);
    }
  }

  /// Disconnect from a neighbour.
  record RemoveSender(NodeId nodeId) implements Command {
    public RemoveSender {
      Objects.requireNonNull(nodeId);
    }
  }

  /// Inject a packet into the network at this node.
  record SendPacket(Packet packet) implements Command {
    public SendPacket {
      Objects.requireNonNull(packet);
    }
  }

  /// Start crashing: drain what is queued then stop.
  record Crash() implements Command {
  }
}
