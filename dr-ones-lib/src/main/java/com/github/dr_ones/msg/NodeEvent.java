// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

import java.util.Objects;

/// Events a node reports to the simulation controller. They are purely for observation and never feed back into
/// routing decisions.
public sealed interface NodeEvent {
  Packet packet();

  /// A packet was handed to a neighbour channel. The packet is exactly what was sent.
  record PacketSent(Packet packet) implements NodeEvent {
    public PacketSent {
      Objects.requireNonNull(packet);
    }
  }

  /// A drone decided to drop a fragment.
  record PacketDropped(Packet packet) implements NodeEvent {
    public PacketDropped {
      Objects.requireNonNull(packet);
    }
  }

  /// An ack, nack or flood response that cannot be routed is handed to the controller to deliver.
  record ControllerShortcut(Packet packet) implements NodeEvent {
    public ControllerShortcut {
      Objects.requireNonNull(packet);
    }
  }
}
