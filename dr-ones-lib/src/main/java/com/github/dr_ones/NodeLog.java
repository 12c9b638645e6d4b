// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

/// Human readable diagnostics of a node. It is handed to each node when it is built rather than being a process wide
/// switch. Implementations must be safe to call from every node thread at once. Nothing written here ever changes
/// what the protocol does.
public interface NodeLog {

  /// Something worth knowing happened such as a packet being dropped for lack of a route.
  void status(NodeId nodeId, String message);

  /// Something failed that the node recovered from such as a neighbour channel being closed during a broadcast.
  void error(NodeId nodeId, String message);

  /// @return a log that discards every line.
  static NodeLog silent() {
    return Silent.INSTANCE;
  }

  enum Silent implements NodeLog {
    INSTANCE;

    @Override
    public void status(NodeId nodeId, String message) {
    }

    @Override
    public void error(NodeId nodeId, String message) {
    }
  }
}
