// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

import com.github.dr_ones.NodeId;
import com.github.dr_ones.NodeType;

import java.util.Objects;

/// One visited node of a flood path trace.
public record PathEntry(NodeId nodeId, NodeType nodeType) {
  public PathEntry {
    Objects.requireNonNull(nodeId, "nodeId cannot be null");
    Objects.requireNonNull(nodeType, "nodeType cannot be null");
  }
}
