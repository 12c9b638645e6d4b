// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import com.github.dr_ones.msg.FloodRequest;

import java.util.Objects;

/// Identifies one flood. Initiators choose flood ids independently so the id alone is not unique across the network.
public record FloodKey(NodeId initiatorId, long floodId) {
  public FloodKey {
    Objects.requireNonNull(initiatorId, "initiatorId cannot be null");
  }

  public static FloodKey of(FloodRequest request) {
    return new FloodKey(request.initiatorId(), request.floodId());
  }
}
