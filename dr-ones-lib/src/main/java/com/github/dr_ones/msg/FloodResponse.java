// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

import java.util.List;

/// The answer to a [FloodRequest] carrying the complete trace of the nodes the request passed through.
public record FloodResponse(long floodId, List<PathEntry> pathTrace) implements PacketType {
  public FloodResponse {
    pathTrace = List.copyOf(pathTrace);
  }
}
