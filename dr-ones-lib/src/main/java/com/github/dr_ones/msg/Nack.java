// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

import java.util.Objects;

/// Reports to the source that the fragment at `fragmentIndex` was not delivered.
///
/// @param fragmentIndex the fragment that failed.
/// @param nackType      the reason it failed.
public record Nack(long fragmentIndex, NackType nackType) implements PacketType {
  public Nack {
    Objects.requireNonNull(nackType, "nackType cannot be null");
  }
}
