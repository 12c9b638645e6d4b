// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

/// The kind of participant recorded against each hop of a flood path trace so that whoever receives the
/// flood response can classify the nodes it discovered.
public enum NodeType {
  DRONE,
  CLIENT,
  SERVER
}
