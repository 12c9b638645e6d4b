// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

/// Why a packet could not be delivered.
public enum NackType {
  /// The next hop of the route is not a neighbour of the node that held the packet.
  ERROR_IN_ROUTING,
  /// The route ended on a drone which can never be the destination of a fragment.
  DESTINATION_IS_DRONE,
  /// A drone dropped the packet.
  DROPPED,
  /// The packet arrived at a node that is not the one at the cursor of its route.
  UNEXPECTED_RECIPIENT
}
