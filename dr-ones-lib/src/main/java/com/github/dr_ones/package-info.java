// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// This package contains the routing and discovery protocol shared by the drones, clients and servers of a simulated
/// packet network.
///
/// Nodes are connected by in process channels. Data travels along a source route chosen by its sender while the
/// topology is discovered by flooding. Node kinds plug in by implementing [com.github.dr_ones.NetworkNode] and are
/// driven by a [com.github.dr_ones.NodeRunner].
///
/// Supporting classes:
/// - [com.github.dr_ones.RoutingHeader]: the source route with its cursor and its reversal for replies.
/// - [com.github.dr_ones.PacketRouter]: sends a packet to the next hop or fans it out to all neighbours.
/// - [com.github.dr_ones.FloodController]: answers or passes on flood requests avoiding loops.
/// - [com.github.dr_ones.ControlPackets]: builds acks, nacks and flood responses.
/// - [com.github.dr_ones.NeighborTable]: the outbound channels of a node.
/// - [com.github.dr_ones.NodeLog]: the per node diagnostics handed to every node. See [com.github.dr_ones.JulNodeLog].
package com.github.dr_ones;
