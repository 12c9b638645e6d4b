// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

/// The payload of a [Packet]. Fragments, acks and nacks travel along a precomputed source route. Flood requests are
/// fanned out hop by hop and flood responses travel back along the reversed path trace.
public sealed interface PacketType permits
    MsgFragment,
    Ack,
    Nack,
    FloodRequest,
    FloodResponse {
}
