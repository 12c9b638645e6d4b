// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The msg package contains the packets exchanged between the nodes of the simulated network and the events and
/// commands exchanged with the simulation controller.
///
/// Every packet is a [com.github.dr_ones.msg.Packet] envelope holding a routing header, a session id and one of the
/// payloads:
/// ```
/// PacketType
/// ├── MsgFragment   routed along the source route
/// ├── Ack           routed back along the reversed route
/// ├── Nack          routed back along the reversed route
/// ├── FloodRequest  fanned out hop by hop
/// └── FloodResponse routed back along the reversed path trace
///```
package com.github.dr_ones.msg;
