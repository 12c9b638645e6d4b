// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The network package provides the in process transport between simulated nodes.
///
/// Key types:
/// - `Channel`: pairs one `Sender` with one `Receiver` over an unbounded queue
/// - `Sender`: cloned freely and held by every neighbour that wants to reach a node
/// - `Receiver`: drained only by the node that owns it
///
/// Design characteristics:
/// 1. Packets are passed as objects, there is no wire format
/// 2. Sends never block and fail only once the receiver is closed
package com.github.dr_ones.network;
