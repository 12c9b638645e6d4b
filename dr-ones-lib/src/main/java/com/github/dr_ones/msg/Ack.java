// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.msg;

/// Acknowledges the delivery of the fragment at `fragmentIndex`.
public record Ack(long fragmentIndex) implements PacketType {
}
