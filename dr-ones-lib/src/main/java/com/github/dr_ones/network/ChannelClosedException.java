// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones.network;

/// Thrown when sending on a channel whose receiver has gone away.
public class ChannelClosedException extends Exception {
  public ChannelClosedException(String channelName) {
    super("channel " + channelName + " is closed");
  }
}
