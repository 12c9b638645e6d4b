// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.dr_ones;

import java.util.logging.Logger;

/// We are using JUL logging to reduce dependencies. You can configure JUL logging to bridge to your chosen logging
/// framework. Per node status and error lines go through a [NodeLog] while this logger carries the fine grained
/// routing trace and the failures of the [NodeRunner].
public final class DrOnesLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.dr_ones");

  private DrOnesLogger() {
  }
}
