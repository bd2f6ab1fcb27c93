// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import java.util.logging.Logger;

public final class ChannelLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.veil.channel");

  private ChannelLogger() {
  }
}
