// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil;

import java.util.logging.Logger;

/// Shared logger for the veil libraries. Messages are built lazily with suppliers so that FINEST tracing costs nothing
/// when disabled. Secret material (scalars, shared keys) must never be passed to this logger.
public final class VeilLogger {
  public static final Logger LOGGER = Logger.getLogger("com.github.veil");

  private VeilLogger() {
  }
}
