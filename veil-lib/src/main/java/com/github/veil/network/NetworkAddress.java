// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.network;

import java.util.Objects;

/// Where a remote service can be reached. Used as the key for channel lookup so it must have value semantics.
public record NetworkAddress(String host, int port) {
  public NetworkAddress {
    Objects.requireNonNull(host, "host required");
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
  }

  public NetworkAddress(int port) {
    this("localhost", port);
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
