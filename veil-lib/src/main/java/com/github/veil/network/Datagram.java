// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.network;

import java.util.Objects;

/// One unit of inbound traffic as handed up by a [Transport].
public record Datagram(NetworkAddress from, byte[] payload) {
  public Datagram {
    Objects.requireNonNull(from, "from required");
    Objects.requireNonNull(payload, "payload required");
  }
}
