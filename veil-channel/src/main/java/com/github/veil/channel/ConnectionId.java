// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.f4b6a3.uuid.UuidCreator;

import java.util.Objects;
import java.util.UUID;

/// Random per channel identifier sent in clear so that inbound traffic can be routed to the right [SecureChannel].
/// It carries no authentication weight.
public record ConnectionId(UUID value) {
  public ConnectionId {
    Objects.requireNonNull(value, "value required");
  }

  public static ConnectionId random() {
    return new ConnectionId(UuidCreator.getRandomBased());
  }

  @Override
  public String toString() {
    return "Conn-" + value;
  }
}
