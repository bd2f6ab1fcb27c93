// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import java.time.Duration;
import java.util.Objects;

/// Tunables for channel lifecycle and handshakes.
///
/// @param idleTimeout                how long a channel may go without traffic before its key is erased
/// @param handshakeTimeout           how long a client waits for a handshake reply before abandoning the attempt
/// @param fragmentPolicy             what happens to a channel when a fragment fails authentication
/// @param requireServerAuthorization whether a client checks the server identity against its authorization policy
public record ChannelConfig(
    Duration idleTimeout,
    Duration handshakeTimeout,
    FragmentPolicy fragmentPolicy,
    boolean requireServerAuthorization
) {
  public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(20);
  public static final Duration DEFAULT_HANDSHAKE_TIMEOUT = Duration.ofSeconds(5);

  static final String PREFIX = "com.github.veil.channel.";

  public ChannelConfig {
    Objects.requireNonNull(idleTimeout, "idleTimeout required");
    Objects.requireNonNull(handshakeTimeout, "handshakeTimeout required");
    Objects.requireNonNull(fragmentPolicy, "fragmentPolicy required");
    if (idleTimeout.isNegative() || idleTimeout.isZero()) {
      throw new IllegalArgumentException("idleTimeout must be positive: " + idleTimeout);
    }
    if (handshakeTimeout.isNegative() || handshakeTimeout.isZero()) {
      throw new IllegalArgumentException("handshakeTimeout must be positive: " + handshakeTimeout);
    }
  }

  /// Defaults, each of which may be overridden with a system property:
  /// `com.github.veil.channel.idleTimeoutMillis`, `com.github.veil.channel.handshakeTimeoutMillis` and
  /// `com.github.veil.channel.fragmentPolicy`.
  public static ChannelConfig defaults() {
    return new ChannelConfig(
        millisProperty("idleTimeoutMillis", DEFAULT_IDLE_TIMEOUT),
        millisProperty("handshakeTimeoutMillis", DEFAULT_HANDSHAKE_TIMEOUT),
        FragmentPolicy.valueOf(System.getProperty(PREFIX + "fragmentPolicy", FragmentPolicy.LENIENT.name())),
        true);
  }

  public ChannelConfig withIdleTimeout(Duration idleTimeout) {
    return new ChannelConfig(idleTimeout, handshakeTimeout, fragmentPolicy, requireServerAuthorization);
  }

  public ChannelConfig withHandshakeTimeout(Duration handshakeTimeout) {
    return new ChannelConfig(idleTimeout, handshakeTimeout, fragmentPolicy, requireServerAuthorization);
  }

  public ChannelConfig withFragmentPolicy(FragmentPolicy fragmentPolicy) {
    return new ChannelConfig(idleTimeout, handshakeTimeout, fragmentPolicy, requireServerAuthorization);
  }

  public ChannelConfig withRequireServerAuthorization(boolean requireServerAuthorization) {
    return new ChannelConfig(idleTimeout, handshakeTimeout, fragmentPolicy, requireServerAuthorization);
  }

  private static Duration millisProperty(String name, Duration fallback) {
    String value = System.getProperty(PREFIX + name);
    if (value == null) {
      return fallback;
    }
    try {
      return Duration.ofMillis(Long.parseLong(value.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + PREFIX + name + ": " + value, e);
    }
  }
}
