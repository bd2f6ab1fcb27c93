// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/// Read-only membership test over public keys. Consulted by a server before it completes a handshake and, unless
/// configured otherwise, by a client before it trusts a server. A failed check is terminal for that one handshake.
@FunctionalInterface
public interface AuthorizationPolicy {

  boolean isMember(IdentityKey key);

  static AuthorizationPolicy of(Collection<IdentityKey> members) {
    return new AuthorizationSet(Set.copyOf(members));
  }

  static AuthorizationPolicy of(IdentityKey... members) {
    return new AuthorizationSet(Set.copyOf(Arrays.asList(members)));
  }

  static AuthorizationPolicy permitAll() {
    return key -> true;
  }

  /// Loads a set from a file holding one hex encoded public key per line. Blank lines and lines starting with `#`
  /// are ignored.
  ///
  /// @throws SecureChannelException.IdentificationFailed if any line is not a valid key
  static AuthorizationPolicy load(Path path) throws IOException {
    try (var lines = Files.lines(path, StandardCharsets.UTF_8)) {
      return new AuthorizationSet(lines
          .map(String::trim)
          .filter(line -> !line.isEmpty() && !line.startsWith("#"))
          .map(IdentityKey::fromHex)
          .collect(Collectors.toUnmodifiableSet()));
    }
  }

  record AuthorizationSet(Set<IdentityKey> members) implements AuthorizationPolicy {
    public AuthorizationSet {
      members = Set.copyOf(members);
    }

    @Override
    public boolean isMember(IdentityKey key) {
      return members.contains(key);
    }
  }
}
