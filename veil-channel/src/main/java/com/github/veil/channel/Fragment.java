// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.Seq;

import java.util.Arrays;
import java.util.Objects;

/// The smallest independently encrypted and authenticated unit of traffic. Arrays are copied on the way in and on the
/// way out so that a fragment cannot change after construction.
public record Fragment(Seq seq, byte[] ciphertext, byte[] authTag) {
  public Fragment {
    Objects.requireNonNull(seq, "seq required");
    Objects.requireNonNull(ciphertext, "ciphertext required");
    Objects.requireNonNull(authTag, "authTag required");
    ciphertext = ciphertext.clone();
    authTag = authTag.clone();
  }

  @Override
  public byte[] ciphertext() {
    return ciphertext.clone();
  }

  @Override
  public byte[] authTag() {
    return authTag.clone();
  }

  int length() {
    return ciphertext.length;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Fragment other
        && seq.equals(other.seq)
        && Arrays.equals(ciphertext, other.ciphertext)
        && Arrays.equals(authTag, other.authTag);
  }

  @Override
  public int hashCode() {
    return Objects.hash(seq, Arrays.hashCode(ciphertext), Arrays.hashCode(authTag));
  }

  @Override
  public String toString() {
    return "Fragment[" + seq + ", " + ciphertext.length + " bytes]";
  }
}
