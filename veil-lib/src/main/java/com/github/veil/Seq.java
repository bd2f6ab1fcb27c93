// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil;

import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.util.Objects;

/// A nonce drawn from [NonceSource]. Used exactly once to key the encryption and authentication of one fragment.
///
/// @param value non-negative integer, typically wider than 256 bits
public record Seq(BigInteger value) implements Comparable<Seq> {
  public Seq {
    Objects.requireNonNull(value, "value required");
    if (value.signum() < 0) {
      throw new IllegalArgumentException("Seq must be non-negative: " + value);
    }
  }

  /// Minimal unsigned big-endian encoding. This is the canonical form fed into hashes and written on the wire.
  public byte[] toBytes() {
    return BigIntegers.asUnsignedByteArray(value);
  }

  public static Seq fromBytes(byte[] bytes) {
    return new Seq(BigIntegers.fromUnsignedByteArray(bytes));
  }

  @Override
  public int compareTo(Seq other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return "Seq[" + value.toString(16) + "]";
  }
}
