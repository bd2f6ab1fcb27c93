// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import org.bouncycastle.math.ec.ECPoint;

import java.math.BigInteger;
import java.security.SecureRandom;

/// Single use key pair owned by one handshake attempt. It is dropped as soon as the shared key is derived and is never
/// stored anywhere else.
record EphemeralKeyPair(BigInteger scalar, ECPoint point) {

  static EphemeralKeyPair generate(SecureRandom random) {
    BigInteger scalar = Curve.randomScalar(random);
    return new EphemeralKeyPair(scalar, Curve.multiplyBase(scalar));
  }

  byte[] encodedPoint() {
    return Curve.encode(point);
  }

  @Override
  public String toString() {
    return "EphemeralKeyPair[" + Curve.encode(point).length + " byte point]";
  }
}
