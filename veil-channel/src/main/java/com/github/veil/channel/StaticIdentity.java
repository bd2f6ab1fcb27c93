// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import java.math.BigInteger;
import java.security.SecureRandom;

/// The long-lived key pair of this process. The public half is advertised; the secret never leaves the process and is
/// absent from [#toString()].
public final class StaticIdentity {
  private final BigInteger secretKey;
  private final IdentityKey publicKey;

  private StaticIdentity(BigInteger secretKey) {
    Curve.checkScalar(secretKey);
    this.secretKey = secretKey;
    this.publicKey = new IdentityKey(Curve.multiplyBase(secretKey));
  }

  public static StaticIdentity generate() {
    return generate(new SecureRandom());
  }

  public static StaticIdentity generate(SecureRandom random) {
    return new StaticIdentity(Curve.randomScalar(random));
  }

  public static StaticIdentity fromSecret(BigInteger secretKey) {
    return new StaticIdentity(secretKey);
  }

  BigInteger secretKey() {
    return secretKey;
  }

  public IdentityKey publicKey() {
    return publicKey;
  }

  @Override
  public String toString() {
    return "StaticIdentity[" + publicKey + "]";
  }
}
