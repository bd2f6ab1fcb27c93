// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.util.Objects;

/// A long-lived public key. Advertised freely and used as the unit of membership in an [AuthorizationPolicy].
public record IdentityKey(ECPoint point) {
  public IdentityKey {
    Objects.requireNonNull(point, "point required");
    point = point.normalize();
  }

  /// @throws SecureChannelException.IdentificationFailed if the encoding is not a valid curve point
  public static IdentityKey fromEncoded(byte[] encoded) {
    return new IdentityKey(Curve.decode(encoded));
  }

  public static IdentityKey fromHex(String hex) {
    try {
      return fromEncoded(Hex.decode(hex.trim()));
    } catch (DecoderException e) {
      throw new SecureChannelException.IdentificationFailed("Not a hex encoded key: " + hex, e);
    }
  }

  public byte[] encoded() {
    return Curve.encode(point);
  }

  public String toHex() {
    return Hex.toHexString(encoded());
  }

  @Override
  public String toString() {
    return "IdentityKey[" + toHex().substring(0, 16) + "]";
  }
}
