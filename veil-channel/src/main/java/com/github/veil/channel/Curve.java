// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.security.SecureRandom;

/// Thin adapter over the Bouncy Castle curve arithmetic. All points handed out are normalized so that their
/// encodings, and therefore every hash taken over them, are canonical.
public final class Curve {

  public static final String NAME = "secp256r1";

  private static final X9ECParameters PARAMS = CustomNamedCurves.getByName(NAME);
  private static final ECCurve CURVE = PARAMS.getCurve();
  private static final ECPoint G = PARAMS.getG();

  /// Order of the base point.
  public static final BigInteger N = PARAMS.getN();

  /// Length of a compressed SEC1 point encoding.
  public static final int ENCODED_POINT_LENGTH = 33;

  /// Longest encoding [#decode] accepts (uncompressed SEC1).
  public static final int MAX_ENCODED_POINT_LENGTH = 65;

  private Curve() {
  }

  /// Decodes and validates a point received from a peer.
  ///
  /// @throws SecureChannelException.IdentificationFailed if the bytes are not a finite point on the curve
  public static ECPoint decode(byte[] encoded) {
    if (encoded == null || encoded.length == 0) {
      throw new SecureChannelException.IdentificationFailed("Empty point encoding");
    }
    if (encoded.length > MAX_ENCODED_POINT_LENGTH) {
      throw new SecureChannelException.IdentificationFailed("Point encoding too long: " + encoded.length);
    }
    final ECPoint point;
    try {
      point = CURVE.decodePoint(encoded);
    } catch (IllegalArgumentException | ArithmeticException e) {
      throw new SecureChannelException.IdentificationFailed("Invalid curve point: " + e.getMessage(), e);
    }
    if (point.isInfinity() || !point.isValid()) {
      throw new SecureChannelException.IdentificationFailed("Point is not a valid finite curve point");
    }
    return point.normalize();
  }

  public static byte[] encode(ECPoint point) {
    return point.getEncoded(true);
  }

  public static ECPoint multiply(BigInteger scalar, ECPoint point) {
    return point.multiply(scalar).normalize();
  }

  public static ECPoint multiplyBase(BigInteger scalar) {
    return new FixedPointCombMultiplier().multiply(G, scalar).normalize();
  }

  /// @return a uniformly random scalar in `[1, N-1]`
  public static BigInteger randomScalar(SecureRandom random) {
    return BigIntegers.createRandomInRange(BigInteger.ONE, N.subtract(BigInteger.ONE), random);
  }

  static void checkScalar(BigInteger scalar) {
    if (scalar == null || scalar.signum() <= 0 || scalar.compareTo(N) >= 0) {
      throw new IllegalArgumentException("Scalar must be in [1, N-1]");
    }
  }
}
