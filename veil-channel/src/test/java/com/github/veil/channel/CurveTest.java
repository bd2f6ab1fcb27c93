// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import org.bouncycastle.math.ec.ECPoint;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.security.SecureRandom;

import static org.junit.jupiter.api.Assertions.*;

class CurveTest {

  private final SecureRandom random = new SecureRandom();

  @Test
  void encodedPointsAreCompressedAndDecodeBack() {
    ECPoint point = Curve.multiplyBase(Curve.randomScalar(random));
    byte[] encoded = Curve.encode(point);
    assertEquals(Curve.ENCODED_POINT_LENGTH, encoded.length);
    assertTrue(encoded[0] == 0x02 || encoded[0] == 0x03);
    assertEquals(point, Curve.decode(encoded));
  }

  @Test
  void uncompressedEncodingIsAccepted() {
    ECPoint point = Curve.multiplyBase(Curve.randomScalar(random));
    assertEquals(point, Curve.decode(point.getEncoded(false)));
  }

  @Test
  void baseMultiplicationMatchesGenericMultiplication() {
    BigInteger k = Curve.randomScalar(random);
    ECPoint g = Curve.multiplyBase(BigInteger.ONE);
    assertEquals(Curve.multiplyBase(k), Curve.multiply(k, g));
  }

  @Test
  void emptyEncodingIsRejected() {
    assertThrows(SecureChannelException.IdentificationFailed.class, () -> Curve.decode(new byte[0]));
    assertThrows(SecureChannelException.IdentificationFailed.class, () -> Curve.decode(null));
  }

  @Test
  void pointAtInfinityIsRejected() {
    assertThrows(SecureChannelException.IdentificationFailed.class, () -> Curve.decode(new byte[]{0x00}));
  }

  @Test
  void pointOffTheCurveIsRejected() {
    byte[] encoded = Curve.multiplyBase(Curve.randomScalar(random)).getEncoded(false);
    encoded[encoded.length - 1] ^= 0x01;
    assertThrows(SecureChannelException.IdentificationFailed.class, () -> Curve.decode(encoded));
  }

  @Test
  void garbageIsRejected() {
    byte[] garbage = new byte[Curve.ENCODED_POINT_LENGTH];
    garbage[0] = 0x07;
    assertThrows(SecureChannelException.IdentificationFailed.class, () -> Curve.decode(garbage));
    assertThrows(SecureChannelException.IdentificationFailed.class,
        () -> Curve.decode(new byte[Curve.MAX_ENCODED_POINT_LENGTH + 1]));
  }

  @Test
  void randomScalarsAreInRange() {
    for (int i = 0; i < 100; i++) {
      BigInteger k = Curve.randomScalar(random);
      assertTrue(k.signum() > 0);
      assertTrue(k.compareTo(Curve.N) < 0);
    }
  }

  @Test
  void scalarsOutsideTheGroupAreRefused() {
    assertThrows(IllegalArgumentException.class, () -> Curve.checkScalar(BigInteger.ZERO));
    assertThrows(IllegalArgumentException.class, () -> Curve.checkScalar(Curve.N));
    assertThrows(IllegalArgumentException.class, () -> StaticIdentity.fromSecret(BigInteger.valueOf(-5)));
  }
}
