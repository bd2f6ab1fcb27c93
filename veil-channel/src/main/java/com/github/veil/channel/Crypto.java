// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.Seq;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.KDFCounterBytesGenerator;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KDFCounterParameters;
import org.bouncycastle.util.Arrays;

/// Hash and keystream primitives over Bouncy Castle.
public final class Crypto {

  /// Length of [#hash256] output and of a channel shared key.
  public static final int HASH_LENGTH = 32;

  private Crypto() {
  }

  /// SHA-256 over the concatenation of the given parts.
  public static byte[] hash256(byte[]... parts) {
    SHA256Digest digest = new SHA256Digest();
    for (byte[] part : parts) {
      digest.update(part, 0, part.length);
    }
    byte[] out = new byte[HASH_LENGTH];
    digest.doFinal(out, 0);
    return out;
  }

  /// Keystream of the requested length. NIST SP 800-108 counter mode KDF with HMAC-SHA256, keyed by `key`,
  /// with the fixed input `tag || seq`.
  public static byte[] prf(byte[] tag, byte[] key, Seq seq, int length) {
    byte[] out = new byte[length];
    if (length == 0) {
      return out;
    }
    KDFCounterBytesGenerator kdf = new KDFCounterBytesGenerator(new HMac(new SHA256Digest()));
    kdf.init(new KDFCounterParameters(key, Arrays.concatenate(tag, seq.toBytes()), 32));
    kdf.generateBytes(out, 0, length);
    return out;
  }

  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    return Arrays.constantTimeAreEqual(a, b);
  }

  public static void zero(byte[] bytes) {
    if (bytes != null) {
      Arrays.fill(bytes, (byte) 0);
    }
  }
}
