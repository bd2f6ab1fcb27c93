// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.Seq;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/// Per fragment encryption and authentication under a channel shared key.
///
/// ```
/// keystream  = PRF(ENC, key, seq) truncated to len(plaintext)
/// ciphertext = plaintext XOR keystream
/// authTag    = H( H(AUTH || key || seq) || seq || ciphertext )
/// ```
///
/// The keystream is a pure function of `(key, seq)` so a seq must never be used twice under one key. Seqs come from
/// [com.github.veil.NonceSource] which never repeats within a process, and keys die with their channel.
public final class FragmentCipher {

  static final byte[] ENC = "veil-fragment-enc".getBytes(StandardCharsets.UTF_8);
  static final byte[] AUTH = "veil-fragment-auth".getBytes(StandardCharsets.UTF_8);

  private FragmentCipher() {
  }

  public static Fragment encrypt(byte[] key, Seq seq, byte[] plaintext) {
    checkKey(key);
    Objects.requireNonNull(seq, "seq required");
    Objects.requireNonNull(plaintext, "plaintext required");
    byte[] ciphertext = xor(plaintext, Crypto.prf(ENC, key, seq, plaintext.length));
    return new Fragment(seq, ciphertext, authTag(key, seq, ciphertext));
  }

  /// @throws SecureChannelException.AuthenticationFailed if the tag does not match, in which case nothing is decrypted
  public static byte[] decrypt(byte[] key, Fragment fragment) {
    checkKey(key);
    Objects.requireNonNull(fragment, "fragment required");
    Seq seq = fragment.seq();
    byte[] ciphertext = fragment.ciphertext();
    byte[] expected = authTag(key, seq, ciphertext);
    if (!Crypto.constantTimeEquals(expected, fragment.authTag())) {
      throw new SecureChannelException.AuthenticationFailed("Fragment authentication failed for " + seq);
    }
    return xor(ciphertext, Crypto.prf(ENC, key, seq, ciphertext.length));
  }

  static byte[] authTag(byte[] key, Seq seq, byte[] ciphertext) {
    byte[] seqBytes = seq.toBytes();
    byte[] macKey = Crypto.hash256(AUTH, key, seqBytes);
    try {
      return Crypto.hash256(macKey, seqBytes, ciphertext);
    } finally {
      Crypto.zero(macKey);
    }
  }

  private static byte[] xor(byte[] data, byte[] keystream) {
    byte[] out = new byte[data.length];
    for (int i = 0; i < data.length; i++) {
      out[i] = (byte) (data[i] ^ keystream[i]);
    }
    Crypto.zero(keystream);
    return out;
  }

  private static void checkKey(byte[] key) {
    if (key == null || key.length != Crypto.HASH_LENGTH) {
      throw new IllegalArgumentException("Shared key must be " + Crypto.HASH_LENGTH + " bytes");
    }
  }
}
