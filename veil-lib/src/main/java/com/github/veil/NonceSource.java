// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil;

import com.github.f4b6a3.uuid.UuidCreator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static com.github.veil.VeilLogger.LOGGER;

/// Process-wide source of [Seq] values. Every draw is strictly greater than every earlier draw from the same source
/// regardless of which thread asks. Draws by concurrent callers interleave but never collide.
///
/// The running value is seeded with the SHA-256 hash of a fresh UUIDv7 and each draw adds 2^256, so every draw
/// lives in its own band above any hash-sized value. Nothing is persisted: the keys these nonces protect do not
/// survive a restart either.
public final class NonceSource {

  /// Width of one band. Each draw advances the counter by exactly this amount.
  public static final BigInteger STRIDE = BigInteger.ONE.shiftLeft(256);

  private static class Holder {
    static final NonceSource GLOBAL = new NonceSource(UuidCreator.getTimeOrderedEpoch());
  }

  private final AtomicReference<BigInteger> current;

  /// Creates an independent source. Production code should share [#global()] so that uniqueness holds process-wide.
  public NonceSource(UUID seedId) {
    this.current = new AtomicReference<>(seedFrom(seedId));
    LOGGER.fine(() -> "NonceSource seeded from " + seedId);
  }

  public static NonceSource global() {
    return Holder.GLOBAL;
  }

  /// @return a value strictly greater than every value previously returned by this source
  public Seq next() {
    return new Seq(current.updateAndGet(v -> v.add(STRIDE)));
  }

  static BigInteger seedFrom(UUID id) {
    ByteBuffer raw = ByteBuffer.allocate(16);
    raw.putLong(id.getMostSignificantBits());
    raw.putLong(id.getLeastSignificantBits());
    SHA256Digest digest = new SHA256Digest();
    digest.update(raw.array(), 0, raw.capacity());
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return BigIntegers.fromUnsignedByteArray(out);
  }
}
