// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.Seq;
import com.github.veil.network.NetworkAddress;
import org.jetbrains.annotations.TestOnly;

import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;

import static com.github.veil.channel.ChannelLogger.LOGGER;

/// One live secure session with a peer. Holds the shared key for as long as the channel lives and zeroes it on
/// [#destroy()], after which traffic sent under it can no longer be decrypted by anyone, including both endpoints.
///
/// Both ends seal and open under the one key. Seqs cannot collide across the two processes: each nonce source starts
/// from a hash below `2^256` and only ever adds multiples of `2^256`, so two sources agree on a value only if their
/// seeds do. The role records which side ran the client half of the handshake.
public final class SecureChannel {

  /// How many recently accepted seqs each channel remembers for replay detection.
  static final int REPLAY_WINDOW = 1024;

  public enum Role {
    INITIATOR,
    RESPONDER
  }

  private final ConnectionId connectionId;
  private final NetworkAddress peerAddress;
  private final IdentityKey peerIdentity;
  private final Role role;
  private final byte[] sharedKey;
  private final LongSupplier nanoClock;
  private final ReplayWindow replayWindow;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private volatile long lastActivityNanos;
  private boolean destroyed;

  SecureChannel(ConnectionId connectionId,
                NetworkAddress peerAddress,
                IdentityKey peerIdentity,
                Role role,
                byte[] sharedKey,
                LongSupplier nanoClock) {
    this(connectionId, peerAddress, peerIdentity, role, sharedKey, nanoClock, REPLAY_WINDOW);
  }

  SecureChannel(ConnectionId connectionId,
                NetworkAddress peerAddress,
                IdentityKey peerIdentity,
                Role role,
                byte[] sharedKey,
                LongSupplier nanoClock,
                int replayWindow) {
    this.connectionId = Objects.requireNonNull(connectionId, "connectionId required");
    this.peerAddress = Objects.requireNonNull(peerAddress, "peerAddress required");
    this.peerIdentity = Objects.requireNonNull(peerIdentity, "peerIdentity required");
    this.role = Objects.requireNonNull(role, "role required");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock required");
    if (sharedKey == null || sharedKey.length != Crypto.HASH_LENGTH) {
      throw new IllegalArgumentException("Shared key must be " + Crypto.HASH_LENGTH + " bytes");
    }
    this.sharedKey = sharedKey;
    this.replayWindow = new ReplayWindow(replayWindow);
    this.lastActivityNanos = nanoClock.getAsLong();
  }

  public ConnectionId connectionId() {
    return connectionId;
  }

  public NetworkAddress peerAddress() {
    return peerAddress;
  }

  public IdentityKey peerIdentity() {
    return peerIdentity;
  }

  public Role role() {
    return role;
  }

  /// Encrypts one outbound fragment and counts as traffic.
  ///
  /// @throws IllegalStateException if the channel was destroyed
  public Fragment seal(Seq seq, byte[] plaintext) {
    lock.readLock().lock();
    try {
      checkLive();
      Fragment fragment = FragmentCipher.encrypt(sharedKey, seq, plaintext);
      touch();
      return fragment;
    } finally {
      lock.readLock().unlock();
    }
  }

  /// Authenticates and decrypts one inbound fragment. Fragments may arrive in any order. Only fragments that
  /// authenticate count as traffic.
  ///
  /// @throws SecureChannelException.AuthenticationFailed if the tag does not verify under this channel's key
  /// @throws SecureChannelException.ReplayDetected if this channel already accepted a fragment with the same seq, or
  /// the seq is older than everything in the replay window
  /// @throws IllegalStateException if the channel was destroyed
  public byte[] open(Fragment fragment) {
    lock.readLock().lock();
    try {
      checkLive();
      byte[] plaintext = FragmentCipher.decrypt(sharedKey, fragment);
      if (!replayWindow.accept(fragment.seq())) {
        throw new SecureChannelException.ReplayDetected("Duplicate or stale " + fragment.seq() + " on " + this);
      }
      touch();
      return plaintext;
    } finally {
      lock.readLock().unlock();
    }
  }

  /// Records a traffic event, which pushes back idle teardown.
  public void touch() {
    lastActivityNanos = nanoClock.getAsLong();
  }

  public long idleNanos() {
    return nanoClock.getAsLong() - lastActivityNanos;
  }

  /// Zeroes the shared key. Idempotent.
  public void destroy() {
    lock.writeLock().lock();
    try {
      if (destroyed) {
        return;
      }
      destroyed = true;
      Crypto.zero(sharedKey);
      replayWindow.clear();
    } finally {
      lock.writeLock().unlock();
    }
    LOGGER.fine(() -> "Destroyed " + this);
  }

  public boolean isDestroyed() {
    lock.readLock().lock();
    try {
      return destroyed;
    } finally {
      lock.readLock().unlock();
    }
  }

  /// Copy of the key bytes so that tests can compare what both sides derived. Zeroes once destroyed.
  @TestOnly
  byte[] sharedKey() {
    lock.readLock().lock();
    try {
      return sharedKey.clone();
    } finally {
      lock.readLock().unlock();
    }
  }

  @TestOnly
  int replayWindowSize() {
    return replayWindow.size();
  }

  private void checkLive() {
    if (destroyed) {
      throw new IllegalStateException(this + " has been destroyed");
    }
  }

  @Override
  public String toString() {
    return "SecureChannel[" + connectionId + ", " + role + ", " + peerAddress + "]";
  }
}
