// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.network.NetworkAddress;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import static com.github.veil.channel.ChannelLogger.LOGGER;

/// Maps peer addresses to live channels, starting a handshake on first use.
///
/// Concurrent callers asking for the same address while a handshake is in flight share that one handshake. Each
/// caller gets its own copy of the pending future so that one caller cancelling or timing out its copy does not
/// affect the others.
///
/// Channels accepted as the responding side are also filed under the client's address, so traffic back to that client
/// reuses the channel instead of running a second handshake. Connection ids are unique: a channel whose id is already
/// registered is refused rather than displacing the existing one.
///
/// Every channel carries a deferred expiry. The reaper wakes when the channel would become idle, rechecks the last
/// activity, and either reschedules itself for the remainder or tears the channel down. Teardown removes the channel
/// and zeroes its key, so the next request for the same address runs a fresh handshake with an unrelated key.
public class ChannelRegistry implements AutoCloseable {

  /// Runs the client side of a handshake with one peer.
  @FunctionalInterface
  public interface Connector {
    CompletableFuture<SecureChannel> connect(NetworkAddress peer);
  }

  private final Connector connector;
  private final long idleTimeoutNanos;
  private final ScheduledExecutorService reaper;
  private final boolean ownsReaper;

  private final Map<NetworkAddress, CompletableFuture<SecureChannel>> byAddress = new ConcurrentHashMap<>();
  private final Map<ConnectionId, SecureChannel> byConnection = new ConcurrentHashMap<>();
  private final List<BiConsumer<SecureChannel, String>> teardownListeners = new CopyOnWriteArrayList<>();

  private volatile boolean closed;

  public ChannelRegistry(Connector connector, Duration idleTimeout) {
    this(connector, idleTimeout, Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "veil-idle-reaper");
      t.setDaemon(true);
      return t;
    }), true);
  }

  ChannelRegistry(Connector connector, Duration idleTimeout, ScheduledExecutorService reaper, boolean ownsReaper) {
    this.connector = Objects.requireNonNull(connector, "connector required");
    Objects.requireNonNull(idleTimeout, "idleTimeout required");
    if (idleTimeout.isNegative() || idleTimeout.isZero()) {
      throw new IllegalArgumentException("idleTimeout must be positive: " + idleTimeout);
    }
    this.idleTimeoutNanos = idleTimeout.toNanos();
    this.reaper = Objects.requireNonNull(reaper, "reaper required");
    this.ownsReaper = ownsReaper;
  }

  /// Returns the live channel for `peer`, or joins or starts the handshake that will produce one. A failed handshake
  /// releases the entry so that the next request starts again from scratch.
  public CompletableFuture<SecureChannel> getOrCreate(NetworkAddress peer) {
    Objects.requireNonNull(peer, "peer required");
    while (true) {
      if (closed) {
        return CompletableFuture.failedFuture(new IllegalStateException("Channel registry is closed"));
      }
      final var fresh = new CompletableFuture<SecureChannel>();
      final var existing = byAddress.putIfAbsent(peer, fresh);
      if (existing == null) {
        LOGGER.fine(() -> "Starting handshake with " + peer);
        connect(peer, fresh);
        return fresh.copy();
      }
      final SecureChannel live = existing.isDone() && !existing.isCompletedExceptionally()
          ? existing.getNow(null)
          : null;
      if (live == null) {
        LOGGER.finest(() -> "Joining in-flight handshake with " + peer);
        return existing.copy();
      }
      if (live.isDestroyed()) {
        byAddress.remove(peer, existing);
        continue;
      }
      if (live.idleNanos() >= idleTimeoutNanos) {
        teardown(live, "idle");
        continue;
      }
      live.touch();
      return existing.copy();
    }
  }

  private void connect(NetworkAddress peer, CompletableFuture<SecureChannel> result) {
    final CompletableFuture<SecureChannel> attempt;
    try {
      attempt = connector.connect(peer);
    } catch (RuntimeException e) {
      byAddress.remove(peer, result);
      result.completeExceptionally(e);
      return;
    }
    attempt.whenComplete((channel, error) -> {
      if (error != null) {
        byAddress.remove(peer, result);
        LOGGER.fine(() -> "Handshake with " + peer + " failed: " + error);
        result.completeExceptionally(error);
        return;
      }
      if (closed) {
        byAddress.remove(peer, result);
        channel.destroy();
        result.completeExceptionally(new IllegalStateException("Channel registry closed during handshake"));
        return;
      }
      if (!register(channel)) {
        byAddress.remove(peer, result);
        channel.destroy();
        result.completeExceptionally(new SecureChannelException.ProtocolViolation(
            "Handshake with " + peer + " chose " + channel.connectionId() + " which is already in use"));
        return;
      }
      result.complete(channel);
    });
  }

  /// Registers a channel established by the responding side of a handshake and files it under the client's address
  /// unless a live or in-flight channel to that address already exists.
  ///
  /// @return false if another channel already holds the same connection id, in which case nothing is registered
  /// @throws IllegalStateException if the registry is closed; the channel is destroyed
  public boolean accept(SecureChannel channel) {
    Objects.requireNonNull(channel, "channel required");
    if (closed) {
      channel.destroy();
      throw new IllegalStateException("Channel registry is closed");
    }
    if (!register(channel)) {
      LOGGER.warning(() -> "Refusing " + channel + ": connection id already registered");
      return false;
    }
    byAddress.compute(channel.peerAddress(), (peer, current) ->
        current == null || isStale(current) ? CompletableFuture.completedFuture(channel) : current);
    return true;
  }

  private static boolean isStale(CompletableFuture<SecureChannel> future) {
    if (!future.isDone()) {
      return false;
    }
    return future.isCompletedExceptionally() || future.getNow(null).isDestroyed();
  }

  private boolean register(SecureChannel channel) {
    if (byConnection.putIfAbsent(channel.connectionId(), channel) != null) {
      return false;
    }
    LOGGER.fine(() -> "Registered " + channel);
    scheduleExpiry(channel, idleTimeoutNanos);
    return true;
  }

  /// Finds the channel that inbound traffic with this id belongs to.
  public Optional<SecureChannel> lookup(ConnectionId connectionId) {
    return Optional.ofNullable(byConnection.get(connectionId));
  }

  /// Removes the channel and zeroes its key. Listeners hear about each channel at most once.
  public void teardown(SecureChannel channel, String reason) {
    final boolean removed = byConnection.remove(channel.connectionId(), channel);
    byAddress.computeIfPresent(channel.peerAddress(), (peer, future) ->
        future.isDone() && !future.isCompletedExceptionally() && future.getNow(null) == channel ? null : future);
    channel.destroy();
    if (removed) {
      LOGGER.fine(() -> "Tore down " + channel + " (" + reason + ")");
      teardownListeners.forEach(listener -> listener.accept(channel, reason));
    }
  }

  public void addTeardownListener(BiConsumer<SecureChannel, String> listener) {
    teardownListeners.add(Objects.requireNonNull(listener, "listener required"));
  }

  /// Number of registered channels.
  public int size() {
    return byConnection.size();
  }

  private void scheduleExpiry(SecureChannel channel, long delayNanos) {
    if (closed) {
      return;
    }
    try {
      reaper.schedule(() -> checkIdle(channel), delayNanos, TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      if (!closed) {
        LOGGER.severe(() -> "Idle reaper rejected " + channel + ": " + e.getMessage());
        teardown(channel, "reaper unavailable");
      }
    }
  }

  private void checkIdle(SecureChannel channel) {
    if (channel.isDestroyed()) {
      return;
    }
    final long idle = channel.idleNanos();
    if (idle >= idleTimeoutNanos) {
      teardown(channel, "idle");
    } else {
      scheduleExpiry(channel, idleTimeoutNanos - idle);
    }
  }

  /// Destroys every channel and fails handshakes still in flight.
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (ownsReaper) {
      reaper.shutdownNow();
    }
    byConnection.values().forEach(channel -> teardown(channel, "closed"));
    byAddress.values().forEach(future ->
        future.completeExceptionally(new IllegalStateException("Channel registry is closed")));
    byAddress.clear();
    LOGGER.fine("Channel registry closed");
  }
}
