// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.Chunker;
import com.github.veil.NonceSource;
import com.github.veil.Reassembler;
import com.github.veil.network.Datagram;
import com.github.veil.network.NetworkAddress;
import com.github.veil.network.Transport;

import java.io.Closeable;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.github.veil.channel.ChannelLogger.LOGGER;

/// Secure datagram endpoint. Payloads handed to [#send] are split by the [Chunker], each piece is stamped with a seq
/// from the [NonceSource] and sealed under the channel for the destination, and the resulting fragments go out over the
/// [Transport] unordered. Inbound fragments are authenticated, decrypted and handed to the [Reassembler] in whatever
/// order they arrive.
///
/// The endpoint answers handshakes as a server and starts them as a client through its [ChannelRegistry]. Nothing
/// here blocks a thread waiting for a peer: every wait is a [CompletableFuture] that the transport thread completes.
///
/// A handshake request seen again while its channel lives is answered with the reply already sent, so a duplicated
/// datagram never leaves an orphan channel on the server.
public class SecureEndpoint implements Closeable {

  /// Draws of a fresh connection id before a handshake is abandoned.
  static final int CONNECTION_ID_ATTEMPTS = 4;

  /// A request already answered, keyed by its client ephemeral id.
  private record AnsweredRequest(byte[] ephemeralKey, KeyAgreement.Response response) {
  }

  private final Transport transport;
  private final KeyAgreement keyAgreement;
  private final ChannelRegistry registry;
  private final NonceSource nonceSource;
  private final Chunker chunker;
  private final Reassembler reassembler;
  private final ChannelConfig config;
  private final Map<UUID, CompletableFuture<WireMessage.HandshakeReply>> pendingHandshakes = new ConcurrentHashMap<>();
  private final Map<UUID, AnsweredRequest> answered = new ConcurrentHashMap<>();

  private volatile boolean closed;

  public SecureEndpoint(Transport transport,
                        StaticIdentity identity,
                        AuthorizationPolicy policy,
                        ChannelConfig config,
                        Chunker chunker,
                        Reassembler reassembler) {
    this(transport, new KeyAgreement(identity, policy, config), NonceSource.global(), config, chunker, reassembler);
  }

  SecureEndpoint(Transport transport,
                 KeyAgreement keyAgreement,
                 NonceSource nonceSource,
                 ChannelConfig config,
                 Chunker chunker,
                 Reassembler reassembler) {
    this.transport = Objects.requireNonNull(transport, "transport required");
    this.keyAgreement = Objects.requireNonNull(keyAgreement, "keyAgreement required");
    this.nonceSource = Objects.requireNonNull(nonceSource, "nonceSource required");
    this.config = Objects.requireNonNull(config, "config required");
    this.chunker = Objects.requireNonNull(chunker, "chunker required");
    this.reassembler = Objects.requireNonNull(reassembler, "reassembler required");
    this.registry = new ChannelRegistry(peer -> keyAgreement.initiate(peer, this::exchange), config.idleTimeout());
    this.registry.addTeardownListener((channel, reason) ->
        answered.values().removeIf(a -> a.response().channel() == channel));
  }

  public void start() {
    transport.subscribe(this::onDatagram, "veil-endpoint-" + transport.localAddress());
    transport.start();
    LOGGER.info(() -> "Secure endpoint started on " + transport.localAddress()
        + " as " + keyAgreement.localIdentity());
  }

  /// Encrypts and sends `payload` to `to`, running a handshake first when there is no live channel. The future
  /// completes once every fragment has been handed to the transport, which says nothing about delivery.
  ///
  /// If the channel is torn down part way through, the remaining pieces go out once over a fresh channel.
  public CompletableFuture<Void> send(NetworkAddress to, byte[] payload) {
    Objects.requireNonNull(to, "to required");
    Objects.requireNonNull(payload, "payload required");
    if (closed) {
      return CompletableFuture.failedFuture(new IllegalStateException("Endpoint is closed"));
    }
    final List<byte[]> pieces = chunker.split(payload);
    return registry.getOrCreate(to).thenCompose(channel -> transmit(to, channel, pieces, 0, false));
  }

  private CompletableFuture<Void> transmit(NetworkAddress to,
                                           SecureChannel channel,
                                           List<byte[]> pieces,
                                           int fromIndex,
                                           boolean retried) {
    for (int i = fromIndex; i < pieces.size(); i++) {
      final Fragment fragment;
      try {
        fragment = channel.seal(nonceSource.next(), pieces.get(i));
      } catch (IllegalStateException e) {
        if (retried || closed || !channel.isDestroyed()) {
          return CompletableFuture.failedFuture(e);
        }
        final int resumeAt = i;
        LOGGER.fine(() -> channel + " was torn down mid send, resending from piece " + resumeAt);
        return registry.getOrCreate(to).thenCompose(fresh -> transmit(to, fresh, pieces, resumeAt, true));
      }
      transport.send(to, WirePickler.INSTANCE.pickle(new WireMessage.Traffic(channel.connectionId(), fragment)));
      LOGGER.finest(() -> "Sent " + fragment + " on " + channel);
    }
    return CompletableFuture.completedFuture(null);
  }

  public ChannelRegistry registry() {
    return registry;
  }

  public NetworkAddress localAddress() {
    return transport.localAddress();
  }

  CompletableFuture<WireMessage.HandshakeReply> exchange(NetworkAddress peer, WireMessage.HandshakeRequest request) {
    final UUID id = request.clientEphemeralId();
    final var reply = new CompletableFuture<WireMessage.HandshakeReply>();
    pendingHandshakes.put(id, reply);
    reply.orTimeout(config.handshakeTimeout().toNanos(), TimeUnit.NANOSECONDS)
        .whenComplete((r, error) -> {
          pendingHandshakes.remove(id, reply);
          if (error instanceof TimeoutException) {
            LOGGER.warning(() -> "Handshake with " + peer + " timed out after " + config.handshakeTimeout());
          }
        });
    transport.send(peer, WirePickler.INSTANCE.pickle(request));
    LOGGER.fine(() -> "Sent handshake request " + id + " to " + peer);
    return reply;
  }

  void onDatagram(Datagram datagram) {
    if (closed) {
      return;
    }
    final WireMessage message;
    try {
      message = WirePickler.INSTANCE.decode(datagram.payload());
    } catch (SecureChannelException.ProtocolViolation e) {
      LOGGER.warning(() -> "Dropping malformed datagram from " + datagram.from() + ": " + e.getMessage());
      return;
    }
    if (message instanceof WireMessage.HandshakeRequest request) {
      onHandshakeRequest(datagram.from(), request);
    } else if (message instanceof WireMessage.HandshakeReply reply) {
      onHandshakeReply(datagram.from(), reply);
    } else if (message instanceof WireMessage.Traffic traffic) {
      onTraffic(datagram.from(), traffic);
    }
  }

  private void onHandshakeRequest(NetworkAddress from, WireMessage.HandshakeRequest request) {
    final UUID id = request.clientEphemeralId();
    final AnsweredRequest previous = answered.get(id);
    if (previous != null && !previous.response().channel().isDestroyed()) {
      answerAgain(from, request, previous);
      return;
    }
    final KeyAgreement.Response response;
    try {
      response = respond(from, request);
    } catch (SecureChannelException e) {
      LOGGER.warning(() -> "Rejected handshake from " + from + ": " + e.getMessage());
      return;
    } catch (IllegalStateException e) {
      LOGGER.fine(() -> "Not answering " + from + ": " + e.getMessage());
      return;
    }
    final var entry = new AnsweredRequest(request.ephemeralKey().clone(), response);
    final var raced = previous == null ? answered.putIfAbsent(id, entry) : swap(id, previous, entry);
    if (raced != null) {
      registry.teardown(response.channel(), "duplicate handshake request");
      answerAgain(from, request, raced);
      return;
    }
    transport.send(from, WirePickler.INSTANCE.pickle(response.reply()));
  }

  /// Replaces an entry whose channel has gone, returning whichever other entry won a concurrent race.
  private AnsweredRequest swap(UUID id, AnsweredRequest stale, AnsweredRequest entry) {
    if (answered.replace(id, stale, entry)) {
      return null;
    }
    return answered.putIfAbsent(id, entry);
  }

  /// Runs the server half and registers the channel, drawing again while the connection id clashes.
  ///
  /// @throws IllegalStateException if the registry is closed or no free connection id turned up
  private KeyAgreement.Response respond(NetworkAddress from, WireMessage.HandshakeRequest request) {
    for (int attempt = 1; attempt <= CONNECTION_ID_ATTEMPTS; attempt++) {
      final var response = keyAgreement.respond(from, request);
      if (registry.accept(response.channel())) {
        return response;
      }
      response.channel().destroy();
      LOGGER.warning(() -> response.channel().connectionId() + " already in use, drawing another for " + from);
    }
    throw new IllegalStateException("No free connection id after " + CONNECTION_ID_ATTEMPTS + " attempts");
  }

  private void answerAgain(NetworkAddress from, WireMessage.HandshakeRequest request, AnsweredRequest previous) {
    final SecureChannel channel = previous.response().channel();
    if (!Arrays.equals(previous.ephemeralKey(), request.ephemeralKey()) || !channel.peerAddress().equals(from)) {
      LOGGER.warning(() -> "Dropping handshake request " + request.clientEphemeralId() + " from " + from
          + " that reuses an answered id with different contents");
      return;
    }
    LOGGER.fine(() -> "Repeating reply to handshake " + request.clientEphemeralId() + " from " + from);
    transport.send(from, WirePickler.INSTANCE.pickle(previous.response().reply()));
  }

  private void onHandshakeReply(NetworkAddress from, WireMessage.HandshakeReply reply) {
    final var pending = pendingHandshakes.remove(reply.clientEphemeralId());
    if (pending == null) {
      LOGGER.fine(() -> "Dropping handshake reply from " + from + " with no pending handshake "
          + reply.clientEphemeralId());
      return;
    }
    pending.complete(reply);
  }

  private void onTraffic(NetworkAddress from, WireMessage.Traffic traffic) {
    final Optional<SecureChannel> found = registry.lookup(traffic.connectionId());
    if (found.isEmpty()) {
      LOGGER.fine(() -> "Dropping traffic from " + from + " for unknown " + traffic.connectionId());
      return;
    }
    final SecureChannel channel = found.get();
    final byte[] plaintext;
    try {
      plaintext = channel.open(traffic.fragment());
    } catch (SecureChannelException.AuthenticationFailed e) {
      LOGGER.warning(() -> "Dropping forged " + traffic.fragment() + " from " + from + " on " + channel);
      if (config.fragmentPolicy() == FragmentPolicy.STRICT) {
        registry.teardown(channel, "authentication failure");
      }
      return;
    } catch (SecureChannelException.ReplayDetected e) {
      LOGGER.warning(() -> "Dropping replayed " + traffic.fragment() + " from " + from + " on " + channel);
      return;
    } catch (IllegalStateException e) {
      LOGGER.fine(() -> "Dropping traffic for " + channel + ": " + e.getMessage());
      return;
    }
    reassembler.accept(channel.peerAddress(), plaintext);
  }

  /// Fails pending handshakes, destroys every channel and closes the transport.
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    pendingHandshakes.values().forEach(pending ->
        pending.completeExceptionally(new IllegalStateException("Endpoint is closed")));
    pendingHandshakes.clear();
    registry.close();
    answered.clear();
    transport.close();
    LOGGER.info(() -> "Secure endpoint on " + transport.localAddress() + " closed");
  }
}
