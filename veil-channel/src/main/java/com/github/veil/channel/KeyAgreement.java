// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.network.NetworkAddress;
import org.bouncycastle.math.ec.ECPoint;

import java.security.SecureRandom;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

import static com.github.veil.channel.ChannelLogger.LOGGER;

/// Unauthenticated three term elliptic curve Diffie-Hellman between two static identities, each contributing one
/// ephemeral key per attempt.
///
/// ```
/// client:  EKey = H( a·B  ||  c·B  ||  a·S )
/// server:  EKey = H( b·A  ||  b·C  ||  s·A )
/// ```
///
/// where `a, b` are the ephemeral scalars with points `A, B` and `c, s` are the client and server static secrets
/// with public keys `C, S`. The terms are pairwise equal so both sides derive the same key without sending it.
///
/// Nothing is signed. Only a holder of the matching static secret can derive a key that decrypts later traffic,
/// which authenticates the peer implicitly, but a transcript of the handshake can be fabricated by anyone from public
/// keys alone. The protocol is therefore repudiable and offers no non-repudiation at all.
public class KeyAgreement {

  private final StaticIdentity local;
  private final AuthorizationPolicy policy;
  private final boolean requireServerAuthorization;
  private final SecureRandom random;
  private final LongSupplier nanoClock;
  private final Supplier<ConnectionId> connectionIds;

  public KeyAgreement(StaticIdentity local, AuthorizationPolicy policy, ChannelConfig config) {
    this(local, policy, config.requireServerAuthorization(), new SecureRandom(), System::nanoTime);
  }

  KeyAgreement(StaticIdentity local,
               AuthorizationPolicy policy,
               boolean requireServerAuthorization,
               SecureRandom random,
               LongSupplier nanoClock) {
    this(local, policy, requireServerAuthorization, random, nanoClock, ConnectionId::random);
  }

  KeyAgreement(StaticIdentity local,
               AuthorizationPolicy policy,
               boolean requireServerAuthorization,
               SecureRandom random,
               LongSupplier nanoClock,
               Supplier<ConnectionId> connectionIds) {
    this.local = Objects.requireNonNull(local, "local identity required");
    this.policy = Objects.requireNonNull(policy, "policy required");
    this.requireServerAuthorization = requireServerAuthorization;
    this.random = Objects.requireNonNull(random, "random required");
    this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock required");
    this.connectionIds = Objects.requireNonNull(connectionIds, "connectionIds required");
  }

  /// Sends one handshake request and eventually yields the reply. Implementations must not block the caller.
  @FunctionalInterface
  public interface HandshakeExchange {
    CompletableFuture<WireMessage.HandshakeReply> exchange(NetworkAddress peer, WireMessage.HandshakeRequest request);
  }

  /// The outcome of the server half: the reply to send back and the channel it establishes.
  public record Response(WireMessage.HandshakeReply reply, SecureChannel channel) {
  }

  public IdentityKey localIdentity() {
    return local.publicKey();
  }

  /// Client role. The returned future completes with the channel or fails with the
  /// [SecureChannelException] that ended the attempt. The calling thread is never blocked.
  public CompletableFuture<SecureChannel> initiate(NetworkAddress peer, HandshakeExchange exchange) {
    final ClientHandshake handshake;
    final CompletableFuture<WireMessage.HandshakeReply> reply;
    try {
      handshake = begin(peer);
      reply = exchange.exchange(peer, handshake.request());
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    return reply.thenApply(handshake::complete);
  }

  /// Starts a client handshake by drawing a fresh ephemeral key pair.
  public ClientHandshake begin(NetworkAddress peer) {
    Objects.requireNonNull(peer, "peer required");
    return new ClientHandshake(peer, EphemeralKeyPair.generate(random), UUID.randomUUID());
  }

  /// Server role. Each call draws a new ephemeral key and a new connection id, even for a request seen before.
  ///
  /// @throws SecureChannelException.ProtocolViolation if the request has the wrong tag
  /// @throws SecureChannelException.IdentificationFailed if either point is malformed
  /// @throws SecureChannelException.NotAuthorized if the client key is not a member of the policy
  public Response respond(NetworkAddress from, WireMessage.HandshakeRequest request) {
    Objects.requireNonNull(from, "from required");
    if (request == null) {
      throw new SecureChannelException.ProtocolViolation("Missing handshake request");
    }
    if (request.tag() != WireMessage.SERVER_CONNECT) {
      throw new SecureChannelException.ProtocolViolation("Unexpected handshake tag: " + request.tag());
    }
    ECPoint clientEphemeral = Curve.decode(request.ephemeralKey());
    IdentityKey clientIdentity = IdentityKey.fromEncoded(request.publicKey());
    if (!policy.isMember(clientIdentity)) {
      LOGGER.warning(() -> "Rejecting handshake from " + from + ": " + clientIdentity + " is not authorized");
      throw new SecureChannelException.NotAuthorized("Client " + clientIdentity + " is not authorized");
    }

    EphemeralKeyPair ephemeral = EphemeralKeyPair.generate(random);
    ConnectionId connectionId = connectionIds.get();
    byte[] sharedKey = deriveKey(
        Curve.multiply(ephemeral.scalar(), clientEphemeral),
        Curve.multiply(ephemeral.scalar(), clientIdentity.point()),
        Curve.multiply(local.secretKey(), clientEphemeral));

    var reply = new WireMessage.HandshakeReply(
        request.clientEphemeralId(), connectionId, ephemeral.encodedPoint(), local.publicKey().encoded());
    var channel = new SecureChannel(
        connectionId, from, clientIdentity, SecureChannel.Role.RESPONDER, sharedKey, nanoClock);
    LOGGER.fine(() -> "Responded to handshake from " + from + " with " + connectionId);
    return new Response(reply, channel);
  }

  /// `H(p1 || p2 || p3)` over the compressed encodings.
  static byte[] deriveKey(ECPoint p1, ECPoint p2, ECPoint p3) {
    return Crypto.hash256(Curve.encode(p1), Curve.encode(p2), Curve.encode(p3));
  }

  /// The client half of one handshake attempt. Holds the ephemeral scalar until [#complete] consumes it; abandoning
  /// the object abandons the attempt.
  public final class ClientHandshake {
    private final NetworkAddress peer;
    private final UUID clientEphemeralId;
    private EphemeralKeyPair ephemeral;

    private ClientHandshake(NetworkAddress peer, EphemeralKeyPair ephemeral, UUID clientEphemeralId) {
      this.peer = peer;
      this.ephemeral = ephemeral;
      this.clientEphemeralId = clientEphemeralId;
    }

    public UUID clientEphemeralId() {
      return clientEphemeralId;
    }

    public WireMessage.HandshakeRequest request() {
      EphemeralKeyPair keys = current();
      return new WireMessage.HandshakeRequest(
          WireMessage.SERVER_CONNECT, clientEphemeralId, keys.encodedPoint(), local.publicKey().encoded());
    }

    /// Validates the reply and derives the channel. The ephemeral key pair is released whatever the outcome.
    ///
    /// @throws SecureChannelException.ProtocolViolation if a field is missing or the reply is for another attempt
    /// @throws SecureChannelException.IdentificationFailed if either point is malformed
    /// @throws SecureChannelException.NotAuthorized if the server key is required to be a member and is not
    public synchronized SecureChannel complete(WireMessage.HandshakeReply reply) {
      EphemeralKeyPair keys = current();
      ephemeral = null;
      if (reply == null) {
        throw new SecureChannelException.ProtocolViolation("Missing handshake reply from " + peer);
      }
      if (reply.connectionId() == null || reply.ephemeralKey() == null || reply.publicKey() == null) {
        throw new SecureChannelException.ProtocolViolation("Handshake reply from " + peer + " is missing fields");
      }
      if (!clientEphemeralId.equals(reply.clientEphemeralId())) {
        throw new SecureChannelException.ProtocolViolation("Handshake reply from " + peer
            + " answers " + reply.clientEphemeralId() + " not " + clientEphemeralId);
      }
      ECPoint serverEphemeral = Curve.decode(reply.ephemeralKey());
      IdentityKey serverIdentity = IdentityKey.fromEncoded(reply.publicKey());
      if (requireServerAuthorization && !policy.isMember(serverIdentity)) {
        LOGGER.warning(() -> "Rejecting handshake with " + peer + ": " + serverIdentity + " is not authorized");
        throw new SecureChannelException.NotAuthorized("Server " + serverIdentity + " is not authorized");
      }

      byte[] sharedKey = deriveKey(
          Curve.multiply(keys.scalar(), serverEphemeral),
          Curve.multiply(local.secretKey(), serverEphemeral),
          Curve.multiply(keys.scalar(), serverIdentity.point()));
      LOGGER.fine(() -> "Completed handshake with " + peer + " as " + reply.connectionId());
      return new SecureChannel(
          reply.connectionId(), peer, serverIdentity, SecureChannel.Role.INITIATOR, sharedKey, nanoClock);
    }

    private synchronized EphemeralKeyPair current() {
      if (ephemeral == null) {
        throw new IllegalStateException("Handshake with " + peer + " already completed");
      }
      return ephemeral;
    }
  }
}
