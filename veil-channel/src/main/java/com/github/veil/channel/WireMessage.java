// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import java.util.Objects;
import java.util.UUID;

/// The three shapes that travel between endpoints. Point and key fields are carried as raw encodings; they are only
/// validated as curve points by [KeyAgreement] so that a bad point surfaces as an identification failure rather than
/// as a framing error.
public sealed interface WireMessage {

  /// Role tag a client puts on a handshake request.
  byte SERVER_CONNECT = 0x01;

  /// Client to server: `{tag, clientEphemeralId, A, clientPublicKey}`.
  record HandshakeRequest(byte tag, UUID clientEphemeralId, byte[] ephemeralKey, byte[] publicKey)
      implements WireMessage {
    public HandshakeRequest {
      Objects.requireNonNull(clientEphemeralId, "clientEphemeralId required");
      Objects.requireNonNull(ephemeralKey, "ephemeralKey required");
      Objects.requireNonNull(publicKey, "publicKey required");
    }
  }

  /// Server to client: `{connectionId, B, serverPublicKey}`. The `clientEphemeralId` is echoed so the client can match
  /// the reply with the handshake that is waiting for it.
  record HandshakeReply(UUID clientEphemeralId, ConnectionId connectionId, byte[] ephemeralKey, byte[] publicKey)
      implements WireMessage {
  }

  /// Steady state traffic: `{connectionId (clear), seq, ciphertext, authTag}`.
  record Traffic(ConnectionId connectionId, Fragment fragment) implements WireMessage {
    public Traffic {
      Objects.requireNonNull(connectionId, "connectionId required");
      Objects.requireNonNull(fragment, "fragment required");
    }
  }
}
