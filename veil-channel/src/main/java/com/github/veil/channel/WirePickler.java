// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.Pickler;
import com.github.veil.Seq;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.UUID;

/// Binary framing for [WireMessage]. Every field is length prefixed after a one byte type:
///
/// ```
/// HandshakeRequest: type=1 | tag:1 | clientEphemeralId:16 | len:2 A | len:2 clientPublicKey
/// HandshakeReply:   type=2 | clientEphemeralId:16 | connectionId:16 | len:2 B | len:2 serverPublicKey
/// Traffic:          type=3 | connectionId:16 | len:2 seq | len:4 ciphertext | len:2 authTag
/// ```
///
/// Anything that does not match one of these shapes exactly is a [SecureChannelException.ProtocolViolation].
public final class WirePickler implements Pickler<WireMessage> {

  public static final WirePickler INSTANCE = new WirePickler();

  static final byte TYPE_REQUEST = 1;
  static final byte TYPE_REPLY = 2;
  static final byte TYPE_TRAFFIC = 3;

  static final int UUID_SIZE = 16;
  static final int MAX_SEQ_LENGTH = 64;
  static final int MAX_CIPHERTEXT_LENGTH = 1 << 20;

  private WirePickler() {
  }

  @Override
  public void serialize(WireMessage message, ByteBuffer buffer) {
    if (message instanceof WireMessage.HandshakeRequest request) {
      buffer.put(TYPE_REQUEST);
      buffer.put(request.tag());
      putUuid(buffer, request.clientEphemeralId());
      putShortBytes(buffer, request.ephemeralKey());
      putShortBytes(buffer, request.publicKey());
    } else if (message instanceof WireMessage.HandshakeReply reply) {
      buffer.put(TYPE_REPLY);
      putUuid(buffer, reply.clientEphemeralId());
      putUuid(buffer, reply.connectionId().value());
      putShortBytes(buffer, reply.ephemeralKey());
      putShortBytes(buffer, reply.publicKey());
    } else if (message instanceof WireMessage.Traffic traffic) {
      Fragment fragment = traffic.fragment();
      buffer.put(TYPE_TRAFFIC);
      putUuid(buffer, traffic.connectionId().value());
      putShortBytes(buffer, fragment.seq().toBytes());
      byte[] ciphertext = fragment.ciphertext();
      buffer.putInt(ciphertext.length);
      buffer.put(ciphertext);
      putShortBytes(buffer, fragment.authTag());
    } else {
      throw new IllegalArgumentException("Unknown message type: " + message.getClass());
    }
  }

  @Override
  public WireMessage deserialize(ByteBuffer buffer) {
    try {
      byte type = buffer.get();
      switch (type) {
        case TYPE_REQUEST: {
          byte tag = buffer.get();
          if (tag != WireMessage.SERVER_CONNECT) {
            throw new SecureChannelException.ProtocolViolation("Unexpected handshake tag: " + tag);
          }
          UUID clientEphemeralId = getUuid(buffer);
          byte[] ephemeralKey = getShortBytes(buffer, Curve.MAX_ENCODED_POINT_LENGTH, "ephemeral key");
          byte[] publicKey = getShortBytes(buffer, Curve.MAX_ENCODED_POINT_LENGTH, "public key");
          return new WireMessage.HandshakeRequest(tag, clientEphemeralId, ephemeralKey, publicKey);
        }
        case TYPE_REPLY: {
          UUID clientEphemeralId = getUuid(buffer);
          ConnectionId connectionId = new ConnectionId(getUuid(buffer));
          byte[] ephemeralKey = getShortBytes(buffer, Curve.MAX_ENCODED_POINT_LENGTH, "ephemeral key");
          byte[] publicKey = getShortBytes(buffer, Curve.MAX_ENCODED_POINT_LENGTH, "public key");
          return new WireMessage.HandshakeReply(clientEphemeralId, connectionId, ephemeralKey, publicKey);
        }
        case TYPE_TRAFFIC: {
          ConnectionId connectionId = new ConnectionId(getUuid(buffer));
          byte[] seq = getShortBytes(buffer, MAX_SEQ_LENGTH, "seq");
          if (seq.length == 0) {
            throw new SecureChannelException.ProtocolViolation("Empty seq");
          }
          int length = buffer.getInt();
          byte[] ciphertext = getBytes(buffer, length, MAX_CIPHERTEXT_LENGTH, "ciphertext");
          byte[] authTag = getShortBytes(buffer, Crypto.HASH_LENGTH, "auth tag");
          if (authTag.length != Crypto.HASH_LENGTH) {
            throw new SecureChannelException.ProtocolViolation("Auth tag must be " + Crypto.HASH_LENGTH + " bytes");
          }
          return new WireMessage.Traffic(connectionId, new Fragment(Seq.fromBytes(seq), ciphertext, authTag));
        }
        default:
          throw new SecureChannelException.ProtocolViolation("Unknown message type: " + type);
      }
    } catch (BufferUnderflowException e) {
      throw new SecureChannelException.ProtocolViolation("Truncated message", e);
    }
  }

  /// Strict decode of one whole datagram: trailing bytes are a violation.
  public WireMessage decode(byte[] bytes) {
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    WireMessage message = deserialize(buffer);
    if (buffer.hasRemaining()) {
      throw new SecureChannelException.ProtocolViolation(buffer.remaining() + " trailing bytes after "
          + message.getClass().getSimpleName());
    }
    return message;
  }

  @Override
  public int sizeOf(WireMessage message) {
    if (message instanceof WireMessage.HandshakeRequest request) {
      return 1 + 1 + UUID_SIZE + 2 + request.ephemeralKey().length + 2 + request.publicKey().length;
    } else if (message instanceof WireMessage.HandshakeReply reply) {
      return 1 + UUID_SIZE + UUID_SIZE + 2 + reply.ephemeralKey().length + 2 + reply.publicKey().length;
    } else if (message instanceof WireMessage.Traffic traffic) {
      Fragment fragment = traffic.fragment();
      return 1 + UUID_SIZE + 2 + fragment.seq().toBytes().length + 4 + fragment.length() + 2 + Crypto.HASH_LENGTH;
    }
    throw new IllegalArgumentException("Unknown message type: " + message.getClass());
  }

  private static void putUuid(ByteBuffer buffer, UUID uuid) {
    buffer.putLong(uuid.getMostSignificantBits());
    buffer.putLong(uuid.getLeastSignificantBits());
  }

  private static UUID getUuid(ByteBuffer buffer) {
    return new UUID(buffer.getLong(), buffer.getLong());
  }

  private static void putShortBytes(ByteBuffer buffer, byte[] bytes) {
    buffer.putShort((short) bytes.length);
    buffer.put(bytes);
  }

  private static byte[] getShortBytes(ByteBuffer buffer, int max, String field) {
    return getBytes(buffer, Short.toUnsignedInt(buffer.getShort()), max, field);
  }

  private static byte[] getBytes(ByteBuffer buffer, int length, int max, String field) {
    if (length < 0 || length > max) {
      throw new SecureChannelException.ProtocolViolation("Invalid " + field + " length: " + length);
    }
    if (length > buffer.remaining()) {
      throw new SecureChannelException.ProtocolViolation("Truncated " + field + ": wanted " + length
          + " bytes, " + buffer.remaining() + " remaining");
    }
    byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }
}
