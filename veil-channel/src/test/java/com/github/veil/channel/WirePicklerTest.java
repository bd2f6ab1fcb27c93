// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.NonceSource;
import com.github.veil.Seq;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.UUID;

import static com.github.veil.channel.Handshakes.SERVER;
import static org.junit.jupiter.api.Assertions.*;

class WirePicklerTest {

  private final Handshakes handshakes = new Handshakes();
  private final WirePickler pickler = WirePickler.INSTANCE;

  private WireMessage.Traffic traffic() {
    Handshakes.Pair pair = handshakes.pair();
    Fragment fragment = pair.initiator().seal(new NonceSource(UUID.randomUUID()).next(), new byte[]{1, 2, 3, 4});
    return new WireMessage.Traffic(pair.initiator().connectionId(), fragment);
  }

  @Test
  void handshakeRequestKeepsEveryField() {
    var request = handshakes.client.begin(SERVER).request();
    byte[] bytes = pickler.pickle(request);
    assertEquals(pickler.sizeOf(request), bytes.length);
    assertEquals(WirePickler.TYPE_REQUEST, bytes[0]);

    var decoded = (WireMessage.HandshakeRequest) pickler.decode(bytes);
    assertEquals(WireMessage.SERVER_CONNECT, decoded.tag());
    assertEquals(request.clientEphemeralId(), decoded.clientEphemeralId());
    assertArrayEquals(request.ephemeralKey(), decoded.ephemeralKey());
    assertArrayEquals(request.publicKey(), decoded.publicKey());
  }

  @Test
  void handshakeReplyKeepsEveryField() {
    var reply = handshakes.server.respond(Handshakes.CLIENT, handshakes.client.begin(SERVER).request()).reply();
    var decoded = (WireMessage.HandshakeReply) pickler.decode(pickler.pickle(reply));
    assertEquals(reply.clientEphemeralId(), decoded.clientEphemeralId());
    assertEquals(reply.connectionId(), decoded.connectionId());
    assertArrayEquals(reply.ephemeralKey(), decoded.ephemeralKey());
    assertArrayEquals(reply.publicKey(), decoded.publicKey());
  }

  @Test
  void trafficKeepsTheFragment() {
    var traffic = traffic();
    byte[] bytes = pickler.pickle(traffic);
    assertEquals(pickler.sizeOf(traffic), bytes.length);
    var decoded = (WireMessage.Traffic) pickler.decode(bytes);
    assertEquals(traffic.connectionId(), decoded.connectionId());
    assertEquals(traffic.fragment(), decoded.fragment());
  }

  @Test
  void unknownTypeIsAProtocolViolation() {
    assertThrows(SecureChannelException.ProtocolViolation.class, () -> pickler.decode(new byte[]{9, 0, 0}));
    assertThrows(SecureChannelException.ProtocolViolation.class, () -> pickler.decode(new byte[0]));
  }

  @Test
  void wrongHandshakeTagIsAProtocolViolation() {
    byte[] bytes = pickler.pickle(handshakes.client.begin(SERVER).request());
    bytes[1] = 0x02;
    assertThrows(SecureChannelException.ProtocolViolation.class, () -> pickler.decode(bytes));
  }

  @Test
  void truncationIsAProtocolViolation() {
    byte[] bytes = pickler.pickle(traffic());
    for (int length : new int[]{1, 10, 17, bytes.length - 1}) {
      byte[] cut = Arrays.copyOf(bytes, length);
      assertThrows(SecureChannelException.ProtocolViolation.class, () -> pickler.decode(cut), "length " + length);
    }
  }

  @Test
  void trailingBytesAreAProtocolViolation() {
    byte[] bytes = pickler.pickle(traffic());
    assertThrows(SecureChannelException.ProtocolViolation.class,
        () -> pickler.decode(Arrays.copyOf(bytes, bytes.length + 1)));
  }

  @Test
  void oversizedLengthsAreAProtocolViolation() {
    var request = handshakes.client.begin(SERVER).request();
    ByteBuffer buffer = ByteBuffer.allocate(256);
    buffer.put(WirePickler.TYPE_REQUEST).put(WireMessage.SERVER_CONNECT);
    buffer.putLong(1L).putLong(2L);
    buffer.putShort((short) 200).put(new byte[200]);
    buffer.putShort((short) request.publicKey().length);
    assertThrows(SecureChannelException.ProtocolViolation.class,
        () -> pickler.deserialize(ByteBuffer.wrap(buffer.array())));
  }

  @Test
  void authTagOfTheWrongWidthIsAProtocolViolation() {
    var traffic = traffic();
    Fragment fragment = traffic.fragment();
    ByteBuffer buffer = ByteBuffer.allocate(128);
    buffer.put(WirePickler.TYPE_TRAFFIC);
    buffer.putLong(traffic.connectionId().value().getMostSignificantBits());
    buffer.putLong(traffic.connectionId().value().getLeastSignificantBits());
    byte[] seq = fragment.seq().toBytes();
    buffer.putShort((short) seq.length).put(seq);
    buffer.putInt(fragment.ciphertext().length).put(fragment.ciphertext());
    buffer.putShort((short) 16).put(Arrays.copyOf(fragment.authTag(), 16));
    byte[] bytes = Arrays.copyOf(buffer.array(), buffer.position());
    assertThrows(SecureChannelException.ProtocolViolation.class, () -> pickler.decode(bytes));
  }

  @Test
  void emptySeqIsAProtocolViolation() {
    ByteBuffer buffer = ByteBuffer.allocate(64);
    buffer.put(WirePickler.TYPE_TRAFFIC).putLong(1L).putLong(2L).putShort((short) 0);
    byte[] bytes = Arrays.copyOf(buffer.array(), buffer.position());
    assertThrows(SecureChannelException.ProtocolViolation.class, () -> pickler.decode(bytes));
  }

  @Test
  void largeSeqsSurvive() {
    Seq big = new Seq(BigInteger.ONE.shiftLeft(400).add(BigInteger.TEN));
    Fragment fragment = new Fragment(big, new byte[]{7}, new byte[Crypto.HASH_LENGTH]);
    var traffic = new WireMessage.Traffic(ConnectionId.random(), fragment);
    assertEquals(big, ((WireMessage.Traffic) pickler.decode(pickler.pickle(traffic))).fragment().seq());
  }
}
