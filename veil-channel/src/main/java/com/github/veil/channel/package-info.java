// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Ephemeral, forward secret and repudiable secure channels over an unordered datagram transport.
///
/// A [com.github.veil.channel.KeyAgreement] combines each side's static identity with a fresh ephemeral key into a
/// 256 bit channel key that is never sent, never persisted, and zeroed when the
/// [com.github.veil.channel.ChannelRegistry] tears the channel down after a period without traffic. Once a key is
/// gone, traffic sent under it cannot be decrypted again, even by a later holder of both static secrets.
///
/// Each fragment is encrypted and authenticated independently by [com.github.veil.channel.FragmentCipher] under a
/// seq that is never reused, so fragments may be delivered in any order.
///
/// There are no signatures anywhere. A peer is authenticated only implicitly, by being able to derive the key, and
/// anyone holding the two public keys can produce a handshake transcript that looks exactly like a real one. Neither
/// party can prove to a third party that a conversation took place: there is no non-repudiation.
package com.github.veil.channel;
