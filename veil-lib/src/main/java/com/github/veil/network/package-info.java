// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The network package provides transport abstractions for the secure channel core.
///
/// Key types:
/// - `Transport`: sends opaque byte arrays to an address and delivers inbound datagrams to subscribers
/// - `NetworkAddress`: value typed remote endpoint used as the channel lookup key
/// - `Datagram`: inbound bytes tagged with the sender address
///
/// Design characteristics:
/// 1. No delivery order is assumed
/// 2. No reliability is assumed; lost handshakes surface as timeouts to the caller
/// 3. Physical sockets live outside this library
package com.github.veil.network;
