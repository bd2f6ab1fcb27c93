// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.network;

import java.io.Closeable;
import java.util.function.Consumer;

/// The secure channel core is agnostic to the underlying transport. This interface abstracts it.
///
/// Implementations must not block the caller of [#send] waiting for the remote side and give no ordering
/// guarantee between datagrams.
public interface Transport extends Closeable {
  void send(NetworkAddress to, byte[] payload);

  void subscribe(Consumer<Datagram> handler, String name);

  NetworkAddress localAddress();

  void start();
}
