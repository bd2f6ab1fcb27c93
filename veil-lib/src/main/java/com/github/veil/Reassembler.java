// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil;

import com.github.veil.network.NetworkAddress;

/// Receives decrypted fragments in arrival order, which need not be send order, and rebuilds the original payloads.
@FunctionalInterface
public interface Reassembler {
  void accept(NetworkAddress from, byte[] piece);
}
