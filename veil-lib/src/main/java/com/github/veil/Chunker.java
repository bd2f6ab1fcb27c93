// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil;

import java.util.List;

/// Splits an arbitrary payload into size bounded pieces that carry whatever tagging their [Reassembler] needs.
/// The channel layer treats each piece as an opaque plaintext and encrypts it as one fragment.
@FunctionalInterface
public interface Chunker {
  List<byte[]> split(byte[] payload);
}
