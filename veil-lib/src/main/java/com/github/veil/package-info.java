// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Leaf components shared by the secure channel core.
///
/// - [com.github.veil.NonceSource] hands out globally unique, strictly increasing [com.github.veil.Seq] values.
/// - [com.github.veil.Pickler] is the codec seam used for every wire message.
/// - [com.github.veil.Chunker] and [com.github.veil.Reassembler] are the seams to the external payload chunking layer.
package com.github.veil;
