// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

/// What an endpoint does with a channel after one of its fragments fails authentication.
public enum FragmentPolicy {
  /// Drop the fragment and keep the channel.
  LENIENT,
  /// Drop the fragment and tear the channel down.
  STRICT
}
