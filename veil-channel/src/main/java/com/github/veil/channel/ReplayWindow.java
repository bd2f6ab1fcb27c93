// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import com.github.veil.Seq;

import java.util.TreeSet;

/// The most recent seqs a channel has accepted, at most `capacity` of them. Once full, the smallest retained seq is
/// the floor: anything below it is too old to tell apart from a replay and is refused along with exact duplicates.
final class ReplayWindow {

  private final int capacity;
  private final TreeSet<Seq> recent = new TreeSet<>();

  ReplayWindow(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
  }

  /// @return true if `seq` is new and now recorded, false if it is a duplicate or below the floor
  synchronized boolean accept(Seq seq) {
    if (recent.size() >= capacity && seq.compareTo(recent.first()) < 0) {
      return false;
    }
    if (!recent.add(seq)) {
      return false;
    }
    if (recent.size() > capacity) {
      recent.pollFirst();
    }
    return true;
  }

  synchronized int size() {
    return recent.size();
  }

  synchronized void clear() {
    recent.clear();
  }
}
