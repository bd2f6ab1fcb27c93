// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil;

import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.UUID;

public class NonceSourcePropertyTests {

  @Property
  void everyDrawExceedsAllEarlierDraws(@ForAll long most, @ForAll long least, @ForAll @IntRange(min = 1, max = 200) int draws) {
    final var source = new NonceSource(new UUID(most, least));
    Seq highest = source.next();
    for (int i = 1; i < draws; i++) {
      Seq next = source.next();
      if (next.compareTo(highest) <= 0) {
        throw new AssertionError(next + " is not above " + highest);
      }
      highest = next;
    }
  }

  @Property
  void drawsFitTheWireLimit(@ForAll long most, @ForAll long least) {
    final var seq = new NonceSource(new UUID(most, least)).next();
    // 256 bit seed plus one stride
    if (seq.toBytes().length > 33) {
      throw new AssertionError("seq too wide: " + seq.toBytes().length);
    }
  }
}
