// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AuthorizationPolicyTest {

  private final IdentityKey alice = StaticIdentity.generate().publicKey();
  private final IdentityKey bob = StaticIdentity.generate().publicKey();
  private final IdentityKey mallory = StaticIdentity.generate().publicKey();

  @Test
  void membershipIsASetLookup() {
    AuthorizationPolicy policy = AuthorizationPolicy.of(alice, bob);
    assertTrue(policy.isMember(alice));
    assertTrue(policy.isMember(IdentityKey.fromEncoded(bob.encoded())));
    assertFalse(policy.isMember(mallory));
  }

  @Test
  void duplicateMembersAreTolerated() {
    AuthorizationPolicy policy = AuthorizationPolicy.of(alice, alice, bob);
    assertThat(((AuthorizationPolicy.AuthorizationSet) policy).members()).containsExactlyInAnyOrder(alice, bob);
  }

  @Test
  void setIsACopy() {
    var members = new ArrayList<>(List.of(alice));
    AuthorizationPolicy policy = AuthorizationPolicy.of(members);
    members.add(mallory);
    assertFalse(policy.isMember(mallory));
  }

  @Test
  void permitAllAcceptsAnyone() {
    assertTrue(AuthorizationPolicy.permitAll().isMember(mallory));
  }

  @Test
  void loadsHexKeysIgnoringCommentsAndBlankLines(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("authorized_keys");
    Files.write(file, List.of(
        "# cluster members",
        alice.toHex(),
        "",
        "   " + bob.toHex() + "   ",
        "# " + mallory.toHex()), StandardCharsets.UTF_8);

    AuthorizationPolicy policy = AuthorizationPolicy.load(file);

    assertTrue(policy.isMember(alice));
    assertTrue(policy.isMember(bob));
    assertFalse(policy.isMember(mallory));
  }

  @Test
  void badKeyInFileIsAnIdentificationFailure(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("authorized_keys");
    Files.write(file, List.of(alice.toHex(), "not-hex"), StandardCharsets.UTF_8);
    assertThrows(SecureChannelException.IdentificationFailed.class, () -> AuthorizationPolicy.load(file));

    Files.write(file, List.of("05" + "00".repeat(32)), StandardCharsets.UTF_8);
    assertThrows(SecureChannelException.IdentificationFailed.class, () -> AuthorizationPolicy.load(file));
  }

  @Test
  void missingFileIsAnIoFailure(@TempDir Path dir) {
    assertThrows(IOException.class, () -> AuthorizationPolicy.load(dir.resolve("absent")));
  }

  @Test
  void hexFormRoundTripsAndIsShortInLogs() {
    assertEquals(alice, IdentityKey.fromHex(alice.toHex()));
    assertThat(alice.toString()).hasSize("IdentityKey[]".length() + 16);
  }
}
