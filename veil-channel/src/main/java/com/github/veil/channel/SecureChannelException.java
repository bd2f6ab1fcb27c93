// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil.channel;

/// Base exception for secure channel failures. Handshake failures are terminal for the one attempt that raised them
/// and are delivered to whoever asked for the channel. Fragment failures only ever cost the one fragment unless the
/// endpoint runs with [FragmentPolicy#STRICT].
public class SecureChannelException extends SecurityException {

  public SecureChannelException(String message) {
    super(message);
  }

  public SecureChannelException(String message, Throwable cause) {
    super(message, cause);
  }

  /// Malformed or invalid curve point or key encoding.
  public static class IdentificationFailed extends SecureChannelException {
    public IdentificationFailed(String message) {
      super(message);
    }

    public IdentificationFailed(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /// Peer public key is not a member of the authorization set.
  public static class NotAuthorized extends SecureChannelException {
    public NotAuthorized(String message) {
      super(message);
    }
  }

  /// Missing or malformed handshake fields, or a message that matches no known shape.
  public static class ProtocolViolation extends SecureChannelException {
    public ProtocolViolation(String message) {
      super(message);
    }

    public ProtocolViolation(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /// Fragment authentication tag mismatch.
  public static class AuthenticationFailed extends SecureChannelException {
    public AuthenticationFailed(String message) {
      super(message);
    }
  }

  /// A fragment whose seq this channel has already accepted.
  public static class ReplayDetected extends SecureChannelException {
    public ReplayDetected(String message) {
      super(message);
    }
  }
}
