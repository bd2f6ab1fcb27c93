// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.veil;

import java.nio.ByteBuffer;

/// Interface for serializing and deserializing objects to ByteBuffers
public interface Pickler<T> {
  /// Serializes the given object into the provided ByteBuffer
  ///
  /// @param object The object to serialize
  /// @param buffer The ByteBuffer to write to, which must have at least [#sizeOf] bytes remaining
  void serialize(T object, ByteBuffer buffer);

  /// Deserializes an object from the provided ByteBuffer
  ///
  /// @param buffer The ByteBuffer to read from
  /// @return The deserialized object
  T deserialize(ByteBuffer buffer);

  /// Calculates the size in bytes required to serialize the given object
  ///
  /// @param value The object to calculate the size for
  /// @return The number of bytes required to serialize the object
  int sizeOf(T value);

  /// Convenience for callers that want a right-sized array rather than writing into a pooled buffer.
  default byte[] pickle(T object) {
    ByteBuffer buffer = ByteBuffer.allocate(sizeOf(object));
    serialize(object, buffer);
    return buffer.array();
  }
}
