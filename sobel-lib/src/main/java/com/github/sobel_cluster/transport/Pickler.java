// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.sobel_cluster.transport;

import java.nio.ByteBuffer;

/// Interface for serializing and deserializing objects to ByteBuffers
public interface Pickler<T> {
  /// Serializes the given object into the provided ByteBuffer
  ///
  /// @param object The object to serialize
  /// @param buffer The ByteBuffer to write to
  void serialize(T object, ByteBuffer buffer);

  /// Deserializes an object from the provided ByteBuffer
  ///
  /// @param buffer The ByteBuffer to read from
  /// @return The deserialized object
  T deserialize(ByteBuffer buffer);

  /// Calculates the size in bytes required to serialize the given object so the buffer can be allocated up front.
  int sizeOf(T value);

  default byte[] serialize(T object) {
    final var buffer = ByteBuffer.allocate(sizeOf(object));
    serialize(object, buffer);
    return buffer.array();
  }

  default T deserialize(byte[] bytes) {
    return deserialize(ByteBuffer.wrap(bytes));
  }
}
