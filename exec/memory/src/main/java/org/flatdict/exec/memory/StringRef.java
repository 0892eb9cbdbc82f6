/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.flatdict.exec.memory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Non-owning reference to a run of bytes, usually inside a {@link StringArena}
 * chunk. The referenced bytes are never modified once the reference exists.
 */
public final class StringRef {

  public static final StringRef EMPTY = new StringRef(new byte[0], 0, 0);

  private final byte[] data;
  private final int offset;
  private final int length;

  StringRef(byte[] data, int offset, int length) {
    this.data = data;
    this.offset = offset;
    this.length = length;
  }

  /**
   * Wraps the UTF-8 bytes of the given string outside of any arena. Used for
   * values shared by many slots, such as an attribute's null value.
   */
  public static StringRef of(String value) {
    Preconditions.checkNotNull(value, "value cannot be null");
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    return new StringRef(bytes, 0, bytes.length);
  }

  @VisibleForTesting
  byte[] buffer() {
    return data;
  }

  @VisibleForTesting
  int offset() {
    return offset;
  }

  public int length() {
    return length;
  }

  public boolean isEmpty() {
    return length == 0;
  }

  public byte byteAt(int index) {
    Preconditions.checkElementIndex(index, length);
    return data[offset + index];
  }

  /**
   * @return a copy of the referenced bytes
   */
  public byte[] getBytes() {
    return Arrays.copyOfRange(data, offset, offset + length);
  }

  /**
   * Decodes the referenced bytes as UTF-8.
   */
  @Override
  public String toString() {
    return new String(data, offset, length, StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StringRef)) {
      return false;
    }
    StringRef other = (StringRef) obj;
    if (length != other.length) {
      return false;
    }
    for (int i = 0; i < length; i++) {
      if (data[offset + i] != other.data[other.offset + i]) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = 1;
    for (int i = offset; i < offset + length; i++) {
      result = 31 * result + data[i];
    }
    return result;
  }
}
