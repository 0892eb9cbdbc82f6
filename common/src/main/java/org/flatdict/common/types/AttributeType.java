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
package org.flatdict.common.types;

import java.util.Locale;
import java.util.Map;

import org.flatdict.common.exceptions.UserException;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.UnsignedBytes;
import com.google.common.primitives.UnsignedInts;
import com.google.common.primitives.UnsignedLongs;

/**
 * The closed set of value types an attribute may have. Unsigned kinds are stored
 * in the signed Java primitive of the same width and widened on read.
 */
public enum AttributeType {
  UINT8("UInt8", 1, true),
  UINT16("UInt16", 2, true),
  UINT32("UInt32", 4, true),
  UINT64("UInt64", 8, true),
  INT8("Int8", 1, true),
  INT16("Int16", 2, true),
  INT32("Int32", 4, true),
  INT64("Int64", 8, true),
  FLOAT32("Float32", 4, false),
  FLOAT64("Float64", 8, false),
  STRING("String", -1, false);

  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AttributeType.class);

  private static final Map<String, AttributeType> BY_NAME;
  static {
    ImmutableMap.Builder<String, AttributeType> builder = ImmutableMap.builder();
    for (AttributeType type : values()) {
      builder.put(type.typeName.toLowerCase(Locale.ROOT), type);
    }
    BY_NAME = builder.build();
  }

  private final String typeName;
  private final int width;
  private final boolean integer;

  AttributeType(String typeName, int width, boolean integer) {
    this.typeName = typeName;
    this.width = width;
    this.integer = integer;
  }

  public String getTypeName() {
    return typeName;
  }

  /**
   * @return width of a stored value in bytes, -1 for variable width types
   */
  public int getWidth() {
    return width;
  }

  public boolean isInteger() {
    return integer;
  }

  public boolean isFixedWidth() {
    return width > 0;
  }

  /**
   * Looks up a type by its name, ignoring case.
   *
   * @throws UserException VALIDATION error if the name is not a known type
   */
  public static AttributeType fromName(String name) {
    AttributeType type = name == null ? null : BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (type == null) {
      throw UserException.validationError()
          .message("Unknown attribute type '%s'", name)
          .addContext("Supported types", BY_NAME.keySet().toString())
          .build(logger);
    }
    return type;
  }

  /**
   * Parses the textual representation of a value of this type. Integer values are
   * returned boxed in the Java primitive used for storage, so unsigned values carry
   * their raw bits: UInt8 as {@link Byte}, UInt16 as {@link Short}, UInt32 as
   * {@link Integer} and UInt64 as {@link Long}.
   *
   * @throws NumberFormatException if the text is not a valid value of this type
   */
  public Object parse(String text) {
    if (text == null) {
      throw new NumberFormatException("null");
    }
    switch (this) {
      case UINT8:
        return UnsignedBytes.parseUnsignedByte(text);
      case UINT16: {
        int value = Integer.parseInt(text);
        if ((value >>> Short.SIZE) != 0) {
          throw new NumberFormatException("out of range: " + text);
        }
        return (short) value;
      }
      case UINT32:
        return UnsignedInts.parseUnsignedInt(text);
      case UINT64:
        return UnsignedLongs.parseUnsignedLong(text);
      case INT8:
        return Byte.parseByte(text);
      case INT16:
        return Short.parseShort(text);
      case INT32:
        return Integer.parseInt(text);
      case INT64:
        return Long.parseLong(text);
      case FLOAT32:
        return Float.parseFloat(text);
      case FLOAT64:
        return Double.parseDouble(text);
      case STRING:
        return text;
      default:
        throw new UnsupportedOperationException("Unhandled type " + this);
    }
  }

  @Override
  public String toString() {
    return typeName;
  }
}
