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
package org.flatdict.exec.dictionary;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.flatdict.common.exceptions.UserException;
import org.flatdict.common.types.AttributeType;
import org.flatdict.exec.memory.OutOfMemoryException;
import org.flatdict.exec.memory.StringArena;
import org.flatdict.exec.memory.StringRef;

/**
 * Storage of a single attribute, indexed directly by identifier.
 * <p>
 * Exactly one of the typed arrays is in use, chosen by the attribute type.
 * Numeric columns hold {@code maxArraySize} slots from the start. String columns
 * start small and grow while loading; their bytes live in the column's own
 * {@link StringArena}. Every slot not written by the loader holds the null value.
 * <p>
 * Getters return the null value for identifiers outside the allocated range and
 * do not check the attribute type; calling the getter of another type fails with
 * a {@link NullPointerException}.
 */
final class AttributeColumn {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AttributeColumn.class);

  /** Estimated size of a reference slot in a string column. */
  private static final int REFERENCE_SIZE = 8;

  private final String name;
  private final AttributeType type;
  private final int maxArraySize;

  private final byte[] bytes;
  private final short[] shorts;
  private final int[] ints;
  private final long[] longs;
  private final float[] floats;
  private final double[] doubles;

  private final byte byteNull;
  private final short shortNull;
  private final int intNull;
  private final long longNull;
  private final float floatNull;
  private final double doubleNull;

  private final StringArena arena;
  private final StringRef stringNull;
  // replaced while loading, never after the dictionary is published
  private StringRef[] strings;

  private AttributeColumn(String name, AttributeType type, Object nullValue, FlatDictionaryOptions options) {
    this.name = name;
    this.type = type;
    this.maxArraySize = options.getMaxArraySize();
    final int size = maxArraySize;

    byte[] bytes = null;
    short[] shorts = null;
    int[] ints = null;
    long[] longs = null;
    float[] floats = null;
    double[] doubles = null;
    byte byteNull = 0;
    short shortNull = 0;
    int intNull = 0;
    long longNull = 0;
    float floatNull = 0;
    double doubleNull = 0;
    StringArena arena = null;
    StringRef stringNull = null;
    StringRef[] strings = null;

    try {
      switch (type) {
        case UINT8:
        case INT8:
          byteNull = (Byte) nullValue;
          bytes = new byte[size];
          Arrays.fill(bytes, byteNull);
          break;
        case UINT16:
        case INT16:
          shortNull = (Short) nullValue;
          shorts = new short[size];
          Arrays.fill(shorts, shortNull);
          break;
        case UINT32:
        case INT32:
          intNull = (Integer) nullValue;
          ints = new int[size];
          Arrays.fill(ints, intNull);
          break;
        case UINT64:
        case INT64:
          longNull = (Long) nullValue;
          longs = new long[size];
          Arrays.fill(longs, longNull);
          break;
        case FLOAT32:
          floatNull = (Float) nullValue;
          floats = new float[size];
          Arrays.fill(floats, floatNull);
          break;
        case FLOAT64:
          doubleNull = (Double) nullValue;
          doubles = new double[size];
          Arrays.fill(doubles, doubleNull);
          break;
        case STRING:
          arena = new StringArena();
          stringNull = StringRef.of((String) nullValue);
          strings = new StringRef[options.getInitialArraySize()];
          Arrays.fill(strings, stringNull);
          break;
        default:
          throw new UnsupportedOperationException("Unhandled attribute type " + type);
      }
    } catch (OutOfMemoryError e) {
      throw new OutOfMemoryException(
          String.format("Failure allocating %d slots for attribute %s of type %s.", size, name, type), e);
    }

    this.bytes = bytes;
    this.shorts = shorts;
    this.ints = ints;
    this.longs = longs;
    this.floats = floats;
    this.doubles = doubles;
    this.byteNull = byteNull;
    this.shortNull = shortNull;
    this.intNull = intNull;
    this.longNull = longNull;
    this.floatNull = floatNull;
    this.doubleNull = doubleNull;
    this.arena = arena;
    this.stringNull = stringNull;
    this.strings = strings;
  }

  /**
   * Creates an empty column with every slot set to the parsed null value.
   *
   * @throws UserException VALUE_PARSE error if the null value is not a valid value of the type
   * @throws OutOfMemoryException if the storage cannot be allocated
   */
  static AttributeColumn create(String name, AttributeType type, String nullValueText,
      FlatDictionaryOptions options) {
    final Object nullValue;
    try {
      nullValue = type.parse(nullValueText);
    } catch (NumberFormatException e) {
      throw UserException.valueParseError(e)
          .message("Cannot parse null value '%s' of attribute %s as %s", nullValueText, name, type)
          .addContext("Attribute", name)
          .build(logger);
    }
    return new AttributeColumn(name, type, nullValue, options);
  }

  static AttributeColumn create(AttributeDescriptor descriptor, FlatDictionaryOptions options) {
    return create(descriptor.getName(), descriptor.getType(), descriptor.getNullValue(), options);
  }

  String getName() {
    return name;
  }

  AttributeType getType() {
    return type;
  }

  private boolean inRange(long id) {
    return id >= 0 && id < maxArraySize;
  }

  short getUInt8(long id) {
    return (short) Byte.toUnsignedInt(inRange(id) ? bytes[(int) id] : byteNull);
  }

  int getUInt16(long id) {
    return Short.toUnsignedInt(inRange(id) ? shorts[(int) id] : shortNull);
  }

  long getUInt32(long id) {
    return Integer.toUnsignedLong(inRange(id) ? ints[(int) id] : intNull);
  }

  long getUInt64(long id) {
    return inRange(id) ? longs[(int) id] : longNull;
  }

  byte getInt8(long id) {
    return inRange(id) ? bytes[(int) id] : byteNull;
  }

  short getInt16(long id) {
    return inRange(id) ? shorts[(int) id] : shortNull;
  }

  int getInt32(long id) {
    return inRange(id) ? ints[(int) id] : intNull;
  }

  long getInt64(long id) {
    return inRange(id) ? longs[(int) id] : longNull;
  }

  float getFloat32(long id) {
    return inRange(id) ? floats[(int) id] : floatNull;
  }

  double getFloat64(long id) {
    return inRange(id) ? doubles[(int) id] : doubleNull;
  }

  StringRef getString(long id) {
    final StringRef[] strings = this.strings;
    return id >= 0 && id < strings.length ? strings[(int) id] : stringNull;
  }

  /**
   * Reads the value at {@code id} as a parent identifier.
   *
   * @throws UserException TYPE_MISMATCH error if the attribute is not of an integer type
   */
  long getParentId(long id) {
    if (!type.isInteger()) {
      throw UserException.typeMismatchError()
          .message("Hierarchical attribute has non-integer type %s", type)
          .addContext("Attribute", name)
          .build();
    }
    switch (type) {
      case UINT8:
        return getUInt8(id);
      case UINT16:
        return getUInt16(id);
      case UINT32:
        return getUInt32(id);
      case UINT64:
        return getUInt64(id);
      case INT8:
        return getInt8(id);
      case INT16:
        return getInt16(id);
      case INT32:
        return getInt32(id);
      case INT64:
        return getInt64(id);
      default:
        throw new UnsupportedOperationException("Unhandled integer type " + type);
    }
  }

  /**
   * Stores a loaded value. Numbers are narrowed to the storage type, strings are
   * copied into the arena. The caller has already checked {@code id} against the
   * maximum array size.
   *
   * @throws UserException TYPE_MISMATCH error if the value class does not fit the attribute type
   * @throws OutOfMemoryException if string storage cannot grow
   */
  void set(int id, Object value) {
    if (type == AttributeType.STRING) {
      setString(id, value);
      return;
    }
    if (!(value instanceof Number)) {
      throw valueMismatch(value);
    }
    final Number number = (Number) value;
    switch (type) {
      case UINT8:
      case INT8:
        bytes[id] = number.byteValue();
        break;
      case UINT16:
      case INT16:
        shorts[id] = number.shortValue();
        break;
      case UINT32:
      case INT32:
        ints[id] = number.intValue();
        break;
      case UINT64:
      case INT64:
        longs[id] = number.longValue();
        break;
      case FLOAT32:
        floats[id] = number.floatValue();
        break;
      case FLOAT64:
        doubles[id] = number.doubleValue();
        break;
      default:
        throw new UnsupportedOperationException("Unhandled attribute type " + type);
    }
  }

  private void setString(int id, Object value) {
    final byte[] data;
    if (value instanceof CharSequence) {
      data = value.toString().getBytes(StandardCharsets.UTF_8);
    } else if (value instanceof byte[]) {
      data = (byte[]) value;
    } else if (value instanceof StringRef) {
      data = ((StringRef) value).getBytes();
    } else {
      throw valueMismatch(value);
    }
    if (id >= strings.length) {
      grow(id);
    }
    strings[id] = arena.insert(data);
  }

  private void grow(int id) {
    final int oldLength = strings.length;
    final int newLength = (int) Math.min(maxArraySize, Math.max(2L * oldLength, 2L * id));
    try {
      strings = Arrays.copyOf(strings, newLength);
    } catch (OutOfMemoryError e) {
      throw new OutOfMemoryException(
          String.format("Failure growing attribute %s to %d slots.", name, newLength), e);
    }
    Arrays.fill(strings, oldLength, newLength, stringNull);
    logger.trace("Grew attribute {} from {} to {} slots.", name, oldLength, newLength);
  }

  private UserException valueMismatch(Object value) {
    return UserException.typeMismatchError()
        .message("Value of class %s cannot be stored in attribute %s of type %s",
            value == null ? "null" : value.getClass().getName(), name, type)
        .addContext("Attribute", name)
        .build(logger);
  }

  /**
   * @return number of slots currently allocated
   */
  int getCapacity() {
    return type.isFixedWidth() ? maxArraySize : strings.length;
  }

  long getBytesAllocated() {
    if (type.isFixedWidth()) {
      return (long) maxArraySize * type.getWidth();
    }
    return (long) strings.length * REFERENCE_SIZE + arena.getAllocatedBytes();
  }

  @Override
  public String toString() {
    return "AttributeColumn{name='" + name + "', type=" + type + ", capacity=" + getCapacity() + '}';
  }
}
