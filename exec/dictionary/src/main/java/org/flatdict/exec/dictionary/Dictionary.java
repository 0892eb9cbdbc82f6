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

import org.flatdict.common.types.AttributeType;
import org.flatdict.exec.dictionary.source.DictionarySource;
import org.flatdict.exec.memory.StringRef;

/**
 * Read only mapping from an unsigned integer identifier to a row of typed
 * attributes. A dictionary is fully loaded when constructed and may then be read
 * from any number of threads without synchronization.
 * <p>
 * Getters taking an attribute name check that the attribute exists and has the
 * requested type. Getters taking an attribute index skip both checks. An
 * identifier without a loaded row yields the attribute's null value.
 * <p>
 * Unsigned values are returned in the next wider signed type, except UInt64
 * which is returned as the raw bits of a {@code long}.
 */
public interface Dictionary {

  String getName();

  /**
   * @return name of the storage layout, such as {@code Flat}
   */
  String getTypeName();

  DictionaryStructure getStructure();

  DictionarySource getSource();

  /**
   * @return wall clock time at which loading started, in milliseconds since the epoch
   */
  long getCreationTime();

  /**
   * @return number of rows read from the source, duplicates included
   */
  long getElementCount();

  long getBytesAllocated();

  int getAttributeCount();

  /**
   * @return {@code true} once every row of the source is loaded
   */
  boolean isComplete();

  boolean hasHierarchy();

  /**
   * Resolves the parent of {@code id} through the hierarchical attribute.
   */
  long toParent(long id);

  int getAttributeIndex(String attributeName);

  AttributeType getAttributeType(int attributeIndex);

  boolean isType(int attributeIndex, AttributeType type);

  short getUInt8(String attributeName, long id);

  int getUInt16(String attributeName, long id);

  long getUInt32(String attributeName, long id);

  long getUInt64(String attributeName, long id);

  byte getInt8(String attributeName, long id);

  short getInt16(String attributeName, long id);

  int getInt32(String attributeName, long id);

  long getInt64(String attributeName, long id);

  float getFloat32(String attributeName, long id);

  double getFloat64(String attributeName, long id);

  StringRef getString(String attributeName, long id);

  short getUInt8Unsafe(int attributeIndex, long id);

  int getUInt16Unsafe(int attributeIndex, long id);

  long getUInt32Unsafe(int attributeIndex, long id);

  long getUInt64Unsafe(int attributeIndex, long id);

  byte getInt8Unsafe(int attributeIndex, long id);

  short getInt16Unsafe(int attributeIndex, long id);

  int getInt32Unsafe(int attributeIndex, long id);

  long getInt64Unsafe(int attributeIndex, long id);

  float getFloat32Unsafe(int attributeIndex, long id);

  double getFloat64Unsafe(int attributeIndex, long id);

  StringRef getStringUnsafe(int attributeIndex, long id);
}
