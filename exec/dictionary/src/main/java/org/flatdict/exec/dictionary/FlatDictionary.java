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

import org.flatdict.common.exceptions.UserException;
import org.flatdict.common.types.AttributeType;
import org.flatdict.exec.dictionary.source.DictionarySource;
import org.flatdict.exec.memory.OutOfMemoryException;
import org.flatdict.exec.memory.StringRef;

import com.google.common.base.Preconditions;

/**
 * Dictionary whose attributes are plain arrays indexed by identifier. Lookups
 * are a bounds check and an array read. Identifiers must be below
 * {@link FlatDictionaryOptions#getMaxArraySize()}, and every numeric attribute
 * costs that many slots regardless of how many rows are loaded.
 * <p>
 * The whole source is loaded by the constructor; a failing load leaves no
 * instance behind. Refreshing means building a new instance.
 */
public class FlatDictionary implements Dictionary {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(FlatDictionary.class);

  public static final String TYPE_NAME = "Flat";

  private final String name;
  private final DictionaryStructure structure;
  private final DictionarySource source;
  private final FlatDictionaryOptions options;
  private final AttributeTable table;
  private final long creationTime;
  private final long elementCount;

  public FlatDictionary(String name, DictionaryStructure structure, DictionarySource source) {
    this(name, structure, source, FlatDictionaryOptions.DEFAULT);
  }

  /**
   * Builds the dictionary and loads every row of {@code source}.
   *
   * @throws UserException if the null values cannot be parsed, storage cannot be
   *         allocated or the source data is invalid
   */
  public FlatDictionary(String name, DictionaryStructure structure, DictionarySource source,
      FlatDictionaryOptions options) {
    this.name = Preconditions.checkNotNull(name, "name cannot be null");
    this.structure = Preconditions.checkNotNull(structure, "structure cannot be null");
    this.source = Preconditions.checkNotNull(source, "source cannot be null");
    this.options = Preconditions.checkNotNull(options, "options cannot be null");
    this.creationTime = System.currentTimeMillis();

    logger.debug("Creating dictionary {} with {} and {}.", name, structure, options);
    try {
      this.table = AttributeTable.create(structure, options);
    } catch (OutOfMemoryException e) {
      throw UserException.memoryError(e)
          .addContext("Maximum array size", options.getMaxArraySize())
          .addDictionary(name)
          .build(logger);
    } catch (UserException e) {
      throw UserException.validationError(e)
          .addDictionary(name)
          .build(logger);
    }
    this.elementCount = new DictionaryLoader(name, table, options).load(source);
  }

  private AttributeColumn column(String attributeName, AttributeType expected) {
    final AttributeColumn column = table.getColumn(attributeName);
    if (column.getType() != expected) {
      throw UserException.typeMismatchError()
          .message("Type mismatch: attribute %s has type %s", attributeName, column.getType())
          .addContext("Requested type", expected.getTypeName())
          .addDictionary(name)
          .build();
    }
    return column;
  }

  @Override
  public short getUInt8(String attributeName, long id) {
    return column(attributeName, AttributeType.UINT8).getUInt8(id);
  }

  @Override
  public int getUInt16(String attributeName, long id) {
    return column(attributeName, AttributeType.UINT16).getUInt16(id);
  }

  @Override
  public long getUInt32(String attributeName, long id) {
    return column(attributeName, AttributeType.UINT32).getUInt32(id);
  }

  @Override
  public long getUInt64(String attributeName, long id) {
    return column(attributeName, AttributeType.UINT64).getUInt64(id);
  }

  @Override
  public byte getInt8(String attributeName, long id) {
    return column(attributeName, AttributeType.INT8).getInt8(id);
  }

  @Override
  public short getInt16(String attributeName, long id) {
    return column(attributeName, AttributeType.INT16).getInt16(id);
  }

  @Override
  public int getInt32(String attributeName, long id) {
    return column(attributeName, AttributeType.INT32).getInt32(id);
  }

  @Override
  public long getInt64(String attributeName, long id) {
    return column(attributeName, AttributeType.INT64).getInt64(id);
  }

  @Override
  public float getFloat32(String attributeName, long id) {
    return column(attributeName, AttributeType.FLOAT32).getFloat32(id);
  }

  @Override
  public double getFloat64(String attributeName, long id) {
    return column(attributeName, AttributeType.FLOAT64).getFloat64(id);
  }

  @Override
  public StringRef getString(String attributeName, long id) {
    return column(attributeName, AttributeType.STRING).getString(id);
  }

  @Override
  public short getUInt8Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getUInt8(id);
  }

  @Override
  public int getUInt16Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getUInt16(id);
  }

  @Override
  public long getUInt32Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getUInt32(id);
  }

  @Override
  public long getUInt64Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getUInt64(id);
  }

  @Override
  public byte getInt8Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getInt8(id);
  }

  @Override
  public short getInt16Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getInt16(id);
  }

  @Override
  public int getInt32Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getInt32(id);
  }

  @Override
  public long getInt64Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getInt64(id);
  }

  @Override
  public float getFloat32Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getFloat32(id);
  }

  @Override
  public double getFloat64Unsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getFloat64(id);
  }

  @Override
  public StringRef getStringUnsafe(int attributeIndex, long id) {
    return table.getColumn(attributeIndex).getString(id);
  }

  @Override
  public int getAttributeIndex(String attributeName) {
    return table.getAttributeIndex(attributeName);
  }

  @Override
  public AttributeType getAttributeType(int attributeIndex) {
    return table.getColumn(attributeIndex).getType();
  }

  @Override
  public boolean isType(int attributeIndex, AttributeType type) {
    return table.getColumn(attributeIndex).getType() == type;
  }

  /**
   * @throws UserException UNSUPPORTED_OPERATION error if no attribute is hierarchical,
   *         TYPE_MISMATCH error if the hierarchical attribute is not of an integer type
   */
  @Override
  public long toParent(long id) {
    final AttributeColumn hierarchical = table.getHierarchical();
    if (hierarchical == null) {
      throw UserException.unsupportedError()
          .message("Dictionary %s has no hierarchical attribute", name)
          .addDictionary(name)
          .build();
    }
    return hierarchical.getParentId(id);
  }

  @Override
  public boolean hasHierarchy() {
    return table.getHierarchical() != null;
  }

  @Override
  public boolean isComplete() {
    return true;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public String getTypeName() {
    return TYPE_NAME;
  }

  @Override
  public DictionaryStructure getStructure() {
    return structure;
  }

  @Override
  public DictionarySource getSource() {
    return source;
  }

  public FlatDictionaryOptions getOptions() {
    return options;
  }

  @Override
  public long getCreationTime() {
    return creationTime;
  }

  @Override
  public long getElementCount() {
    return elementCount;
  }

  @Override
  public long getBytesAllocated() {
    return table.getBytesAllocated();
  }

  @Override
  public int getAttributeCount() {
    return table.size();
  }

  @Override
  public String toString() {
    return "FlatDictionary{name='" + name + "', elements=" + elementCount + '}';
  }
}
