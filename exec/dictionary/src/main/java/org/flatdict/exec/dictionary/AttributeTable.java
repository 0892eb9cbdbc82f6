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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The columns of a dictionary in schema order, with lookup by name.
 */
final class AttributeTable {
  private final ImmutableList<AttributeColumn> columns;
  private final ImmutableMap<String, Integer> indexByName;
  private final AttributeColumn hierarchical;

  private AttributeTable(ImmutableList<AttributeColumn> columns, AttributeColumn hierarchical) {
    this.columns = columns;
    ImmutableMap.Builder<String, Integer> names = ImmutableMap.builder();
    for (int i = 0; i < columns.size(); i++) {
      names.put(columns.get(i).getName(), i);
    }
    this.indexByName = names.build();
    this.hierarchical = hierarchical;
  }

  static AttributeTable create(DictionaryStructure structure, FlatDictionaryOptions options) {
    ImmutableList.Builder<AttributeColumn> columns = ImmutableList.builder();
    AttributeColumn hierarchical = null;
    for (AttributeDescriptor descriptor : structure.getAttributes()) {
      AttributeColumn column = AttributeColumn.create(descriptor, options);
      if (descriptor.isHierarchical()) {
        hierarchical = column;
      }
      columns.add(column);
    }
    return new AttributeTable(columns.build(), hierarchical);
  }

  /**
   * @throws UserException UNKNOWN_ATTRIBUTE error if there is no attribute with this name
   */
  int getAttributeIndex(String name) {
    Integer index = indexByName.get(name);
    if (index == null) {
      throw UserException.unknownAttributeError()
          .message("No such attribute '%s'", name)
          .build();
    }
    return index;
  }

  AttributeColumn getColumn(int index) {
    return columns.get(index);
  }

  AttributeColumn getColumn(String name) {
    return columns.get(getAttributeIndex(name));
  }

  int size() {
    return columns.size();
  }

  /**
   * @return the hierarchical column, or {@code null} if none is configured
   */
  AttributeColumn getHierarchical() {
    return hierarchical;
  }

  long getBytesAllocated() {
    long total = 0;
    for (AttributeColumn column : columns) {
      total += column.getBytesAllocated();
    }
    return total;
  }
}
