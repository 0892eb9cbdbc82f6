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
package org.flatdict.exec.dictionary.source;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A batch of rows in columnar form. Position 0 holds the identifiers, positions
 * 1..n the attribute values in schema order.
 */
public class Block {

  public static final Block EMPTY = new Block(ImmutableList.<ValueColumn>of());

  private final ImmutableList<ValueColumn> columns;

  public Block(List<? extends ValueColumn> columns) {
    this.columns = ImmutableList.copyOf(columns);
  }

  public static Block of(ValueColumn... columns) {
    return new Block(ImmutableList.copyOf(columns));
  }

  public ValueColumn getByPosition(int position) {
    return columns.get(position);
  }

  public int getColumnCount() {
    return columns.size();
  }

  /**
   * @return row count of the first column, 0 for a block without columns
   */
  public int getRowCount() {
    return columns.isEmpty() ? 0 : columns.get(0).size();
  }

  public boolean isEmpty() {
    return getRowCount() == 0;
  }
}
