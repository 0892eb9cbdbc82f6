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

import java.util.ArrayList;
import java.util.List;

import org.flatdict.common.config.CommonConstants;
import org.flatdict.common.config.DictConfig;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Source over rows held in memory. Each row is {@code [id, value1, ..., valueN]}.
 * Rows are emitted in blocks of at most {@code blockSize} rows. Blocks handed out
 * by an open stream are retained until {@link #reset()}.
 */
public class MemoryDictionarySource implements DictionarySource {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(MemoryDictionarySource.class);

  public static final int DEFAULT_BLOCK_SIZE = 8192;

  private final ImmutableList<Object[]> rows;
  private final int blockSize;
  private final List<Block> emitted = new ArrayList<>();

  private MemoryDictionarySource(ImmutableList<Object[]> rows, int blockSize) {
    this.rows = rows;
    this.blockSize = blockSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public BlockInputStream loadAll() {
    logger.debug("Streaming {} rows in blocks of {}.", rows.size(), blockSize);
    return new RowBlockStream();
  }

  @Override
  public void reset() {
    emitted.clear();
  }

  public int getRowCount() {
    return rows.size();
  }

  public int getBlockSize() {
    return blockSize;
  }

  /**
   * @return number of blocks emitted since the last {@link #reset()}
   */
  public int getRetainedBlockCount() {
    return emitted.size();
  }

  private Block toBlock(int from, int to) {
    int width = rows.get(from).length;
    List<ValueColumn> columns = new ArrayList<>(width);
    for (int column = 0; column < width; column++) {
      Object[] values = new Object[to - from];
      for (int row = from; row < to; row++) {
        values[row - from] = rows.get(row)[column];
      }
      columns.add(new ArrayValueColumn(values));
    }
    return new Block(columns);
  }

  private class RowBlockStream implements BlockInputStream {
    private int position;
    private boolean closed;

    @Override
    public Block read() {
      Preconditions.checkState(!closed, "stream is closed");
      if (position >= rows.size()) {
        return null;
      }
      int end = Math.min(rows.size(), position + blockSize);
      Block block = toBlock(position, end);
      position = end;
      emitted.add(block);
      return block;
    }

    @Override
    public void close() {
      closed = true;
    }
  }

  public static class Builder {
    private final ImmutableList.Builder<Object[]> rows = ImmutableList.builder();
    private int blockSize = DEFAULT_BLOCK_SIZE;
    private int width = -1;

    public Builder blockSize(int blockSize) {
      Preconditions.checkArgument(blockSize > 0, "block size must be positive");
      this.blockSize = blockSize;
      return this;
    }

    public Builder blockSize(DictConfig config) {
      return blockSize(config.getPositiveInt(CommonConstants.MEMORY_SOURCE_BLOCK_SIZE));
    }

    /**
     * Adds a row. The first value is the identifier. All rows must have the same
     * number of values.
     */
    public Builder addRow(Object... values) {
      Preconditions.checkArgument(values.length > 0, "a row needs at least an identifier");
      if (width == -1) {
        width = values.length;
      }
      Preconditions.checkArgument(values.length == width,
          "row has %s values, expected %s", values.length, width);
      rows.add(values.clone());
      return this;
    }

    public MemoryDictionarySource build() {
      return new MemoryDictionarySource(rows.build(), blockSize);
    }
  }
}
