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

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;

import org.flatdict.common.AutoCloseables;
import org.flatdict.common.exceptions.UserException;
import org.flatdict.exec.dictionary.source.Block;
import org.flatdict.exec.dictionary.source.BlockInputStream;
import org.flatdict.exec.dictionary.source.DictionarySource;
import org.flatdict.exec.dictionary.source.ValueColumn;
import org.flatdict.exec.memory.OutOfMemoryException;

import com.google.common.base.Stopwatch;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;

/**
 * Drains a {@link DictionarySource} into the columns of an {@link AttributeTable}.
 * Runs once per dictionary, on the constructing thread. The stream is closed and
 * the source reset whether loading succeeds or not.
 */
class DictionaryLoader {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DictionaryLoader.class);

  private final String dictionaryName;
  private final AttributeTable table;
  private final int maxArraySize;

  private long rowCount;
  private int blockCount;

  DictionaryLoader(String dictionaryName, AttributeTable table, FlatDictionaryOptions options) {
    this.dictionaryName = dictionaryName;
    this.table = table;
    this.maxArraySize = options.getMaxArraySize();
  }

  /**
   * Reads every block of the source.
   *
   * @return number of rows loaded, duplicates included
   * @throws UserException on any failure; the table must then be discarded
   */
  long load(DictionarySource source) {
    final Stopwatch watch = Stopwatch.createStarted();
    BlockInputStream stream = null;
    try {
      stream = source.loadAll();
      Block block;
      while ((block = stream.read()) != null && !block.isEmpty()) {
        loadBlock(block);
      }
    } catch (RuntimeException e) {
      UserException failure = toUserException(e);
      AutoCloseables.close(failure, stream, source::reset);
      throw failure;
    }

    try {
      AutoCloseables.close(stream, source::reset);
    } catch (Exception e) {
      throw UserException.dataReadError(e)
          .message("Failure while releasing the source of dictionary %s", dictionaryName)
          .addDictionary(dictionaryName)
          .build(logger);
    }

    logger.info("Loaded {} rows in {} blocks into dictionary {} in {} ms.",
        rowCount, blockCount, dictionaryName, watch.elapsed(TimeUnit.MILLISECONDS));
    return rowCount;
  }

  private UserException toUserException(RuntimeException e) {
    if (e instanceof OutOfMemoryException) {
      return UserException.memoryError(e)
          .addContext("Rows loaded", rowCount)
          .addDictionary(dictionaryName)
          .build(logger);
    }
    return UserException.dataReadError(e)
        .message("Failure while loading dictionary %s", dictionaryName)
        .addContext("Rows loaded", rowCount)
        .addDictionary(dictionaryName)
        .build(logger);
  }

  private void loadBlock(Block block) {
    final int rows = block.getRowCount();
    final int attributes = table.size();
    if (block.getColumnCount() != attributes + 1) {
      throw UserException.dataReadError()
          .message("Block has %d columns, expected identifier column and %d attribute columns",
              block.getColumnCount(), attributes)
          .addContext("Block", blockCount)
          .build(logger);
    }
    for (int position = 1; position <= attributes; position++) {
      if (block.getByPosition(position).size() != rows) {
        throw UserException.dataReadError()
            .message("Block column %d has %d rows, identifier column has %d",
                position, block.getByPosition(position).size(), rows)
            .addContext("Block", blockCount)
            .build(logger);
      }
    }

    final ValueColumn idColumn = block.getByPosition(0);
    final long[] ids = new long[rows];
    for (int row = 0; row < rows; row++) {
      ids[row] = toId(idColumn.getObject(row));
    }

    for (int attribute = 0; attribute < attributes; attribute++) {
      final AttributeColumn column = table.getColumn(attribute);
      final ValueColumn values = block.getByPosition(attribute + 1);
      for (int row = 0; row < rows; row++) {
        setAttributeValue(column, ids[row], values.getObject(row));
      }
    }

    rowCount += rows;
    blockCount++;
    logger.debug("Loaded block #{} of {} rows into dictionary {}.", blockCount, rows, dictionaryName);
  }

  /**
   * Converts an identifier of an integral class to its unsigned bits. Negative
   * values and big integers beyond 64 bits abort the load as out of range.
   *
   * @throws UserException TYPE_MISMATCH error for non integral identifiers
   */
  private long toId(Object value) {
    if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte
        || value instanceof UnsignedLong || value instanceof UnsignedInteger) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger) {
      final BigInteger id = (BigInteger) value;
      if (id.signum() < 0 || id.bitLength() > Long.SIZE) {
        throw idOutOfBound(id.toString()).build(logger);
      }
      return UnsignedLong.valueOf(id).longValue();
    }
    throw UserException.typeMismatchError()
        .message("Identifier of class %s is not an unsigned integer",
            value == null ? "null" : value.getClass().getName())
        .addContext("Identifier", String.valueOf(value))
        .build(logger);
  }

  private UserException.Builder idOutOfBound(String id) {
    return UserException.idOutOfBoundError()
        .message("Identifier should be less than %d", maxArraySize)
        .addContext("Identifier", id);
  }

  /**
   * Writes one value. Identifiers at or above the maximum array size, including
   * unsigned values that do not fit a signed long, abort the load.
   *
   * @throws UserException ID_OUT_OF_BOUND error if the identifier is out of range
   */
  void setAttributeValue(AttributeColumn column, long id, Object value) {
    if (id < 0 || id >= maxArraySize) {
      throw idOutOfBound(Long.toUnsignedString(id))
          .addContext("Attribute", column.getName())
          .build(logger);
    }
    column.set((int) id, value);
  }
}
