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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Append-only byte storage for string values. Bytes are copied into chunks that
 * are never moved, resized or released while the arena is reachable, so every
 * {@link StringRef} handed out stays valid for the arena's whole lifetime.
 * <p>
 * Chunk sizes double from the initial size up to the linear growth threshold and
 * stay at the threshold afterwards. A value larger than the next chunk gets a
 * chunk of its own size.
 * <p>
 * Not thread safe. Insertions happen while a dictionary is loaded, by one thread.
 */
public class StringArena {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(StringArena.class);

  public static final int INITIAL_CHUNK_SIZE = 4096;
  public static final int LINEAR_GROWTH_THRESHOLD = 128 * 1024 * 1024;

  private final int linearGrowthThreshold;
  private final List<byte[]> chunks = new ArrayList<>();

  private byte[] current;
  private int position;
  private int nextChunkSize;
  private long usedBytes;
  private long allocatedBytes;

  public StringArena() {
    this(INITIAL_CHUNK_SIZE, LINEAR_GROWTH_THRESHOLD);
  }

  public StringArena(int initialChunkSize, int linearGrowthThreshold) {
    Preconditions.checkArgument(initialChunkSize > 0, "initial chunk size must be positive");
    Preconditions.checkArgument(linearGrowthThreshold >= initialChunkSize,
        "linear growth threshold must not be below the initial chunk size");
    this.linearGrowthThreshold = linearGrowthThreshold;
    this.nextChunkSize = initialChunkSize;
  }

  public StringRef insert(byte[] bytes) {
    return insert(bytes, 0, bytes.length);
  }

  /**
   * Copies {@code length} bytes starting at {@code offset} into the arena.
   *
   * @return reference to the copy
   * @throws OutOfMemoryException if a new chunk cannot be allocated
   */
  public StringRef insert(byte[] bytes, int offset, int length) {
    Preconditions.checkPositionIndexes(offset, offset + length, bytes.length);
    if (length == 0) {
      return StringRef.EMPTY;
    }
    if (current == null || current.length - position < length) {
      addChunk(length);
    }
    System.arraycopy(bytes, offset, current, position, length);
    final StringRef ref = new StringRef(current, position, length);
    position += length;
    usedBytes += length;
    return ref;
  }

  private void addChunk(int minSize) {
    final int size = Math.max(nextChunkSize, minSize);
    final byte[] chunk;
    try {
      chunk = new byte[size];
    } catch (OutOfMemoryError e) {
      throw new OutOfMemoryException(
          String.format("Failure allocating arena chunk of %d bytes, %d bytes already allocated.", size, allocatedBytes), e);
    }
    chunks.add(chunk);
    current = chunk;
    position = 0;
    allocatedBytes += size;
    if (nextChunkSize < linearGrowthThreshold) {
      nextChunkSize = (int) Math.min(2L * nextChunkSize, linearGrowthThreshold);
    }
    logger.trace("Allocated arena chunk #{} of {} bytes.", chunks.size(), size);
  }

  /**
   * @return number of bytes handed out by {@link #insert}
   */
  public long getUsedBytes() {
    return usedBytes;
  }

  /**
   * @return total capacity of all chunks
   */
  public long getAllocatedBytes() {
    return allocatedBytes;
  }

  public int getChunkCount() {
    return chunks.size();
  }
}
