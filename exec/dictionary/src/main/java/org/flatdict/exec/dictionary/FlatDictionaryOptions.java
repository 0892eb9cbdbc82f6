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

import org.flatdict.common.config.CommonConstants;
import org.flatdict.common.config.DictConfig;
import org.flatdict.common.exceptions.UserException;

import com.google.common.base.MoreObjects;

/**
 * Capacity limits of a {@link FlatDictionary}.
 * <ul>
 * <li>{@code maxArraySize}: identifiers must be below this value; every numeric
 *     attribute is allocated with exactly this many slots.</li>
 * <li>{@code initialArraySize}: initial slot count of string attributes, never
 *     above {@code maxArraySize}.</li>
 * </ul>
 */
public final class FlatDictionaryOptions {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(FlatDictionaryOptions.class);

  public static final int DEFAULT_MAX_ARRAY_SIZE = 500_000;
  public static final int DEFAULT_INITIAL_ARRAY_SIZE = 128;

  public static final FlatDictionaryOptions DEFAULT =
      new FlatDictionaryOptions(DEFAULT_MAX_ARRAY_SIZE, DEFAULT_INITIAL_ARRAY_SIZE);

  private final int maxArraySize;
  private final int initialArraySize;

  public FlatDictionaryOptions(int maxArraySize, int initialArraySize) {
    if (maxArraySize <= 0 || initialArraySize <= 0) {
      throw UserException.validationError()
          .message("Array sizes must be positive, got max_array_size = %d and initial_array_size = %d.",
              maxArraySize, initialArraySize)
          .build(logger);
    }
    this.maxArraySize = maxArraySize;
    this.initialArraySize = Math.min(initialArraySize, maxArraySize);
  }

  public static FlatDictionaryOptions fromConfig(DictConfig config) {
    return new FlatDictionaryOptions(
        config.getPositiveInt(CommonConstants.FLAT_MAX_ARRAY_SIZE),
        config.getPositiveInt(CommonConstants.FLAT_INITIAL_ARRAY_SIZE));
  }

  public int getMaxArraySize() {
    return maxArraySize;
  }

  public int getInitialArraySize() {
    return initialArraySize;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("maxArraySize", maxArraySize)
        .add("initialArraySize", initialArraySize)
        .toString();
  }
}
