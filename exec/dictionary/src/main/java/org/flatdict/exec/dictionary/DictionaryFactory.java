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

import java.util.Locale;

import org.flatdict.common.config.DictConfig;
import org.flatdict.common.exceptions.UserException;
import org.flatdict.exec.dictionary.source.DictionarySource;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Builds dictionaries from their configuration block:
 * <pre>
 * layout = flat
 * structure { ... }
 * </pre>
 * Capacity limits come from the factory's {@link DictConfig}.
 */
public class DictionaryFactory {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DictionaryFactory.class);

  public static final String LAYOUT = "layout";
  public static final String STRUCTURE = "structure";
  public static final String FLAT_LAYOUT = "flat";

  private final FlatDictionaryOptions flatOptions;

  public DictionaryFactory(DictConfig config) {
    Preconditions.checkNotNull(config, "config cannot be null");
    this.flatOptions = FlatDictionaryOptions.fromConfig(config);
  }

  /**
   * @throws UserException UNSUPPORTED_OPERATION error for an unknown layout,
   *         VALIDATION error for a malformed block, or any load error
   */
  public Dictionary create(String name, Config dictionaryConfig, DictionarySource source) {
    final String layout;
    final Config structureConfig;
    try {
      layout = dictionaryConfig.getString(LAYOUT);
      structureConfig = dictionaryConfig.getConfig(STRUCTURE);
    } catch (ConfigException e) {
      throw UserException.validationError(e)
          .message("Invalid configuration of dictionary %s: %s", name, e.getMessage())
          .addDictionary(name)
          .build(logger);
    }

    if (!FLAT_LAYOUT.equals(layout.toLowerCase(Locale.ROOT))) {
      throw UserException.unsupportedError()
          .message("Dictionary layout '%s' is not supported", layout)
          .addContext("Supported layouts", FLAT_LAYOUT)
          .addDictionary(name)
          .build(logger);
    }

    final DictionaryStructure structure = DictionaryStructure.fromConfig(structureConfig);
    logger.debug("Creating {} dictionary {}.", layout, name);
    return new FlatDictionary(name, structure, source, flatOptions);
  }

  public FlatDictionaryOptions getFlatOptions() {
    return flatOptions;
  }
}
