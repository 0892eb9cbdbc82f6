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
package org.flatdict.common.config;

public interface CommonConstants {

  /** Default (base) configuration file name.  (Classpath resource pathname.) */
  String CONFIG_DEFAULT_RESOURCE_PATHNAME = "flatdict-default.conf";

  /** Module configuration files name.  (Classpath resource pathname.) */
  String MODULE_CONFIG_RESOURCE_PATHNAME = "flatdict-module.conf";

  /** Override configuration file name.  (Classpath resource pathname.) */
  String CONFIG_OVERRIDE_RESOURCE_PATHNAME = "flatdict-override.conf";

  String FLAT_MAX_ARRAY_SIZE = "flatdict.dictionary.flat.max_array_size";
  String FLAT_INITIAL_ARRAY_SIZE = "flatdict.dictionary.flat.initial_array_size";
  String MEMORY_SOURCE_BLOCK_SIZE = "flatdict.dictionary.source.memory.block_size";
}
