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
package org.flatdict.common.exceptions;

/**
 * Category of a {@link UserException}.
 */
public enum ErrorType {
  /** attribute name is not part of the dictionary structure */
  UNKNOWN_ATTRIBUTE,
  /** requested type differs from the stored attribute type */
  TYPE_MISMATCH,
  /** identifier is outside of the dictionary capacity while loading */
  ID_OUT_OF_BOUND,
  /** configured text could not be parsed into the declared type */
  VALUE_PARSE,
  /** memory could not be allocated */
  RESOURCE,
  /** dictionary structure or configuration is invalid */
  VALIDATION,
  /** source produced malformed data or failed */
  DATA_READ,
  /** operation not supported by this dictionary */
  UNSUPPORTED_OPERATION
}
