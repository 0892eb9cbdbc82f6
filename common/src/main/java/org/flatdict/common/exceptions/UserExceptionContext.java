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

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Holds context information about a UserException. We can add structured
 * context information that will be added to the error message displayed to
 * the caller.
 */
public class UserExceptionContext {

  private final String errorId;
  private final List<String> contextList;

  private String dictionaryName;

  UserExceptionContext() {
    errorId = UUID.randomUUID().toString();
    contextList = new ArrayList<>();
  }

  /**
   * adds a context line to the bottom of the context list
   * @param context context line
   */
  public UserExceptionContext add(String context) {
    contextList.add(context);
    return this;
  }

  /**
   * sets the name of the dictionary the error was raised by. The first name set wins.
   */
  public UserExceptionContext setDictionaryName(String name) {
    if (dictionaryName == null) {
      dictionaryName = name;
    }
    return this;
  }

  /**
   * adds a long to the bottom of the context list
   * @param context context prefix string
   * @param value long value
   */
  public UserExceptionContext add(String context, long value) {
    add(context + ": " + value);
    return this;
  }

  public UserExceptionContext add(String context, String value) {
    add(context + " " + value);
    return this;
  }

  String getErrorId() {
    return errorId;
  }

  String getDictionaryName() {
    return dictionaryName;
  }

  /**
   * generate a context message
   * @param includeErrorId whether the error id and dictionary name are appended
   * @return string containing all context information concatenated
   */
  String generateContextMessage(boolean includeErrorId) {
    StringBuilder sb = new StringBuilder();

    for (String context : contextList) {
      sb.append(context).append("\n");
    }

    if (includeErrorId) {
      sb.append("\n[Error Id: ").append(errorId);
      if (dictionaryName != null) {
        sb.append(" in dictionary ").append(dictionaryName);
      }
      sb.append("]");
    }

    return sb.toString();
  }
}
