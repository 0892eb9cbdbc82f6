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

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * {@link ValueColumn} backed by an object array.
 */
public class ArrayValueColumn implements ValueColumn {

  private final Object[] values;

  public ArrayValueColumn(Object... values) {
    this.values = Preconditions.checkNotNull(values);
  }

  @Override
  public int size() {
    return values.length;
  }

  @Override
  public Object getObject(int index) {
    return values[index];
  }

  @Override
  public String toString() {
    return Arrays.toString(values);
  }
}
