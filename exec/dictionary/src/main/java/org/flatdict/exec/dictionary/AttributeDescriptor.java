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

import java.util.Objects;

import org.flatdict.common.types.AttributeType;

import com.google.common.base.Preconditions;

/**
 * Configured attribute of a dictionary: its name, type, the textual null value
 * and whether its values are parent identifiers.
 */
public class AttributeDescriptor {

  private final String name;
  private final AttributeType type;
  private final String nullValue;
  private final boolean hierarchical;

  public AttributeDescriptor(String name, AttributeType type, String nullValue, boolean hierarchical) {
    this.name = Preconditions.checkNotNull(name, "name cannot be null");
    this.type = Preconditions.checkNotNull(type, "type cannot be null");
    this.nullValue = Preconditions.checkNotNull(nullValue, "null value cannot be null");
    this.hierarchical = hierarchical;
  }

  public AttributeDescriptor(String name, AttributeType type, String nullValue) {
    this(name, type, nullValue, false);
  }

  public String getName() {
    return name;
  }

  public AttributeType getType() {
    return type;
  }

  public String getNullValue() {
    return nullValue;
  }

  public boolean isHierarchical() {
    return hierarchical;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AttributeDescriptor that = (AttributeDescriptor) o;
    return hierarchical == that.hierarchical
        && name.equals(that.name)
        && type == that.type
        && nullValue.equals(that.nullValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, nullValue, hierarchical);
  }

  @Override
  public String toString() {
    return "AttributeDescriptor{" +
        "name='" + name + '\'' +
        ", type=" + type +
        ", nullValue='" + nullValue + '\'' +
        ", hierarchical=" + hierarchical +
        '}';
  }
}
