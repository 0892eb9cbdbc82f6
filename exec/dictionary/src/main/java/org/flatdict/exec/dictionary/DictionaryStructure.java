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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.flatdict.common.exceptions.UserException;
import org.flatdict.common.types.AttributeType;

import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Schema of a dictionary: the name of the identifier column and the ordered list
 * of attributes. Attribute position in the list is the attribute index used by
 * the index based getters.
 */
public class DictionaryStructure {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DictionaryStructure.class);

  public static final String ID_NAME = "id.name";
  public static final String ATTRIBUTES = "attributes";
  public static final String ATTRIBUTE_NAME = "name";
  public static final String ATTRIBUTE_TYPE = "type";
  public static final String ATTRIBUTE_NULL_VALUE = "null_value";
  public static final String ATTRIBUTE_HIERARCHICAL = "hierarchical";

  private final String idName;
  private final ImmutableList<AttributeDescriptor> attributes;
  private final int hierarchicalIndex;

  public DictionaryStructure(String idName, List<AttributeDescriptor> attributes) {
    if (idName == null || idName.isEmpty()) {
      throw UserException.validationError()
          .message("Dictionary structure must name its identifier column.")
          .build(logger);
    }
    if (attributes == null || attributes.isEmpty()) {
      throw UserException.validationError()
          .message("Dictionary structure must declare at least one attribute.")
          .build(logger);
    }
    Set<String> names = new HashSet<>();
    int hierarchical = -1;
    for (int i = 0; i < attributes.size(); i++) {
      AttributeDescriptor attribute = attributes.get(i);
      if (!names.add(attribute.getName())) {
        throw UserException.validationError()
            .message("Duplicate attribute '%s'", attribute.getName())
            .build(logger);
      }
      if (attribute.isHierarchical()) {
        if (hierarchical != -1) {
          throw UserException.validationError()
              .message("Only one hierarchical attribute is allowed, found '%s' and '%s'",
                  attributes.get(hierarchical).getName(), attribute.getName())
              .build(logger);
        }
        hierarchical = i;
      }
    }
    this.idName = idName;
    this.attributes = ImmutableList.copyOf(attributes);
    this.hierarchicalIndex = hierarchical;
  }

  /**
   * Reads a structure from its configuration block:
   * <pre>
   * structure {
   *   id.name = region_id
   *   attributes = [
   *     { name = parent, type = UInt32, null_value = "0", hierarchical = true }
   *     { name = name, type = String, null_value = "" }
   *   ]
   * }
   * </pre>
   * The argument is the content of the {@code structure} block.
   *
   * @throws UserException VALIDATION error if the block is malformed
   */
  public static DictionaryStructure fromConfig(Config config) {
    try {
      String idName = config.getString(ID_NAME);
      ImmutableList.Builder<AttributeDescriptor> attributes = ImmutableList.builder();
      for (Config attribute : config.getConfigList(ATTRIBUTES)) {
        boolean hierarchical = attribute.hasPath(ATTRIBUTE_HIERARCHICAL)
            && attribute.getBoolean(ATTRIBUTE_HIERARCHICAL);
        attributes.add(new AttributeDescriptor(
            attribute.getString(ATTRIBUTE_NAME),
            AttributeType.fromName(attribute.getString(ATTRIBUTE_TYPE)),
            attribute.getString(ATTRIBUTE_NULL_VALUE),
            hierarchical));
      }
      return new DictionaryStructure(idName, attributes.build());
    } catch (ConfigException e) {
      throw UserException.validationError(e)
          .message("Invalid dictionary structure: %s", e.getMessage())
          .build(logger);
    }
  }

  public String getIdName() {
    return idName;
  }

  public ImmutableList<AttributeDescriptor> getAttributes() {
    return attributes;
  }

  public int getAttributeCount() {
    return attributes.size();
  }

  public AttributeDescriptor getAttribute(int index) {
    return attributes.get(index);
  }

  public boolean hasHierarchy() {
    return hierarchicalIndex != -1;
  }

  /**
   * @return index of the hierarchical attribute, -1 if there is none
   */
  public int getHierarchicalIndex() {
    return hierarchicalIndex;
  }

  @Override
  public String toString() {
    return "DictionaryStructure{idName='" + idName + "', attributes=" + attributes + '}';
  }
}
