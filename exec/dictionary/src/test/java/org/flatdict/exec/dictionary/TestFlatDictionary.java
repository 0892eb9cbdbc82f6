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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.flatdict.common.exceptions.ErrorType;
import org.flatdict.common.exceptions.UserException;
import org.flatdict.common.types.AttributeType;
import org.flatdict.exec.dictionary.source.MemoryDictionarySource;
import org.flatdict.test.DictTest;
import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.UnsignedLong;
import com.google.common.primitives.UnsignedLongs;

public class TestFlatDictionary extends DictTest {

  private static final FlatDictionaryOptions SMALL = new FlatDictionaryOptions(1000, 4);

  private static final DictionaryStructure REGIONS = new DictionaryStructure("region_id", ImmutableList.of(
      new AttributeDescriptor("parent", AttributeType.UINT32, "0", true),
      new AttributeDescriptor("name", AttributeType.STRING, ""),
      new AttributeDescriptor("population", AttributeType.UINT64, "0"),
      new AttributeDescriptor("area", AttributeType.FLOAT64, "-1.5"),
      new AttributeDescriptor("code", AttributeType.INT8, "-1")));

  private static MemoryDictionarySource.Builder regions() {
    return MemoryDictionarySource.builder()
        .addRow(0L, 0L, "World", 8_000_000_000L, 510.1, (byte) 1)
        .addRow(2L, 0L, "Europe", 750_000_000L, 10.2, (byte) 2)
        .addRow(5L, 2L, "France", 68_000_000L, 0.64, (byte) 33);
  }

  private static FlatDictionary load(MemoryDictionarySource.Builder rows) {
    return new FlatDictionary("regions", REGIONS, rows.build(), SMALL);
  }

  @Test
  public void testLoadedValues() {
    FlatDictionary dict = load(regions());

    assertEquals(2L, dict.getUInt32("parent", 5));
    assertEquals("France", dict.getString("name", 5).toString());
    assertEquals(68_000_000L, dict.getUInt64("population", 5));
    assertEquals(0.64, dict.getFloat64("area", 5), 0.0);
    assertEquals(33, dict.getInt8("code", 5));
  }

  @Test
  public void testMissingIdReturnsNullValue() {
    FlatDictionary dict = load(regions());

    assertEquals(0L, dict.getUInt32("parent", 7));
    assertEquals("", dict.getString("name", 7).toString());
    assertEquals(-1.5, dict.getFloat64("area", 7), 0.0);
    assertEquals(-1, dict.getInt8("code", 7));
  }

  @Test
  public void testOutOfRangeIdReturnsNullValue() {
    FlatDictionary dict = load(regions());

    assertEquals(-1, dict.getInt8("code", 1000));
    assertEquals(-1, dict.getInt8("code", 5_000_000_000L));
    assertEquals(-1, dict.getInt8("code", -1L));
    assertEquals("", dict.getString("name", 999_999).toString());
    assertEquals("", dict.getString("name", -1L).toString());
  }

  @Test
  public void testLastWriteWins() {
    FlatDictionary dict = load(regions()
        .addRow(5L, 2L, "République française", 68_100_000L, 0.65, (byte) 34));

    assertEquals("République française", dict.getString("name", 5).toString());
    assertEquals(68_100_000L, dict.getUInt64("population", 5));
    assertEquals(34, dict.getInt8("code", 5));
    assertEquals(4, dict.getElementCount());
  }

  @Test
  public void testStringsAcrossGrowth() {
    FlatDictionary dict = load(MemoryDictionarySource.builder()
        .addRow(0L, 0L, "zero", 0L, 0.0, (byte) 0)
        .addRow(5L, 0L, "five", 0L, 0.0, (byte) 0)
        .addRow(999L, 0L, "last", 0L, 0.0, (byte) 0));

    assertEquals("zero", dict.getString("name", 0).toString());
    assertEquals("five", dict.getString("name", 5).toString());
    assertEquals("last", dict.getString("name", 999).toString());
    assertEquals("", dict.getString("name", 3).toString());
    assertEquals("", dict.getString("name", 500).toString());
  }

  @Test
  public void testUnsignedValuesAreWidened() {
    DictionaryStructure structure = new DictionaryStructure("id", ImmutableList.of(
        new AttributeDescriptor("u8", AttributeType.UINT8, "255"),
        new AttributeDescriptor("u16", AttributeType.UINT16, "65535"),
        new AttributeDescriptor("u32", AttributeType.UINT32, "4294967295"),
        new AttributeDescriptor("u64", AttributeType.UINT64, "18446744073709551615")));
    FlatDictionary dict = new FlatDictionary("unsigned", structure, MemoryDictionarySource.builder()
        .addRow(1L, 200, 60000, 4_000_000_000L, UnsignedLong.valueOf("18446744073709551000"))
        .build(), SMALL);

    assertEquals(200, dict.getUInt8("u8", 1));
    assertEquals(60000, dict.getUInt16("u16", 1));
    assertEquals(4_000_000_000L, dict.getUInt32("u32", 1));
    assertEquals("18446744073709551000", UnsignedLongs.toString(dict.getUInt64("u64", 1)));

    assertEquals(255, dict.getUInt8("u8", 2));
    assertEquals(65535, dict.getUInt16("u16", 2));
    assertEquals(4294967295L, dict.getUInt32("u32", 2));
    assertEquals(-1L, dict.getUInt64("u64", 2));
  }

  @Test
  public void testSignedAndFloatKinds() {
    DictionaryStructure structure = new DictionaryStructure("id", ImmutableList.of(
        new AttributeDescriptor("i16", AttributeType.INT16, "-7"),
        new AttributeDescriptor("i32", AttributeType.INT32, "-8"),
        new AttributeDescriptor("i64", AttributeType.INT64, "-9"),
        new AttributeDescriptor("f32", AttributeType.FLOAT32, "0.5")));
    FlatDictionary dict = new FlatDictionary("signed", structure, MemoryDictionarySource.builder()
        .addRow(3L, -300, -70_000, Long.MIN_VALUE, 2.25f)
        .build(), SMALL);

    assertEquals(-300, dict.getInt16("i16", 3));
    assertEquals(-70_000, dict.getInt32("i32", 3));
    assertEquals(Long.MIN_VALUE, dict.getInt64("i64", 3));
    assertEquals(2.25f, dict.getFloat32("f32", 3), 0.0f);

    assertEquals(-7, dict.getInt16("i16", 4));
    assertEquals(-8, dict.getInt32("i32", 4));
    assertEquals(-9L, dict.getInt64("i64", 4));
    assertEquals(0.5f, dict.getFloat32("f32", 4), 0.0f);
  }

  @Test
  public void testTypeMismatch() {
    FlatDictionary dict = load(regions());
    try {
      dict.getUInt64("parent", 5);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.TYPE_MISMATCH, e.getErrorType());
      assertEquals("Type mismatch: attribute parent has type UInt32", e.getOriginalMessage());
      assertEquals("regions", e.getDictionaryName());
    }
  }

  @Test
  public void testUnknownAttribute() {
    FlatDictionary dict = load(regions());
    try {
      dict.getString("capital", 5);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.UNKNOWN_ATTRIBUTE, e.getErrorType());
      assertEquals("No such attribute 'capital'", e.getOriginalMessage());
    }
  }

  @Test
  public void testQueryErrorsLeaveDictionaryUsable() {
    FlatDictionary dict = load(regions());
    try {
      dict.getString("parent", 5);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.TYPE_MISMATCH, e.getErrorType());
    }
    assertEquals("France", dict.getString("name", 5).toString());
  }

  @Test
  public void testIndexGetters() {
    FlatDictionary dict = load(regions());
    int parent = dict.getAttributeIndex("parent");
    int name = dict.getAttributeIndex("name");
    int population = dict.getAttributeIndex("population");
    int area = dict.getAttributeIndex("area");
    int code = dict.getAttributeIndex("code");

    assertEquals(0, parent);
    assertEquals(4, code);
    assertEquals(2L, dict.getUInt32Unsafe(parent, 5));
    assertEquals("Europe", dict.getStringUnsafe(name, 2).toString());
    assertEquals(750_000_000L, dict.getUInt64Unsafe(population, 2));
    assertEquals(10.2, dict.getFloat64Unsafe(area, 2), 0.0);
    assertEquals(-1, dict.getInt8Unsafe(code, 1001));
  }

  @Test
  public void testTypePredicates() {
    FlatDictionary dict = load(regions());

    assertTrue(dict.isType(0, AttributeType.UINT32));
    assertFalse(dict.isType(0, AttributeType.INT32));
    assertTrue(dict.isType(1, AttributeType.STRING));
    assertEquals(AttributeType.FLOAT64, dict.getAttributeType(3));
  }

  @Test
  public void testHierarchy() {
    FlatDictionary dict = load(regions());

    assertTrue(dict.hasHierarchy());
    assertEquals(2L, dict.toParent(5));
    assertEquals(0L, dict.toParent(2));
    assertEquals(0L, dict.toParent(999_999));
  }

  @Test
  public void testSignedHierarchySignExtends() {
    DictionaryStructure structure = new DictionaryStructure("id", ImmutableList.of(
        new AttributeDescriptor("parent", AttributeType.INT8, "0", true)));
    FlatDictionary dict = new FlatDictionary("signed", structure, MemoryDictionarySource.builder()
        .addRow(1L, -1)
        .build(), SMALL);

    assertEquals(-1L, dict.toParent(1));
  }

  @Test
  public void testUnsignedHierarchyZeroExtends() {
    DictionaryStructure structure = new DictionaryStructure("id", ImmutableList.of(
        new AttributeDescriptor("parent", AttributeType.UINT8, "0", true)));
    FlatDictionary dict = new FlatDictionary("unsigned", structure, MemoryDictionarySource.builder()
        .addRow(1L, 255)
        .build(), SMALL);

    assertEquals(255L, dict.toParent(1));
  }

  @Test
  public void testNonIntegerHierarchyIsRejectedAtQueryTime() {
    DictionaryStructure structure = new DictionaryStructure("id", ImmutableList.of(
        new AttributeDescriptor("parent", AttributeType.FLOAT64, "0", true)));
    FlatDictionary dict = new FlatDictionary("floats", structure, MemoryDictionarySource.builder()
        .addRow(1L, 2.0)
        .build(), SMALL);

    assertTrue(dict.hasHierarchy());
    try {
      dict.toParent(1);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.TYPE_MISMATCH, e.getErrorType());
      assertEquals("Hierarchical attribute has non-integer type Float64", e.getOriginalMessage());
    }
  }

  @Test
  public void testToParentWithoutHierarchy() {
    DictionaryStructure structure = new DictionaryStructure("id", ImmutableList.of(
        new AttributeDescriptor("name", AttributeType.STRING, "")));
    FlatDictionary dict = new FlatDictionary("flat", structure, MemoryDictionarySource.builder().build(), SMALL);

    assertFalse(dict.hasHierarchy());
    try {
      dict.toParent(1);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.UNSUPPORTED_OPERATION, e.getErrorType());
    }
  }

  @Test
  public void testIdAtMaximumFailsLoad() {
    try {
      load(regions().addRow(1000L, 0L, "too far", 0L, 0.0, (byte) 0));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.ID_OUT_OF_BOUND, e.getErrorType());
      assertEquals("Identifier should be less than 1000", e.getOriginalMessage());
      assertEquals("regions", e.getDictionaryName());
    }
  }

  @Test
  public void testIdBelowMaximumLoads() {
    FlatDictionary dict = load(regions().addRow(999L, 5L, "edge", 1L, 0.0, (byte) 0));

    assertEquals(5L, dict.getUInt32("parent", 999));
    assertEquals("edge", dict.getString("name", 999).toString());
  }

  @Test
  public void testUnsignedIdAboveSignedRangeFailsLoad() {
    try {
      load(regions().addRow(UnsignedLong.valueOf("9223372036854775808"), 0L, "huge", 0L, 0.0, (byte) 0));
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.ID_OUT_OF_BOUND, e.getErrorType());
    }
  }

  @Test
  public void testInvalidNullValue() {
    DictionaryStructure structure = new DictionaryStructure("id", ImmutableList.of(
        new AttributeDescriptor("level", AttributeType.UINT8, "256")));
    try {
      new FlatDictionary("levels", structure, MemoryDictionarySource.builder().build(), SMALL);
      fail();
    } catch (UserException e) {
      assertEquals(ErrorType.VALUE_PARSE, e.getErrorType());
      assertThat(e.getOriginalMessage(), containsString("attribute level as UInt8"));
      assertEquals("levels", e.getDictionaryName());
    }
  }

  @Test
  public void testMetadata() {
    MemoryDictionarySource source = regions().build();
    long before = System.currentTimeMillis();
    FlatDictionary dict = new FlatDictionary("regions", REGIONS, source, SMALL);

    assertEquals("regions", dict.getName());
    assertEquals("Flat", dict.getTypeName());
    assertTrue(dict.isComplete());
    assertEquals(REGIONS, dict.getStructure());
    assertEquals(source, dict.getSource());
    assertEquals(SMALL, dict.getOptions());
    assertEquals(3, dict.getElementCount());
    assertEquals(5, dict.getAttributeCount());
    assertThat(dict.getCreationTime(), greaterThanOrEqualTo(before));
    // parent, population, area and code are fully allocated
    assertThat(dict.getBytesAllocated(), greaterThanOrEqualTo(1000L * (4 + 8 + 8 + 1)));
  }

  @Test
  public void testEmptySource() {
    FlatDictionary dict = load(MemoryDictionarySource.builder());

    assertEquals(0, dict.getElementCount());
    assertEquals(0L, dict.getUInt32("parent", 0));
  }

  @Test
  public void testDefaultOptions() {
    FlatDictionary dict = new FlatDictionary("regions", REGIONS, regions().build());

    assertEquals(FlatDictionaryOptions.DEFAULT_MAX_ARRAY_SIZE, dict.getOptions().getMaxArraySize());
    assertEquals("France", dict.getString("name", 5).toString());
    assertEquals(-1, dict.getInt8("code", 499_999));
  }
}
