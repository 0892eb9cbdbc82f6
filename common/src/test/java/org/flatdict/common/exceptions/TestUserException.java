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

import org.flatdict.test.DictTest;
import org.junit.Assert;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Test various use cases around creating user exceptions
 */
public class TestUserException extends DictTest {
  private static final Logger logger = LoggerFactory.getLogger(TestUserException.class);

  private Exception wrap(UserException uex, int numWraps) {
    Exception ex = uex;
    for (int i = 0; i < numWraps; i++) {
      ex = new Exception("wrap #" + (i + 1), ex);
    }

    return ex;
  }

  @Test
  public void testBuildUserExceptionWithMessage() {
    String message = "Test message";

    UserException uex = UserException.dataReadError().message(message).build(logger);

    Assert.assertEquals(ErrorType.DATA_READ, uex.getErrorType());
    Assert.assertEquals(message, uex.getOriginalMessage());
  }

  @Test
  public void testBuildUserExceptionWithCause() {
    String message = "Test message";

    UserException uex = UserException.valueParseError(new NumberFormatException(message)).build(logger);

    // cause message should be used
    Assert.assertEquals(ErrorType.VALUE_PARSE, uex.getErrorType());
    Assert.assertEquals(message, uex.getOriginalMessage());
  }

  @Test
  public void testBuildUserExceptionWithCauseAndMessage() {
    String messageA = "Test message A";
    String messageB = "Test message B";

    UserException uex = UserException.resourceError(new RuntimeException(messageA)).message(messageB).build(logger);

    // passed message should override the cause message
    Assert.assertEquals(ErrorType.RESOURCE, uex.getErrorType());
    Assert.assertFalse(uex.getMessage().contains(messageA)); // messageA should not be part of the context
    Assert.assertEquals(messageB, uex.getOriginalMessage());
  }

  @Test
  public void testBuildUserExceptionWithUserExceptionCauseAndMessage() {
    String messageA = "Test message A";
    String messageB = "Test message B";

    UserException original = UserException.unknownAttributeError().message(messageA).build(logger);
    UserException uex = UserException.dataReadError(wrap(original, 5)).message(messageB).build(logger);

    //builder should return the unwrapped original user exception and not build a new one
    Assert.assertSame(original, uex);
    Assert.assertEquals(ErrorType.UNKNOWN_ATTRIBUTE, uex.getErrorType());
    Assert.assertEquals(messageA, uex.getOriginalMessage());
  }

  @Test
  public void testBuildUserExceptionWithFormattedMessage() {
    String format = "This is test #%d";

    UserException uex = UserException.idOutOfBoundError().message(format, 5).build(logger);

    Assert.assertEquals(ErrorType.ID_OUT_OF_BOUND, uex.getErrorType());
    Assert.assertEquals(String.format(format, 5), uex.getOriginalMessage());
  }

  @Test
  public void testMessageWithoutArgumentsIsNotFormatted() {
    UserException uex = UserException.typeMismatchError().message("100% wrong").build(logger);

    Assert.assertEquals("100% wrong", uex.getOriginalMessage());
  }

  // make sure context added to a wrapped user exception ends up in the original one
  @Test
  public void testContextIsAddedToWrappedUserException() {
    UserException original = UserException.validationError().message("bad structure").build(logger);

    UserException.dataReadError(wrap(original, 3))
        .addContext("Attribute", "region")
        .addContext("Row", 7)
        .build(logger);

    String message = original.getMessage();
    Assert.assertTrue(message.startsWith("VALIDATION ERROR: bad structure"));
    Assert.assertTrue(message.contains("Attribute region\nRow: 7\n"));
    Assert.assertTrue(message.contains(original.getErrorId()));
  }

  @Test
  public void testDictionaryNameIsKeptOnce() {
    UserException uex = UserException.unsupportedError()
        .message("no hierarchy")
        .addDictionary("regions")
        .addDictionary("other")
        .build(logger);

    Assert.assertEquals("regions", uex.getDictionaryName());
    Assert.assertTrue(uex.getMessage().contains("in dictionary regions"));
  }

  @Test
  public void testVerboseMessageContainsCauses() {
    UserException uex = UserException.memoryError(new OutOfMemoryError("heap")).build(logger);

    Assert.assertEquals(ErrorType.RESOURCE, uex.getErrorType());
    Assert.assertEquals(UserException.MEMORY_ERROR_MSG, uex.getOriginalMessage());
    Assert.assertTrue(uex.getVerboseMessage().contains("(java.lang.OutOfMemoryError) heap"));
  }

  @Test
  public void testBuildWithoutLogger() {
    UserException uex = UserException.unknownAttributeError().message("No such attribute '%s'", "zone").build();

    Assert.assertEquals(ErrorType.UNKNOWN_ATTRIBUTE, uex.getErrorType());
    Assert.assertEquals("No such attribute 'zone'", uex.getOriginalMessage());
  }

  @Test
  public void testBuildWithoutLoggerReturnsWrappedUserException() {
    UserException original = UserException.typeMismatchError().message("wrong type").build();
    UserException uex = UserException.dataReadError(wrap(original, 2)).addContext("Attribute", "region").build();

    Assert.assertSame(original, uex);
    Assert.assertTrue(uex.getMessage().contains("Attribute region\n"));
  }
}
