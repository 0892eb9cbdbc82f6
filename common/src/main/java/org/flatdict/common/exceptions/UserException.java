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

import org.slf4j.Logger;

/**
 * Base class for all user exceptions. The goal is to separate out common error conditions where we can give callers
 * useful feedback.
 * <p>Configuration and programming mistakes (unknown attributes, type mismatches, identifiers beyond the dictionary
 * capacity, unparsable null values) are all reported through this class, tagged with an {@link ErrorType}. None of
 * them is transient, so none is retried.
 * <p>Errors raised while building or loading a dictionary are logged when built. Errors raised by lookups are built
 * with {@link Builder#build()} and are not logged.
 *
 * @see ErrorType
 */
public class UserException extends DictionaryRuntimeException {
  private static final long serialVersionUID = -6720929331624621840L;

  public static final String MEMORY_ERROR_MSG = "Not enough memory to allocate the dictionary.";

  /**
   * Creates a RESOURCE error with a prebuilt message for out of memory exceptions
   *
   * @param cause exception that will be wrapped inside a memory error
   * @return resource error builder
   */
  public static Builder memoryError(final Throwable cause) {
    return UserException.resourceError(cause)
      .message(MEMORY_ERROR_MSG);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#UNKNOWN_ATTRIBUTE
   * @return user exception builder
   */
  public static Builder unknownAttributeError() {
    return new Builder(ErrorType.UNKNOWN_ATTRIBUTE, null);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#TYPE_MISMATCH
   * @return user exception builder
   */
  public static Builder typeMismatchError() {
    return new Builder(ErrorType.TYPE_MISMATCH, null);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#ID_OUT_OF_BOUND
   * @return user exception builder
   */
  public static Builder idOutOfBoundError() {
    return new Builder(ErrorType.ID_OUT_OF_BOUND, null);
  }

  /**
   * Wraps the passed exception inside a value parse error.
   * <p>The cause message will be used unless {@link Builder#message(String, Object...)} is called.
   *
   * @see ErrorType#VALUE_PARSE
   *
   * @param cause exception we want the user exception to wrap. If cause is, or wrap, a user exception it will be
   *              returned by the builder instead of creating a new user exception
   * @return user exception builder
   */
  public static Builder valueParseError(final Throwable cause) {
    return new Builder(ErrorType.VALUE_PARSE, cause);
  }

  /**
   * Wraps the passed exception inside a resource error.
   *
   * @see ErrorType#RESOURCE
   * @return user exception builder
   */
  public static Builder resourceError(final Throwable cause) {
    return new Builder(ErrorType.RESOURCE, cause);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#VALIDATION
   * @return user exception builder
   */
  public static Builder validationError() {
    return validationError(null);
  }

  /**
   * wraps the passed exception inside a validation error.
   * <p>the cause message will be used unless {@link Builder#message(String, Object...)} is called.
   *
   * @see ErrorType#VALIDATION
   * @return user exception builder
   */
  public static Builder validationError(final Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#DATA_READ
   * @return user exception builder
   */
  public static Builder dataReadError() {
    return dataReadError(null);
  }

  /**
   * Wraps the passed exception inside a data read error.
   * <p>The cause message will be used unless {@link Builder#message(String, Object...)} is called.
   * <p>If the wrapped exception is, or wraps, a user exception it will be returned by {@link Builder#build(Logger)}
   * instead of creating a new exception. Any added context will be added to the user exception as well.
   *
   * @see ErrorType#DATA_READ
   * @return user exception builder
   */
  public static Builder dataReadError(final Throwable cause) {
    return new Builder(ErrorType.DATA_READ, cause);
  }

  /**
   * Creates a new user exception builder.
   *
   * @see ErrorType#UNSUPPORTED_OPERATION
   * @return user exception builder
   */
  public static Builder unsupportedError() {
    return new Builder(ErrorType.UNSUPPORTED_OPERATION, null);
  }

  /**
   * Builder class for UserException. You can wrap an existing exception, in this case it will first check if
   * this exception is, or wraps, a UserException. If it does then the builder will use the user exception as it is
   * (it will ignore the message passed to the constructor) and will add any additional context information to the
   * exception's context
   */
  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    /**
     * Wraps an existing exception inside a user exception.
     *
     * @param errorType user exception type that should be created if the passed exception isn't,
     *                  or doesn't wrap a user exception
     * @param cause exception to wrap inside a user exception. Can be null
     */
    private Builder(final ErrorType errorType, final Throwable cause) {
      this.cause = cause;

      uex = ErrorHelper.findWrappedUserException(cause);
      if (uex != null) {
        this.errorType = null;
        this.context = uex.context;
      } else {
        // we will create a new user exception
        this.errorType = errorType;
        this.context = new UserExceptionContext();
        this.message = cause != null ? cause.getMessage() : null;
      }
    }

    /**
     * sets or replaces the error message.
     * <p>This will be ignored if this builder is wrapping a user exception
     *
     * @see String#format(String, Object...)
     *
     * @param format format string
     * @param args Arguments referenced by the format specifiers in the format string
     * @return this builder
     */
    public Builder message(final String format, final Object... args) {
      // we can't replace the message of a user exception
      if (uex == null && format != null) {
        if (args.length == 0) {
          message = format;
        } else {
          message = String.format(format, args);
        }
      }
      return this;
    }

    /**
     * add the dictionary name to the context.
     * <p>if the context already has a dictionary name, the new name will be ignored
     */
    public Builder addDictionary(final String name) {
      context.setDictionaryName(name);
      return this;
    }

    /**
     * add a string line to the bottom of the context
     * @param value string line
     * @return this builder
     */
    public Builder addContext(final String value) {
      context.add(value);
      return this;
    }

    /**
     * add a string value to the bottom of the context
     *
     * @param name context name
     * @param value context value
     * @return this builder
     */
    public Builder addContext(final String name, final String value) {
      context.add(name, value);
      return this;
    }

    /**
     * add a long value to the bottom of the context
     *
     * @param name context name
     * @param value context value
     * @return this builder
     */
    public Builder addContext(final String name, final long value) {
      context.add(name, value);
      return this;
    }

    /**
     * builds a user exception or returns the wrapped one. A new exception is logged at INFO to the given
     * {@link Logger}.
     *
     * @param logger the logger to write to
     * @return user exception
     */
    public UserException build(final Logger logger) {
      if (uex != null) {
        return uex;
      }

      final UserException newException = new UserException(this);

      // since we just created a new exception, we should log it for later reference
      StringBuilder buf = new StringBuilder();
      buf.append("User Error Occurred");
      if (message != null) {
        buf.append(": ").append(message);
      }
      if (cause != null) {
        buf.append(" (").append(cause.getMessage()).append(")");
      }
      logger.info(buf.toString(), newException);

      return newException;
    }

    /**
     * builds a user exception or returns the wrapped one, without logging it. Used on lookup paths, where the
     * caller decides whether the failure is worth reporting.
     *
     * @return user exception
     */
    public UserException build() {
      if (uex != null) {
        return uex;
      }
      return new UserException(this);
    }
  }

  private final ErrorType errorType;

  private final UserExceptionContext context;

  private UserException(final Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  /**
   * generates the message that will be displayed to the caller without the stack trace.
   *
   * @return non verbose error message
   */
  @Override
  public String getMessage() {
    return generateMessage(true);
  }

  /**
   * @return the error message that was passed to the builder
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  /**
   * generates the message that will be displayed to the caller. The message also contains the stack trace.
   *
   * @return verbose error message
   */
  public String getVerboseMessage() {
    return generateMessage(true) + "\n\n" + ErrorHelper.buildCausesMessage(getCause());
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  public String getDictionaryName() {
    return context.getDictionaryName();
  }

  /**
   * Generates a user error message that has the following structure:
   * ERROR TYPE ERROR: ERROR_MESSAGE
   * CONTEXT
   * [Error Id: ERROR_ID in dictionary NAME]
   *
   * @return generated user error message
   */
  private String generateMessage(boolean includeErrorId) {
    return errorType + " ERROR: " + super.getMessage() + "\n\n" +
        context.generateContextMessage(includeErrorId);
  }
}
