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

import java.io.IOException;
import java.net.URL;
import java.util.Collections;
import java.util.List;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.flatdict.common.exceptions.UserException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigRenderOptions;

/**
 * Dictionary configuration. Wraps a resolved Typesafe {@link Config} and adds
 * typed accessors that report missing or malformed values as validation errors.
 */
public class DictConfig {
  private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(DictConfig.class);

  private final Config config;

  @VisibleForTesting
  public DictConfig(Config config) {
    this.config = config;
    logger.debug("Setting up DictConfig object.");
    logger.trace("Given Config object is:\n{}", config.root().render(ConfigRenderOptions.defaults()));
  }

  /**
   * Creates a DictConfig object using the default config file names.
   * @return The new DictConfig object.
   */
  public static DictConfig create() {
    return create(null, null);
  }

  /**
   * <b><u>Do not use this method outside of test code.</u></b>
   */
  @VisibleForTesting
  public static DictConfig create(Properties testConfigurations) {
    return create(null, testConfigurations);
  }

  /**
   * Creates a configuration using the provided config object.
   * @param config custom configuration
   * @return {@link DictConfig} instance
   */
  public static DictConfig create(Config config) {
    return new DictConfig(config.resolve());
  }

  /**
   * DictConfig loads configuration information. It does this utilizing a combination of classpath lookups
   * and Configuration fallbacks provided by the TypeSafe configuration library. The order of precedence is as
   * follows:
   * <ul>
   * <li>Overriding properties, if any.</li>
   * <li>A single copy of "flatdict-override.conf" (or of the given override resource).</li>
   * <li>All copies of "{@code flatdict-module.conf}". Loading order is indeterminate.</li>
   * <li>A single copy of "{@code flatdict-default.conf}".</li>
   * </ul>
   *
   * @param overrideFileResourcePathname
   *          the classpath resource pathname of the file to use for
   *          configuration override purposes; {@code null} specifies to use the
   *          default pathname ({@link CommonConstants#CONFIG_OVERRIDE_RESOURCE_PATHNAME})
   * @param overriderProps
   *          optional property map for further overriding
   * @return A merged Config object.
   */
  public static DictConfig create(String overrideFileResourcePathname, final Properties overriderProps) {
    final StringBuilder logString = new StringBuilder();
    final Stopwatch watch = Stopwatch.createStarted();
    overrideFileResourcePathname =
        overrideFileResourcePathname == null
            ? CommonConstants.CONFIG_OVERRIDE_RESOURCE_PATHNAME
            : overrideFileResourcePathname;

    final ClassLoader classLoader = classLoader();

    // 1. Load defaults configuration file.
    Config fallback = ConfigFactory.empty();
    final URL defaultUrl = classLoader.getResource(CommonConstants.CONFIG_DEFAULT_RESOURCE_PATHNAME);
    if (defaultUrl != null) {
      logString.append("Base Configuration:\n\t- ").append(defaultUrl).append("\n");
      fallback = ConfigFactory.parseURL(defaultUrl);
    }

    // 2. Load per-module configuration files.
    logString.append("\nIntermediate Configuration files, in order of precedence:\n");
    for (URL url : moduleConfigUrls(classLoader)) {
      logString.append("\t- ").append(url).append("\n");
      fallback = ConfigFactory.parseURL(url).withFallback(fallback);
    }
    logString.append("\n");

    // 3. Load any specified overrides configuration file.
    final URL overrideFileUrl = classLoader.getResource(overrideFileResourcePathname);
    Config effectiveConfig = fallback;
    if (overrideFileUrl != null) {
      logString.append("Override File: ").append(overrideFileUrl).append("\n");
      effectiveConfig = ConfigFactory.parseURL(overrideFileUrl).withFallback(fallback);
    }

    // 4. Apply any overriding properties.
    if (overriderProps != null) {
      logString.append("Overridden Properties:\n");
      for (Entry<Object, Object> entry : overriderProps.entrySet()) {
        logString.append("\t-").append(entry.getKey()).append(" = ").append(entry.getValue()).append("\n");
      }
      logString.append("\n");
      effectiveConfig = ConfigFactory.parseProperties(overriderProps).withFallback(effectiveConfig);
    }

    logger.info("Configuration file(s) identified in {}ms.\n{}",
        watch.elapsed(TimeUnit.MILLISECONDS),
        logString);
    return new DictConfig(effectiveConfig.resolve());
  }

  private static ClassLoader classLoader() {
    final ClassLoader contextLoader = Thread.currentThread().getContextClassLoader();
    return contextLoader != null ? contextLoader : DictConfig.class.getClassLoader();
  }

  private static List<URL> moduleConfigUrls(ClassLoader classLoader) {
    try {
      return Collections.list(classLoader.getResources(CommonConstants.MODULE_CONFIG_RESOURCE_PATHNAME));
    } catch (IOException e) {
      throw UserException.validationError(e)
          .message("Failure while looking up %s on the classpath.", CommonConstants.MODULE_CONFIG_RESOURCE_PATHNAME)
          .build(logger);
    }
  }

  public Config getConfig() {
    return config;
  }

  public boolean hasPath(String path) {
    return config.hasPath(path);
  }

  public String getString(String path) {
    try {
      return config.getString(path);
    } catch (ConfigException e) {
      throw invalidValue(path, e);
    }
  }

  public int getInt(String path) {
    try {
      return config.getInt(path);
    } catch (ConfigException e) {
      throw invalidValue(path, e);
    }
  }

  /**
   * Reads a strictly positive integer.
   */
  public int getPositiveInt(String path) {
    final int value = getInt(path);
    if (value <= 0) {
      throw UserException.validationError()
          .message("Configuration value %s must be positive, got %d.", path, value)
          .build(logger);
    }
    return value;
  }

  private UserException invalidValue(String path, ConfigException e) {
    return UserException.validationError(e)
        .message("Invalid or missing configuration value at %s.", path)
        .addContext("Cause", e.getMessage())
        .build(logger);
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
