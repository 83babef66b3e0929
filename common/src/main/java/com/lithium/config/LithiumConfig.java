/*
 * Copyright (C) 2017-2019 Dremio Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.lithium.config;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueFactory;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;

/**
 * A configuration object that is merged with and validated against lithium-reference.conf.
 *
 * <p>Values are layered in this order, later layers winning: the reference file, the user file
 * (lithium.conf on the classpath or an explicit URL), then JVM system properties whose key
 * exists in the reference.
 */
public class LithiumConfig {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(LithiumConfig.class);

  private static final String REFERENCE_CONFIG = "lithium-reference.conf";
  private static final String DEFAULT_USER_CONFIG = "lithium.conf";

  public static final String SCHEDULER_THREADS_INT = "lithium.scheduler.threads";
  public static final String SCHEDULER_MINIMUM_THREADS_INT = "lithium.scheduler.minimum-threads";
  public static final String SCHEDULER_THREAD_NAME_STRING = "lithium.scheduler.thread-name";
  public static final String SCHEDULER_DAEMON_BOOL = "lithium.scheduler.daemon";

  private final Config unresolved;
  private final Config reference;
  private final Config config;

  /**
   * We maintain both the reference and the unresolved data so any withValue layering can be done
   * against unresolved values.
   */
  private LithiumConfig(Config unresolved, Config reference) {
    this.unresolved = unresolved;
    this.reference = reference;
    this.config = unresolved.withFallback(reference).resolve();
    check();
  }

  private void check() {
    final Config ref = reference.resolve();

    // make sure types are right
    config.checkValid(ref);

    // make sure we don't have any extra paths. these are typically typos.
    final List<String> invalidPaths = new ArrayList<>();
    for (Entry<String, ConfigValue> entry : config.entrySet()) {
      if (!ref.hasPath(entry.getKey())) {
        invalidPaths.add(entry.getKey());
      }
    }

    if (!invalidPaths.isEmpty()) {
      final StringBuilder sb = new StringBuilder();
      sb.append("Failure reading configuration file. The following properties were invalid:\n");
      for (String s : invalidPaths) {
        sb.append("\t").append(s).append("\n");
      }
      throw new RuntimeException(sb.toString());
    }
  }

  public static LithiumConfig create() {
    return create(null);
  }

  public static LithiumConfig create(final URL userConfigPath) {
    final ClassLoader classLoader = LithiumConfig.class.getClassLoader();
    Preconditions.checkNotNull(
        classLoader.getResource(REFERENCE_CONFIG), "Unable to find the reference configuration.");
    final Config reference = ConfigFactory.parseResources(classLoader, REFERENCE_CONFIG);

    final Config userConfig;
    if (userConfigPath == null) {
      userConfig =
          classLoader.getResource(DEFAULT_USER_CONFIG) == null
              ? null
              : ConfigFactory.parseResources(classLoader, DEFAULT_USER_CONFIG);
    } else {
      userConfig =
          ConfigFactory.parseURL(
              userConfigPath, ConfigParseOptions.defaults().setAllowMissing(false));
    }

    final Config effective = userConfig != null ? userConfig : reference;
    return new LithiumConfig(applySystemProperties(effective, reference), reference);
  }

  private static Config applySystemProperties(Config config, Config reference) {
    for (Entry<String, ConfigValue> entry : reference.entrySet()) {
      final String property = System.getProperty(entry.getKey());
      if (property != null && !property.isEmpty()) {
        config = config.withValue(entry.getKey(), ConfigValueFactory.fromAnyRef(property));
        logger.info(
            "Applying provided system property to config: -D{}={}", entry.getKey(), property);
      }
    }
    return config;
  }

  public LithiumConfig withValue(String path, ConfigValue value) {
    return new LithiumConfig(unresolved.withValue(path, value), reference);
  }

  public LithiumConfig withValue(String path, Object value) {
    return withValue(path, ConfigValueFactory.fromAnyRef(value));
  }

  public int getInt(String path) {
    return config.getInt(path);
  }

  public boolean getBoolean(String path) {
    return config.getBoolean(path);
  }

  public String getString(String path) {
    return config.getString(path);
  }

  @Override
  public String toString() {
    return config.root().render();
  }
}
