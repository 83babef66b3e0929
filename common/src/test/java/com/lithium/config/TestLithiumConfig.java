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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lithium.test.TemporarySystemPropertiesExtension;
import com.typesafe.config.ConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

/** Test Lithium Config. */
public class TestLithiumConfig {

  @RegisterExtension
  public final TemporarySystemPropertiesExtension properties =
      new TemporarySystemPropertiesExtension();

  @Test
  public void initialize() {
    LithiumConfig config = LithiumConfig.create();
    assertThat(config.getInt(LithiumConfig.SCHEDULER_THREADS_INT)).isEqualTo(0);
    assertThat(config.getInt(LithiumConfig.SCHEDULER_MINIMUM_THREADS_INT)).isEqualTo(-1);
    assertThat(config.getString(LithiumConfig.SCHEDULER_THREAD_NAME_STRING))
        .isEqualTo("lithium-worker");
    assertThat(config.getBoolean(LithiumConfig.SCHEDULER_DAEMON_BOOL)).isTrue();
  }

  @Test
  public void fileOverride() {
    properties.clear(LithiumConfig.SCHEDULER_THREADS_INT);

    LithiumConfig config = LithiumConfig.create(getClass().getResource("/test-lithium.conf"));

    assertThat(config.getInt(LithiumConfig.SCHEDULER_THREADS_INT)).isEqualTo(3);
    assertThat(config.getString(LithiumConfig.SCHEDULER_THREAD_NAME_STRING))
        .isEqualTo("test-worker");
    // not in the user file, falls back to the reference
    assertThat(config.getBoolean(LithiumConfig.SCHEDULER_DAEMON_BOOL)).isTrue();
  }

  /**
   * Make sure that we're overriding options provided in a user config even if that user config
   * doesn't set that value.
   */
  @Test
  public void systemOverFile() {
    properties.set(LithiumConfig.SCHEDULER_THREADS_INT, "5");
    properties.set(LithiumConfig.SCHEDULER_DAEMON_BOOL, "false");

    LithiumConfig config = LithiumConfig.create(getClass().getResource("/test-lithium.conf"));

    assertThat(config.getInt(LithiumConfig.SCHEDULER_THREADS_INT)).isEqualTo(5);
    assertThat(config.getBoolean(LithiumConfig.SCHEDULER_DAEMON_BOOL)).isFalse();
  }

  @Test
  public void badProperty() {
    assertThatThrownBy(
            () -> LithiumConfig.create(getClass().getResource("/test-lithium-bad.conf")))
        .isInstanceOf(RuntimeException.class)
        .hasMessageContaining("mistyped-property");
  }

  @Test
  public void wrongType() {
    assertThatThrownBy(
            () -> LithiumConfig.create(getClass().getResource("/test-lithium-wrongtype.conf")))
        .isInstanceOf(ConfigException.class);
  }

  @Test
  public void appOverride() {
    LithiumConfig config =
        LithiumConfig.create()
            .withValue(LithiumConfig.SCHEDULER_THREADS_INT, 7)
            .withValue(LithiumConfig.SCHEDULER_THREAD_NAME_STRING, "app-worker");

    assertThat(config.getInt(LithiumConfig.SCHEDULER_THREADS_INT)).isEqualTo(7);
    assertThat(config.getString(LithiumConfig.SCHEDULER_THREAD_NAME_STRING))
        .isEqualTo("app-worker");
  }

  @Test
  public void appOverrideRejectsUnknownPath() {
    assertThatThrownBy(() -> LithiumConfig.create().withValue("lithium.scheduler.nope", 1))
        .hasMessageContaining("lithium.scheduler.nope");
  }
}
