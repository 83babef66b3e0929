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
package com.lithium.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

/** Tests for {@link AutoCloseables} */
public class TestAutoCloseables {

  @Test
  public void testCloseAllAndThrowFirst() {
    Resource r1 = new Resource(new IOException("R1 exception"));
    Resource r2 = new Resource(null);
    Resource r3 = new Resource(new RuntimeException("R3 exception"));

    assertThatThrownBy(() -> AutoCloseables.close(r1, r2, r3))
        .isInstanceOf(IOException.class)
        .hasMessage("R1 exception")
        .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
    assertThat(r1.closed && r2.closed && r3.closed).isTrue();
  }

  @Test
  public void testCloseWithLogger() {
    Logger logger = mock(Logger.class);
    Resource failing = new Resource(new IOException("boom"));
    AutoCloseables.close(failing, logger);
    assertThat(failing.closed).isTrue();
    verify(logger).warn(anyString(), any(Object.class), any(Object.class));
  }

  @Test
  public void testNullsIgnored() throws Exception {
    AutoCloseables.close((AutoCloseable) null);
    AutoCloseables.close(null, mock(Logger.class));
  }

  private static final class Resource implements AutoCloseable {
    private final Exception toBeThrown;
    private boolean closed = false;

    private Resource(Exception toBeThrown) {
      this.toBeThrown = toBeThrown;
    }

    @Override
    public void close() throws Exception {
      closed = true;
      if (toBeThrown != null) {
        throw toBeThrown;
      }
    }
  }
}
