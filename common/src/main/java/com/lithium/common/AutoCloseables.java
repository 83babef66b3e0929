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

import java.util.Arrays;
import org.slf4j.Logger;

/**
 * Utilities for closing several {@link AutoCloseable}s at once. Every resource is closed even if
 * an earlier one fails; the first failure is thrown with the later ones attached as suppressed.
 */
public final class AutoCloseables {

  private AutoCloseables() {
  }

  public static void close(AutoCloseable... closeables) throws Exception {
    close(Arrays.asList(closeables));
  }

  public static void close(Iterable<? extends AutoCloseable> closeables) throws Exception {
    Exception topLevelException = null;
    for (AutoCloseable closeable : closeables) {
      try {
        if (closeable != null) {
          closeable.close();
        }
      } catch (Exception e) {
        if (topLevelException == null) {
          topLevelException = e;
        } else if (e != topLevelException) {
          topLevelException.addSuppressed(e);
        }
      }
    }
    if (topLevelException != null) {
      throw topLevelException;
    }
  }

  /** Closes a resource and logs a failure instead of throwing it. */
  public static void close(AutoCloseable closeable, Logger logger) {
    if (closeable == null) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception e) {
      logger.warn("Failure while closing {}.", closeable, e);
    }
  }
}
