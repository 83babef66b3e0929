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
package com.lithium.common.concurrent;

import com.google.common.base.Preconditions;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ThreadFactory} that names threads {@code <prefix>-<n>} and logs exceptions that escape a
 * thread's run method.
 */
public class NamedThreadFactory implements ThreadFactory {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(NamedThreadFactory.class);

  private final AtomicInteger nextId = new AtomicInteger(0);
  private final String prefix;
  private final boolean daemon;

  public NamedThreadFactory(String prefix) {
    this(prefix, true);
  }

  public NamedThreadFactory(String prefix, boolean daemon) {
    Preconditions.checkArgument(
        prefix != null && !prefix.isEmpty(), "thread name prefix is required");
    this.prefix = prefix;
    this.daemon = daemon;
  }

  @Override
  public Thread newThread(Runnable r) {
    final Thread t = new Thread(r, prefix + "-" + nextId.getAndIncrement());
    t.setDaemon(daemon);
    if (t.getPriority() != Thread.NORM_PRIORITY) {
      t.setPriority(Thread.NORM_PRIORITY);
    }
    t.setUncaughtExceptionHandler(
        (thread, e) ->
            logger.error("{} terminated with an uncaught exception.", thread.getName(), e));
    return t;
  }
}
