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
package com.lithium.service.scheduler;

import com.google.common.base.Preconditions;
import java.util.concurrent.Callable;

/**
 * A unit of work sitting in a worker queue. {@link #run()} never throws: whatever the wrapped
 * callable throws is delivered to its handle or logged and dropped.
 */
abstract class Task {

  private final Callable<?> callable;

  Task(Callable<?> callable) {
    this.callable = Preconditions.checkNotNull(callable, "task");
  }

  Callable<?> getCallable() {
    return callable;
  }

  /** Executes the task on the calling worker thread. */
  abstract void run();

  /** Resolves a task that will never run because its pool shut down. */
  abstract void cancel();

  static <T> Task withResult(Callable<T> callable, ResultHandle<T> handle) {
    return new ResultTask<>(callable, handle);
  }

  static Task detached(Callable<?> callable) {
    return new DetachedTask(callable);
  }

  @Override
  public String toString() {
    return callable.toString();
  }

  private static final class ResultTask<T> extends Task {
    private final Callable<T> callable;
    private final ResultHandle<T> handle;

    private ResultTask(Callable<T> callable, ResultHandle<T> handle) {
      super(callable);
      this.callable = callable;
      this.handle = Preconditions.checkNotNull(handle, "handle");
    }

    @Override
    void run() {
      final T value;
      try {
        value = callable.call();
      } catch (Throwable t) {
        handle.setFailure(t);
        return;
      }
      handle.set(value);
    }

    @Override
    void cancel() {
      handle.setCancelled();
    }
  }

  private static final class DetachedTask extends Task {
    private static final org.slf4j.Logger logger =
        org.slf4j.LoggerFactory.getLogger(DetachedTask.class);

    private DetachedTask(Callable<?> callable) {
      super(callable);
    }

    @Override
    void run() {
      try {
        getCallable().call();
      } catch (Throwable t) {
        logger.warn("Detached task {} failed, discarding the failure.", getCallable(), t);
      }
    }

    @Override
    void cancel() {
      logger.debug("Dropping detached task {} at shutdown.", getCallable());
    }
  }
}
