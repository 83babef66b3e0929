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

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/** A fixed set of worker threads that run submitted tasks. */
public interface TaskPool extends AutoCloseable {

  /**
   * Queues a task and returns its handle without waiting.
   *
   * @throws SubmissionException if the pool is shut down or has no workers
   */
  <T> ResultHandle<T> submit(Callable<T> task);

  ResultHandle<Void> submit(Runnable task);

  /** Queues a task whose outcome nobody reads. Failures are logged. */
  void submitDetached(Runnable task);

  void submitDetached(Callable<?> task);

  /** Number of live worker threads. */
  int size();

  /**
   * Blocks until every accepted task has finished or was cancelled. Must not be called from a
   * worker thread of this pool.
   */
  void waitForTasks() throws InterruptedException;

  /** @return false if tasks were still in flight when the timeout elapsed */
  boolean waitForTasks(long timeout, TimeUnit unit) throws InterruptedException;

  List<WorkerInfo> getWorkerInfos();

  /**
   * Stops the workers, joins their threads and cancels tasks that never started. Blocks until
   * done; later calls return immediately.
   */
  void shutdown();

  boolean isShutdown();

  boolean isTerminated();

  @Override
  default void close() {
    shutdown();
  }

  class WorkerInfo {
    /** current Java thread name */
    public final String threadName;
    /** position of the worker in the pool */
    public final int workerId;

    public final WorkerState state;
    public final int queuedTasks;
    public final long executedTasks;
    public final long stolenTasks;

    /** Java thread id */
    public final long threadId;

    public WorkerInfo(
        String threadName,
        int workerId,
        WorkerState state,
        int queuedTasks,
        long executedTasks,
        long stolenTasks,
        long threadId) {
      this.threadName = threadName;
      this.workerId = workerId;
      this.state = state;
      this.queuedTasks = queuedTasks;
      this.executedTasks = executedTasks;
      this.stolenTasks = stolenTasks;
      this.threadId = threadId;
    }

    @Override
    public String toString() {
      return String.format(
          "%s[id=%d, state=%s, queued=%d, executed=%d, stolen=%d]",
          threadName, workerId, state, queuedTasks, executedTasks, stolenTasks);
    }
  }
}
