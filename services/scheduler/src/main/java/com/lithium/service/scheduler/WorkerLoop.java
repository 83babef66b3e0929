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

import java.util.Optional;

/**
 * Body of one worker thread. Parks on its signal, drains its own queue from the front, then
 * steals from the back of its peers' queues while the pool still has pending tasks.
 */
final class WorkerLoop implements Runnable {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(WorkerLoop.class);

  private final WorkStealingThreadPool pool;
  private final WorkerRecord record;
  private final WorkerInitializer initializer;

  WorkerLoop(WorkStealingThreadPool pool, WorkerRecord record, WorkerInitializer initializer) {
    this.pool = pool;
    this.record = record;
    this.initializer = initializer;
  }

  @Override
  public void run() {
    try {
      pool.awaitReady();
      if (pool.isStopRequested()) {
        return;
      }
      initialize();
      serve();
    } finally {
      record.setState(WorkerState.STOPPED);
      logger.debug("Worker {} of pool {} stopped.", record.getId(), pool.getName());
    }
  }

  private void initialize() {
    try {
      initializer.initialize(record.getId());
    } catch (Exception e) {
      logger.warn(
          "Initializer failed on worker {} of pool {}, continuing.",
          record.getId(),
          pool.getName(),
          e);
    }
  }

  /**
   * Stop is sampled once per cycle, at the top and right after waking. Work that is visible to
   * the worker once it is awake is always run.
   */
  private void serve() {
    while (!pool.isStopRequested()) {
      record.setState(WorkerState.PARKED);
      try {
        record.getSignal().acquire();
      } catch (InterruptedException e) {
        logger.debug("Worker {} interrupted while parked, ignoring.", record.getId());
        continue;
      }
      if (pool.isStopRequested()) {
        break;
      }

      do {
        record.setState(WorkerState.DRAINING);
        drainOwnQueue();
        record.setState(WorkerState.STEALING);
        stealOne();
      } while (pool.hasPendingTasks());

      record.setState(WorkerState.IDLE_TRANSITION);
      pool.prioritize(record.getId());
    }
  }

  private void drainOwnQueue() {
    Optional<Task> task;
    while ((task = record.getQueue().popFront()).isPresent()) {
      pool.taskDequeued();
      execute(task.get());
    }
  }

  /** Takes one task from the first peer that has any. */
  private void stealOne() {
    final int workers = pool.size();
    for (int offset = 1; offset < workers; offset++) {
      final WorkerRecord victim = pool.getRecord((record.getId() + offset) % workers);
      final Optional<Task> task = victim.getQueue().steal();
      if (task.isPresent()) {
        pool.taskDequeued();
        record.taskStolen();
        logger.debug("Worker {} stole a task from worker {}.", record.getId(), victim.getId());
        execute(task.get());
        return;
      }
    }
  }

  private void execute(Task task) {
    try {
      task.run();
    } catch (Throwable t) {
      // Task.run() contains user failures, this is a bug in the wrapper
      logger.error("Task {} leaked an exception on worker {}.", task, record.getId(), t);
    } finally {
      record.taskExecuted();
      pool.taskFinished();
      if (Thread.interrupted()) {
        logger.debug("Cleared interrupt left by a task on worker {}.", record.getId());
      }
    }
  }
}
