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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.Uninterruptibles;
import com.lithium.common.concurrent.NamedThreadFactory;
import com.lithium.config.LithiumConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed size pool where every worker owns a queue. Submissions are spread round robin over the
 * workers, preferring workers that recently ran dry; a worker with an empty queue steals from the
 * back of its peers' queues.
 *
 * <p>Shutdown is cooperative: an awake worker finishes all work it can see before it stops, and
 * tasks left in a queue after the workers are joined are resolved as cancelled.
 */
public class WorkStealingThreadPool implements TaskPool {
  private static final org.slf4j.Logger logger =
      org.slf4j.LoggerFactory.getLogger(WorkStealingThreadPool.class);

  public static final String DEFAULT_NAME = "lithium-worker";

  private enum State {
    RUNNING,
    STOP_REQUESTED,
    TERMINATED
  }

  private final String name;
  private final ImmutableList<WorkerRecord> workers;
  private final ImmutableList<Thread> threads;
  private final SchedulerIndex index = new SchedulerIndex();
  private final CountDownLatch ready = new CountDownLatch(1);

  private final AtomicLong pending = new AtomicLong();
  private final AtomicLong inFlight = new AtomicLong();
  private final AtomicInteger activeSubmitters = new AtomicInteger();
  private final Object idleMonitor = new Object();
  private final Object shutdownLock = new Object();
  private volatile State state = State.RUNNING;

  /** Pool with {@code threads} daemon workers that fails if any of them cannot be started. */
  public WorkStealingThreadPool(int threads) {
    this(builder().setThreads(threads));
  }

  private WorkStealingThreadPool(Builder builder) {
    Preconditions.checkArgument(
        builder.threads >= 0, "Thread count must not be negative, was %s.", builder.threads);
    final int minimum = builder.minimumThreads < 0 ? builder.threads : builder.minimumThreads;
    Preconditions.checkArgument(
        minimum <= builder.threads,
        "Minimum thread count %s exceeds requested thread count %s.",
        minimum,
        builder.threads);

    this.name = builder.name;
    final ThreadFactory factory =
        builder.threadFactory != null
            ? builder.threadFactory
            : new NamedThreadFactory(builder.name, builder.daemon);

    final List<WorkerRecord> records = new ArrayList<>(builder.threads);
    final List<Thread> started = new ArrayList<>(builder.threads);
    Throwable firstFailure = null;
    for (int slot = 0; slot < builder.threads; slot++) {
      // ids of surviving workers stay contiguous
      final WorkerRecord record = new WorkerRecord(records.size());
      index.add(record.getId());
      try {
        final Thread thread =
            factory.newThread(new WorkerLoop(this, record, builder.initializer));
        if (thread == null) {
          throw new IllegalStateException("Thread factory returned no thread.");
        }
        thread.start();
        records.add(record);
        started.add(thread);
      } catch (RuntimeException | OutOfMemoryError e) {
        logger.warn("Failed to start worker thread {} of pool {}.", slot, name, e);
        index.remove(record.getId());
        if (firstFailure == null) {
          firstFailure = e;
        }
      }
    }
    this.workers = ImmutableList.copyOf(records);
    this.threads = ImmutableList.copyOf(started);

    if (threads.size() < minimum) {
      state = State.STOP_REQUESTED;
      ready.countDown();
      stopWorkers();
      state = State.TERMINATED;
      throw new ConstructionException(
          name, builder.threads, threads.size(), minimum, firstFailure);
    }

    ready.countDown();
    logger.info(
        "Started {} of {} worker threads for pool {}.", threads.size(), builder.threads, name);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builds a pool from the {@code lithium.scheduler} section of the configuration. */
  public static WorkStealingThreadPool fromConfig(LithiumConfig config) {
    int threads = config.getInt(LithiumConfig.SCHEDULER_THREADS_INT);
    if (threads == 0) {
      threads = Runtime.getRuntime().availableProcessors();
    }
    return builder()
        .setThreads(threads)
        .setMinimumThreads(config.getInt(LithiumConfig.SCHEDULER_MINIMUM_THREADS_INT))
        .setName(config.getString(LithiumConfig.SCHEDULER_THREAD_NAME_STRING))
        .setDaemon(config.getBoolean(LithiumConfig.SCHEDULER_DAEMON_BOOL))
        .build();
  }

  @Override
  public <T> ResultHandle<T> submit(Callable<T> task) {
    Preconditions.checkNotNull(task, "task");
    final ResultHandle<T> handle = new ResultHandle<>(task.toString());
    enqueue(Task.withResult(task, handle));
    return handle;
  }

  @Override
  public ResultHandle<Void> submit(Runnable task) {
    Preconditions.checkNotNull(task, "task");
    final ResultHandle<Void> handle = new ResultHandle<>(task.toString());
    enqueue(Task.withResult(Executors.callable(task, (Void) null), handle));
    return handle;
  }

  @Override
  public void submitDetached(Runnable task) {
    Preconditions.checkNotNull(task, "task");
    enqueue(Task.detached(Executors.callable(task)));
  }

  @Override
  public void submitDetached(Callable<?> task) {
    enqueue(Task.detached(task));
  }

  private void enqueue(Task task) {
    activeSubmitters.incrementAndGet();
    try {
      if (state != State.RUNNING) {
        throw new SubmissionException(SubmissionException.Reason.POOL_CLOSED, name);
      }
      final OptionalInt target = index.nextTarget();
      if (!target.isPresent()) {
        throw new SubmissionException(SubmissionException.Reason.NO_WORKERS, name);
      }
      final WorkerRecord worker = workers.get(target.getAsInt());
      pending.incrementAndGet();
      inFlight.incrementAndGet();
      worker.getQueue().pushBack(task);
      worker.getSignal().release();
    } finally {
      activeSubmitters.decrementAndGet();
    }
  }

  @Override
  public int size() {
    return workers.size();
  }

  @Override
  public void waitForTasks() throws InterruptedException {
    checkNotWorkerThread("waitForTasks");
    synchronized (idleMonitor) {
      while (inFlight.get() > 0) {
        idleMonitor.wait();
      }
    }
  }

  @Override
  public boolean waitForTasks(long timeout, TimeUnit unit) throws InterruptedException {
    checkNotWorkerThread("waitForTasks");
    final long deadline = System.nanoTime() + unit.toNanos(timeout);
    synchronized (idleMonitor) {
      while (inFlight.get() > 0) {
        final long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(idleMonitor, remaining);
      }
    }
    return true;
  }

  @Override
  public List<WorkerInfo> getWorkerInfos() {
    final ImmutableList.Builder<WorkerInfo> infos = ImmutableList.builder();
    for (int i = 0; i < workers.size(); i++) {
      final WorkerRecord record = workers.get(i);
      final Thread thread = threads.get(i);
      infos.add(
          new WorkerInfo(
              thread.getName(),
              record.getId(),
              record.getState(),
              record.getQueue().size(),
              record.getExecutedTasks(),
              record.getStolenTasks(),
              thread.getId()));
    }
    return infos.build();
  }

  @Override
  public void shutdown() {
    checkNotWorkerThread("shutdown");
    synchronized (shutdownLock) {
      if (state == State.TERMINATED) {
        return;
      }
      logger.info("Stopping pool {} with {} workers.", name, workers.size());
      state = State.STOP_REQUESTED;
      while (activeSubmitters.get() > 0) {
        Thread.yield();
      }
      stopWorkers();

      int cancelled = 0;
      for (WorkerRecord worker : workers) {
        for (Task task : worker.getQueue().drain()) {
          pending.decrementAndGet();
          task.cancel();
          taskFinished();
          cancelled++;
        }
      }
      if (cancelled > 0) {
        logger.warn("Cancelled {} queued tasks while stopping pool {}.", cancelled, name);
      }
      state = State.TERMINATED;
      logger.info("Pool {} stopped.", name);
    }
  }

  private void stopWorkers() {
    for (WorkerRecord worker : workers) {
      worker.getSignal().release();
    }
    for (Thread thread : threads) {
      Uninterruptibles.joinUninterruptibly(thread);
    }
  }

  @Override
  public boolean isShutdown() {
    return state != State.RUNNING;
  }

  @Override
  public boolean isTerminated() {
    return state == State.TERMINATED;
  }

  public String getName() {
    return name;
  }

  @VisibleForTesting
  List<Integer> getSchedulingOrder() {
    return index.snapshot();
  }

  private void checkNotWorkerThread(String operation) {
    Preconditions.checkState(
        !threads.contains(Thread.currentThread()),
        "%s cannot be called from a worker thread of pool %s.",
        operation,
        name);
  }

  // Worker side.

  void awaitReady() {
    Uninterruptibles.awaitUninterruptibly(ready);
  }

  boolean isStopRequested() {
    return state != State.RUNNING;
  }

  boolean hasPendingTasks() {
    return pending.get() > 0;
  }

  WorkerRecord getRecord(int workerId) {
    return workers.get(workerId);
  }

  void prioritize(int workerId) {
    index.prioritize(workerId);
  }

  void taskDequeued() {
    pending.decrementAndGet();
  }

  void taskFinished() {
    if (inFlight.decrementAndGet() == 0) {
      synchronized (idleMonitor) {
        idleMonitor.notifyAll();
      }
    }
  }

  @Override
  public String toString() {
    return "WorkStealingThreadPool[" + name + ", workers=" + workers + "]";
  }

  /** Settings for a {@link WorkStealingThreadPool}. */
  public static final class Builder {
    private int threads = Runtime.getRuntime().availableProcessors();
    private int minimumThreads = -1;
    private String name = DEFAULT_NAME;
    private boolean daemon = true;
    private ThreadFactory threadFactory;
    private WorkerInitializer initializer = WorkerInitializer.NONE;

    private Builder() {}

    public Builder setThreads(int threads) {
      this.threads = threads;
      return this;
    }

    /**
     * Fewest workers the pool may start with when some threads fail to start. Negative means all
     * requested threads are required.
     */
    public Builder setMinimumThreads(int minimumThreads) {
      this.minimumThreads = minimumThreads;
      return this;
    }

    public Builder setName(String name) {
      this.name = Preconditions.checkNotNull(name, "name");
      return this;
    }

    public Builder setDaemon(boolean daemon) {
      this.daemon = daemon;
      return this;
    }

    /** Replaces the default {@link NamedThreadFactory}; name and daemon flag are then unused. */
    public Builder setThreadFactory(ThreadFactory threadFactory) {
      this.threadFactory = threadFactory;
      return this;
    }

    public Builder setInitializer(WorkerInitializer initializer) {
      this.initializer = Preconditions.checkNotNull(initializer, "initializer");
      return this;
    }

    public WorkStealingThreadPool build() {
      return new WorkStealingThreadPool(this);
    }
  }
}
