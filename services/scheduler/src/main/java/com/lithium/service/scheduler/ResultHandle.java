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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Outcome of one submitted task. It is written exactly once by the pool, with the task's value,
 * with what the task threw, or as cancelled when the pool shut down before the task ran. Any
 * number of threads may read it.
 *
 * <p>Callers cannot cancel a handle: {@link #cancel(boolean)} always returns false.
 *
 * @param <T> value type
 */
public final class ResultHandle<T> implements Future<T> {

  private enum Kind {
    VALUE,
    FAILED,
    CANCELLED
  }

  private static final class Outcome<T> {
    private final Kind kind;
    private final T value;
    private final Throwable failure;

    private Outcome(Kind kind, T value, Throwable failure) {
      this.kind = kind;
      this.value = value;
      this.failure = failure;
    }
  }

  private final AtomicReference<Outcome<T>> outcome = new AtomicReference<>();
  private final CountDownLatch written = new CountDownLatch(1);
  private final CompletableFuture<T> completion = new CompletableFuture<>();
  private final String description;

  ResultHandle(String description) {
    this.description = description;
  }

  boolean set(T value) {
    return write(new Outcome<>(Kind.VALUE, value, null));
  }

  boolean setFailure(Throwable failure) {
    Preconditions.checkNotNull(failure, "failure");
    return write(new Outcome<>(Kind.FAILED, null, failure));
  }

  boolean setCancelled() {
    return write(new Outcome<>(Kind.CANCELLED, null, null));
  }

  private boolean write(Outcome<T> result) {
    if (!outcome.compareAndSet(null, result)) {
      return false;
    }
    written.countDown();
    switch (result.kind) {
      case VALUE:
        completion.complete(result.value);
        break;
      case FAILED:
        completion.completeExceptionally(result.failure);
        break;
      case CANCELLED:
        completion.completeExceptionally(cancelled());
        break;
      default:
        throw new IllegalStateException("Unknown outcome " + result.kind);
    }
    return true;
  }

  /**
   * Waits for the task and returns its value.
   *
   * @throws TaskExecutionException if the task threw; the cause is what it threw
   * @throws TaskCancelledException if the task was dropped at shutdown
   */
  @Override
  public T get() throws InterruptedException, TaskExecutionException {
    written.await();
    return report(outcome.get());
  }

  @Override
  public T get(long timeout, TimeUnit unit)
      throws InterruptedException, TaskExecutionException, TimeoutException {
    if (!written.await(timeout, unit)) {
      throw new TimeoutException(
          String.format("%s did not complete within %d %s.", description, timeout, unit));
    }
    return report(outcome.get());
  }

  /**
   * Non-blocking read. Empty while the task has not completed, and also when it completed with a
   * null value; {@link #isDone()} tells the two apart.
   */
  public Optional<T> tryGet() throws TaskExecutionException {
    final Outcome<T> current = outcome.get();
    if (current == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(report(current));
  }

  private T report(Outcome<T> result) throws TaskExecutionException {
    switch (result.kind) {
      case VALUE:
        return result.value;
      case FAILED:
        throw new TaskExecutionException(result.failure);
      case CANCELLED:
        throw cancelled();
      default:
        throw new IllegalStateException("Unknown outcome " + result.kind);
    }
  }

  private TaskCancelledException cancelled() {
    return new TaskCancelledException(description + " was cancelled before it started.");
  }

  @Override
  public boolean cancel(boolean mayInterruptIfRunning) {
    return false;
  }

  @Override
  public boolean isCancelled() {
    final Outcome<T> current = outcome.get();
    return current != null && current.kind == Kind.CANCELLED;
  }

  @Override
  public boolean isDone() {
    return outcome.get() != null;
  }

  public boolean isFailed() {
    final Outcome<T> current = outcome.get();
    return current != null && current.kind == Kind.FAILED;
  }

  /**
   * A dependent future for composition. Completing or cancelling it does not affect this handle.
   */
  public CompletableFuture<T> toCompletableFuture() {
    return completion.copy();
  }

  @Override
  public String toString() {
    final Outcome<T> current = outcome.get();
    return description + "[" + (current == null ? "PENDING" : current.kind) + "]";
  }
}
