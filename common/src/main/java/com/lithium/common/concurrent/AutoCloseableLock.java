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
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps a {@link Lockable} so it can be released by a try-with-resources block. A single-use
 * instance tracks whether it is open and ignores a second close.
 *
 * <pre>
 * try (AutoCloseableLock ignored = lock.open()) {
 *   ...
 * }
 * </pre>
 */
public class AutoCloseableLock implements AutoCloseable {

  private final boolean singleUse;
  private final AtomicBoolean closed = new AtomicBoolean(true);
  private final Lockable lock;

  public AutoCloseableLock(Lockable lock) {
    this(lock, false);
  }

  public AutoCloseableLock(Lockable lock, boolean singleUse) {
    this.lock = Preconditions.checkNotNull(lock, "lock required");
    this.singleUse = singleUse;
  }

  public AutoCloseableLock open() {
    startOpen();
    lock.lock();
    return this;
  }

  private void startOpen() {
    if (singleUse && !closed.compareAndSet(true, false)) {
      throw new IllegalStateException(
          "Trying to open an already opened lock. "
              + "A single use AutoCloseableLock allows only one lock count to be held at a time.");
    }
  }

  private boolean shouldClose() {
    return !singleUse || closed.compareAndSet(false, true);
  }

  /**
   * Acquires the lock only if it is free right now.
   *
   * @return this lock, opened, or empty if the lock was held elsewhere
   */
  public Optional<AutoCloseableLock> tryOpen() {
    startOpen();
    if (lock.tryLock()) {
      return Optional.of(this);
    }
    shouldClose();
    return Optional.empty();
  }

  /** Releases the lock. A single-use lock that is already closed is left alone. */
  @Override
  public void close() {
    if (shouldClose()) {
      lock.unlock();
    }
  }

  public static AutoCloseableLock of(Lockable lock, boolean singleUse) {
    return new AutoCloseableLock(lock, singleUse);
  }

  public static AutoCloseableLock lockAndWrap(Lockable lock, boolean singleUse) {
    AutoCloseableLock acl = new AutoCloseableLock(lock, singleUse);
    acl.startOpen();
    lock.lock();
    return acl;
  }
}
