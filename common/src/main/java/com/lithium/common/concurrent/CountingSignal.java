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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A binary wake-up signal. {@link #release()} sets it, and repeated releases do not accumulate.
 * {@link #acquire()} waits for it to be set and clears it again before returning.
 */
public class CountingSignal {

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition released = lock.newCondition();
  private boolean set;

  public CountingSignal() {
    this(false);
  }

  public CountingSignal(boolean initiallySet) {
    this.set = initiallySet;
  }

  /** Sets the signal and wakes one waiter. Has no further effect if already set. */
  public void release() {
    lock.lock();
    try {
      if (!set) {
        set = true;
        released.signal();
      }
    } finally {
      lock.unlock();
    }
  }

  /** Waits until the signal is set, then clears it. */
  public void acquire() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (!set) {
        released.await();
      }
      set = false;
    } finally {
      lock.unlock();
    }
  }

  /** Clears the signal if it is set, without waiting. */
  public boolean tryAcquire() {
    lock.lock();
    try {
      if (!set) {
        return false;
      }
      set = false;
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits up to the given time for the signal.
   *
   * @return true if the signal was set and has been cleared, false on timeout
   */
  public boolean tryAcquire(long timeout, TimeUnit unit) throws InterruptedException {
    long remaining = unit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (!set) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = released.awaitNanos(remaining);
      }
      set = false;
      return true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isReleased() {
    lock.lock();
    try {
      return set;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "CountingSignal[" + (isReleased() ? "released" : "clear") + "]";
  }
}
