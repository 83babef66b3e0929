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

import java.util.concurrent.locks.ReentrantLock;

/** Standard exclusive mutex, backed by a non-fair {@link ReentrantLock}. */
public final class ExclusiveLock implements Lockable {

  private final ReentrantLock lock = new ReentrantLock();

  @Override
  public void lock() {
    lock.lock();
  }

  @Override
  public void unlock() {
    lock.unlock();
  }

  @Override
  public boolean tryLock() {
    return lock.tryLock();
  }

  public boolean isHeldByCurrentThread() {
    return lock.isHeldByCurrentThread();
  }

  @Override
  public String toString() {
    return "ExclusiveLock[" + (lock.isLocked() ? "locked" : "unlocked") + "]";
  }
}
