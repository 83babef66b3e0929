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

/**
 * Minimal lock capability used by the structures in this package. Implementations are injected
 * into the structures they guard, so a structure never needs to know which lock it runs on.
 */
public interface Lockable {

  /** Blocks until the lock is held by the calling thread. */
  void lock();

  /** Releases a lock held by the calling thread. */
  void unlock();

  /**
   * Acquires the lock only if it is free at the time of the call.
   *
   * @return true if the lock was acquired
   */
  boolean tryLock();
}
