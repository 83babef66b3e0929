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

import com.lithium.common.concurrent.CountingSignal;
import com.lithium.common.concurrent.OwnedQueue;
import java.util.concurrent.atomic.AtomicLong;

/** Per worker bookkeeping: its queue, its wake-up signal and a few counters. */
final class WorkerRecord {

  private final int id;
  private final OwnedQueue<Task> queue = new OwnedQueue<>();
  private final CountingSignal signal = new CountingSignal();
  private final AtomicLong executed = new AtomicLong();
  private final AtomicLong stolen = new AtomicLong();
  private volatile WorkerState state = WorkerState.STARTING;

  WorkerRecord(int id) {
    this.id = id;
  }

  int getId() {
    return id;
  }

  OwnedQueue<Task> getQueue() {
    return queue;
  }

  CountingSignal getSignal() {
    return signal;
  }

  WorkerState getState() {
    return state;
  }

  void setState(WorkerState state) {
    this.state = state;
  }

  void taskExecuted() {
    executed.incrementAndGet();
  }

  void taskStolen() {
    stolen.incrementAndGet();
  }

  long getExecutedTasks() {
    return executed.get();
  }

  long getStolenTasks() {
    return stolen.get();
  }

  @Override
  public String toString() {
    return "Worker-" + id + "[" + state + ", queued=" + queue.size() + "]";
  }
}
