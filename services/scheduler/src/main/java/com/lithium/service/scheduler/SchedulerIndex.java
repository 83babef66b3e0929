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

import com.lithium.common.concurrent.OwnedQueue;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Rotation of worker ids used to pick submission targets. Submissions take the front id and move
 * it to the back; a worker that runs out of work moves itself to the front so the next submission
 * goes to an idle worker.
 */
final class SchedulerIndex {

  private final OwnedQueue<Integer> order = new OwnedQueue<>();

  /** Appends a worker id. Only used while the pool is being built. */
  void add(int workerId) {
    order.pushBack(workerId);
  }

  /** Drops a slot whose thread could not be started. */
  boolean remove(int workerId) {
    return order.remove(workerId);
  }

  OptionalInt nextTarget() {
    final Optional<Integer> next = order.copyFrontAndRotateToBack();
    return next.isPresent() ? OptionalInt.of(next.get()) : OptionalInt.empty();
  }

  void prioritize(int workerId) {
    order.rotateToFront(workerId);
  }

  int size() {
    return order.size();
  }

  List<Integer> snapshot() {
    return order.snapshot();
  }

  @Override
  public String toString() {
    return order.toString();
  }
}
