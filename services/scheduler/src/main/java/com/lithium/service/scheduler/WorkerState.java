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

/** Where a worker thread currently is in its loop. */
public enum WorkerState {
  /** thread started, waiting for the pool to finish construction */
  STARTING,
  /** waiting on its signal */
  PARKED,
  /** executing tasks from its own queue */
  DRAINING,
  /** own queue empty, taking tasks from peers */
  STEALING,
  /** found no work, moving itself to the front of the scheduler index */
  IDLE_TRANSITION,
  /** loop exited */
  STOPPED
}
