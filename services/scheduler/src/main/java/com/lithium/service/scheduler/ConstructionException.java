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

/**
 * Thrown when a pool could not start as many worker threads as it requires. Workers that did
 * start have already been stopped when this is thrown.
 */
public class ConstructionException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final int requestedWorkers;
  private final int startedWorkers;

  public ConstructionException(
      String poolName,
      int requestedWorkers,
      int startedWorkers,
      int minimumWorkers,
      Throwable cause) {
    super(
        String.format(
            "Task pool %s started %d of %d worker threads, at least %d are required.",
            poolName, startedWorkers, requestedWorkers, minimumWorkers),
        cause);
    this.requestedWorkers = requestedWorkers;
    this.startedWorkers = startedWorkers;
  }

  public int getRequestedWorkers() {
    return requestedWorkers;
  }

  public int getStartedWorkers() {
    return startedWorkers;
  }
}
