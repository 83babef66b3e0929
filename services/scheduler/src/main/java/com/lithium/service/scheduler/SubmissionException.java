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

import java.util.concurrent.RejectedExecutionException;

/** Thrown to the submitting thread when a {@link TaskPool} does not accept a task. */
public class SubmissionException extends RejectedExecutionException {

  private static final long serialVersionUID = 1L;

  /** Why the task was not accepted. */
  public enum Reason {
    /** shutdown has been requested */
    POOL_CLOSED,
    /** the pool runs no worker threads */
    NO_WORKERS
  }

  private final Reason reason;

  public SubmissionException(Reason reason, String poolName) {
    super(describe(reason, poolName));
    this.reason = reason;
  }

  private static String describe(Reason reason, String poolName) {
    switch (reason) {
      case POOL_CLOSED:
        return String.format("Task pool %s is shut down.", poolName);
      case NO_WORKERS:
        return String.format("Task pool %s has no worker threads.", poolName);
      default:
        throw new IllegalArgumentException("Unknown reason " + reason);
    }
  }

  public Reason getReason() {
    return reason;
  }
}
