/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.google.cloud.run.runnerscaler.clients;

import java.io.IOException;

/**
 * A transient failure talking to a remote API. The tick that hit it is skipped and the next tick
 * starts over with fresh reads.
 */
public class ScalerIoException extends IOException {

  /** Which collaborator call failed. */
  public enum Failure {
    DEMAND_QUERY,
    CAPACITY_QUERY,
    CAPACITY_APPLY
  }

  private final Failure failure;

  public ScalerIoException(Failure failure, String message) {
    super(message);
    this.failure = failure;
  }

  public ScalerIoException(Failure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = failure;
  }

  public Failure failure() {
    return failure;
  }
}
