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

/** Reads and writes the replica count of one named worker pool. */
public interface CapacityClient {

  /**
   * Returns the configured instance count of the worker pool.
   *
   * @throws ScalerIoException with {@link ScalerIoException.Failure#CAPACITY_QUERY} on failure.
   */
  int getInstanceCount() throws ScalerIoException, InterruptedException;

  /**
   * Requests a new instance count. Callers read the count back to verify the change, since another
   * writer may have raced this one.
   *
   * @throws ScalerIoException with {@link ScalerIoException.Failure#CAPACITY_APPLY} on failure.
   */
  void setInstanceCount(int instances) throws ScalerIoException, InterruptedException;

  /** Human readable name of the worker pool, for logs. */
  String workerName();
}
