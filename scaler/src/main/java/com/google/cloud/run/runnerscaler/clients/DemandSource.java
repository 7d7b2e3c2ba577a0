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

import com.google.cloud.run.runnerscaler.engine.ScalingObservation.RunnerCounts;

/** Source of job demand and runner registrations for the worker pool. */
public interface DemandSource {

  /**
   * Jobs that currently need runner capacity.
   *
   * @param queued Jobs waiting for a runner.
   * @param inProgress Jobs running on one of our runners.
   */
  record JobDemand(int queued, int inProgress) {
    public int total() {
      return queued + inProgress;
    }
  }

  /** @throws ScalerIoException with {@link ScalerIoException.Failure#DEMAND_QUERY} on failure. */
  JobDemand getJobDemand() throws ScalerIoException, InterruptedException;

  /** @throws ScalerIoException with {@link ScalerIoException.Failure#DEMAND_QUERY} on failure. */
  RunnerCounts getRunnerCounts() throws ScalerIoException, InterruptedException;
}
