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

package com.google.cloud.run.runnerscaler.engine;

import com.google.common.base.Preconditions;
import java.util.Optional;

/**
 * The facts a scaling policy consumes on each tick.
 *
 * @param demand Work units that need capacity. Must not be negative.
 * @param currentInstanceCount The current replica count of the worker pool.
 * @param runnerCounts Registered runner counts, only present when the policy asked for them.
 */
public record ScalingObservation(
    int demand, int currentInstanceCount, Optional<RunnerCounts> runnerCounts) {

  public ScalingObservation {
    Preconditions.checkArgument(demand >= 0, "Demand must not be negative: %s", demand);
    Preconditions.checkArgument(
        currentInstanceCount >= 0,
        "Current instance count must not be negative: %s",
        currentInstanceCount);
    Preconditions.checkNotNull(runnerCounts, "Runner counts cannot be null.");
  }

  public static ScalingObservation of(int demand, int currentInstanceCount) {
    return new ScalingObservation(demand, currentInstanceCount, Optional.empty());
  }

  public static ScalingObservation of(
      int demand, int currentInstanceCount, RunnerCounts runnerCounts) {
    return new ScalingObservation(demand, currentInstanceCount, Optional.of(runnerCounts));
  }

  /**
   * Returns the runner counts.
   *
   * @throws IllegalStateException if the observation carries none.
   */
  public RunnerCounts requireRunnerCounts() {
    Preconditions.checkState(runnerCounts.isPresent(), "Observation has no runner counts.");
    return runnerCounts.get();
  }

  /**
   * Online and idle runners registered for the worker pool.
   *
   * @param online Runners that are connected and able to take jobs or already running one.
   * @param idle Online runners that are not busy. Only these are safe to remove.
   */
  public record RunnerCounts(int online, int idle) {
    public RunnerCounts {
      Preconditions.checkArgument(online >= 0, "Online count must not be negative: %s", online);
      Preconditions.checkArgument(
          idle >= 0 && idle <= online, "Idle count must be in [0, %s]: %s", online, idle);
    }
  }
}
