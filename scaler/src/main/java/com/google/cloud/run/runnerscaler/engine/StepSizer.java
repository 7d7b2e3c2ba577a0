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
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;

/** Converts a confirmed breach into a bounded, proportional change in instance count. */
public final class StepSizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ScalerConfig config;

  public StepSizer(ScalerConfig config) {
    this.config = Preconditions.checkNotNull(config, "Scaler config cannot be null.");
  }

  /**
   * Returns the step for closing {@code gap}: {@code round(gap * proportion)} clamped to {@code
   * [1, maxStep]}, so every action makes progress even when the proportion yields less than one.
   */
  public int step(ScalingDirection direction, int gap, int maxStep) {
    Preconditions.checkArgument(maxStep >= 1, "Max step must be >= 1: %s", maxStep);
    long proportional = Math.round(gap * config.proportion(direction));
    return (int) Longs.constrainToRange(proportional, 1, maxStep);
  }

  /** Same as {@link #targetInstanceCount(ScalingDirection, int, int, int)} with the default cap. */
  public int targetInstanceCount(ScalingDirection direction, int demand, int currentInstanceCount) {
    return targetInstanceCount(direction, demand, currentInstanceCount, config.stepMax(direction));
  }

  /**
   * Returns the instance count after one step in {@code direction}, clamped to {@code
   * [MIN_INSTANCES, MAX_INSTANCES]}. The result equals the current count when the pool already
   * sits on the bound in that direction.
   */
  public int targetInstanceCount(
      ScalingDirection direction, int demand, int currentInstanceCount, int maxStep) {
    int gap =
        direction == ScalingDirection.UP
            ? demand - currentInstanceCount
            : currentInstanceCount - demand;
    int step = step(direction, gap, maxStep);
    logger.atInfo().log(
        "Scale-%s step: %d (%s=%d, proportion=%s)",
        direction.label(),
        step,
        direction == ScalingDirection.UP ? "deficit" : "excess",
        gap,
        config.proportion(direction));
    int unbounded =
        direction == ScalingDirection.UP
            ? currentInstanceCount + step
            : currentInstanceCount - step;
    return Ints.constrainToRange(unbounded, config.minInstances(), config.maxInstances());
  }
}
