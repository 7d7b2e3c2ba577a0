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

/**
 * Hysteresis thresholds on the demand to capacity ratio.
 *
 * <p>Both comparisons are strict, so demand exactly on a threshold line counts as stable.
 */
public final class ThresholdEvaluator {

  private final ScalerConfig config;

  public ThresholdEvaluator(ScalerConfig config) {
    this.config = Preconditions.checkNotNull(config, "Scaler config cannot be null.");
  }

  /** Returns true iff {@code demand > current * SCALE_UP_THRESHOLD}. */
  public boolean shouldScaleUp(int demand, int currentInstanceCount) {
    return demand > limit(ScalingDirection.UP, currentInstanceCount);
  }

  /** Returns true iff {@code demand < current * SCALE_DOWN_THRESHOLD}. */
  public boolean shouldScaleDown(int demand, int currentInstanceCount) {
    return demand < limit(ScalingDirection.DOWN, currentInstanceCount);
  }

  public boolean isBreached(ScalingDirection direction, int demand, int currentInstanceCount) {
    return direction == ScalingDirection.UP
        ? shouldScaleUp(demand, currentInstanceCount)
        : shouldScaleDown(demand, currentInstanceCount);
  }

  /** The demand level the given direction compares against. */
  public double limit(ScalingDirection direction, int currentInstanceCount) {
    double ratio =
        direction == ScalingDirection.UP
            ? config.scaleUpThreshold()
            : config.scaleDownThreshold();
    return currentInstanceCount * ratio;
  }
}
