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
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Minimum interval between two scaling actions in the same direction.
 *
 * <p>The up and down cooldowns are independent: a recent scale-up never blocks a scale-down.
 */
public final class CooldownGuard {

  private final ScalerConfig config;

  public CooldownGuard(ScalerConfig config) {
    this.config = Preconditions.checkNotNull(config, "Scaler config cannot be null.");
  }

  public boolean isCooldownActive(ScalingState state, ScalingDirection direction, Instant now) {
    return !remaining(state, direction, now).isZero();
  }

  /** Time left before {@code direction} may act again. Zero when not cooling down. */
  public Duration remaining(ScalingState state, ScalingDirection direction, Instant now) {
    Optional<Instant> lastScaleTime = state.lastScaleTime(direction);
    if (lastScaleTime.isEmpty()) {
      return Duration.ZERO;
    }
    Duration elapsed = Duration.between(lastScaleTime.get(), now);
    Duration remaining = config.cooldown(direction).minus(elapsed);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }
}
