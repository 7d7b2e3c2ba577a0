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
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Removes instances whose runners are all idle once idle runners exceed the minimum.
 *
 * <p>Only whole instances' worth of idle runners above {@code MIN_INSTANCES * RUNNERS_PER_INSTANCE}
 * count as removable, so a busy runner is never targeted for termination. At most {@code
 * SCALE_DOWN_STEP} instances are removed per tick.
 */
public final class ScaleDownIdleRule implements ScalingRule {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ScalerConfig config;
  private final CooldownGuard cooldownGuard;

  public ScaleDownIdleRule(ScalerConfig config) {
    this.config = Preconditions.checkNotNull(config, "Scaler config cannot be null.");
    this.cooldownGuard = new CooldownGuard(config);
  }

  @Override
  public Optional<ScalingDecision> apply(
      ScalingObservation observation, ScalingState state, Instant now) {
    int idle = observation.requireRunnerCounts().idle();
    int minRunners = config.minRunners();
    if (idle <= minRunners) {
      return Optional.empty();
    }

    int current = observation.currentInstanceCount();
    logger.atInfo().log("Idle runners above minimum (%d > %d)", idle, minRunners);
    if (cooldownGuard.isCooldownActive(state, ScalingDirection.DOWN, now)) {
      Duration remaining = cooldownGuard.remaining(state, ScalingDirection.DOWN, now);
      logger.atInfo().log(
          "Scale-down blocked by cooldown (%ds remaining)",
          (long) Math.ceil(remaining.toMillis() / 1000d));
      return Optional.of(ScalingDecision.none(current));
    }

    int idleInstances = (idle - minRunners) / config.runnersPerInstance();
    if (idleInstances < 1) {
      logger.atInfo().log("Scale-down skipped, no fully idle instance to remove");
      return Optional.of(ScalingDecision.none(current));
    }

    int step = Math.min(config.stepMax(ScalingDirection.DOWN), idleInstances);
    int target =
        Ints.constrainToRange(current - step, config.minInstances(), config.maxInstances());
    if (target >= current) {
      logger.atInfo().log("Already at MIN_INSTANCES (%d)", config.minInstances());
      return Optional.of(ScalingDecision.none(current));
    }
    return Optional.of(ScalingDecision.down(target));
  }
}
