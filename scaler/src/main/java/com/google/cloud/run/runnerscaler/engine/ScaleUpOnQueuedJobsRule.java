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
 * Scales up as soon as jobs are queued, without waiting for breach evidence.
 *
 * <p>The observation's demand is the number of instances the queued jobs need. The step is {@code
 * ceil(demand * SCALE_UP_PROPORTION)}, at least one and at most {@code SCALE_UP_STEP}. Any queued
 * demand ends the chain, so no scale-down is considered while jobs wait.
 */
public final class ScaleUpOnQueuedJobsRule implements ScalingRule {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ScalerConfig config;
  private final CooldownGuard cooldownGuard;

  public ScaleUpOnQueuedJobsRule(ScalerConfig config) {
    this.config = Preconditions.checkNotNull(config, "Scaler config cannot be null.");
    this.cooldownGuard = new CooldownGuard(config);
  }

  @Override
  public Optional<ScalingDecision> apply(
      ScalingObservation observation, ScalingState state, Instant now) {
    int queued = observation.demand();
    if (queued == 0) {
      return Optional.empty();
    }

    int current = observation.currentInstanceCount();
    logger.atInfo().log("Queued jobs need %d instance(s)", queued);
    if (cooldownGuard.isCooldownActive(state, ScalingDirection.UP, now)) {
      Duration remaining = cooldownGuard.remaining(state, ScalingDirection.UP, now);
      logger.atInfo().log(
          "Scale-up blocked by cooldown (%ds remaining)",
          (long) Math.ceil(remaining.toMillis() / 1000d));
      return Optional.of(ScalingDecision.none(current));
    }

    int step =
        Ints.constrainToRange(
            (int) Math.ceil(queued * config.proportion(ScalingDirection.UP)),
            1,
            config.stepMax(ScalingDirection.UP));
    int target =
        Ints.constrainToRange(current + step, config.minInstances(), config.maxInstances());
    if (target <= current) {
      logger.atInfo().log("Already at MAX_INSTANCES (%d)", config.maxInstances());
      return Optional.of(ScalingDecision.none(current));
    }
    return Optional.of(ScalingDecision.up(target));
  }
}
