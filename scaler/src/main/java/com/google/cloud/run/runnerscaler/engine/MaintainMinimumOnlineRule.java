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
import com.google.common.math.IntMath;
import com.google.common.primitives.Ints;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps at least {@code MIN_INSTANCES * RUNNERS_PER_INSTANCE} runners online when runners are
 * ephemeral.
 *
 * <p>Ephemeral runners exit after a single job, so the replica count can look healthy while few
 * runners are actually registered. This rule tops the pool up by the instances needed to host the
 * missing runners. It ignores the scale-up cooldown.
 */
public final class MaintainMinimumOnlineRule implements ScalingRule {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ScalerConfig config;

  public MaintainMinimumOnlineRule(ScalerConfig config) {
    this.config = Preconditions.checkNotNull(config, "Scaler config cannot be null.");
  }

  @Override
  public Optional<ScalingDecision> apply(
      ScalingObservation observation, ScalingState state, Instant now) {
    int online = observation.requireRunnerCounts().online();
    int minRunners = config.minRunners();
    if (online >= minRunners) {
      return Optional.empty();
    }

    int current = observation.currentInstanceCount();
    int missingInstances =
        IntMath.divide(minRunners - online, config.runnersPerInstance(), RoundingMode.CEILING);
    logger.atInfo().log("Online runners below minimum (%d < %d)", online, minRunners);

    int target =
        Ints.constrainToRange(
            current + missingInstances, config.minInstances(), config.maxInstances());
    if (target <= current) {
      logger.atInfo().log("Already at MAX_INSTANCES (%d)", config.maxInstances());
      return Optional.of(ScalingDecision.none(current));
    }
    return Optional.of(ScalingDecision.up(target));
  }
}
