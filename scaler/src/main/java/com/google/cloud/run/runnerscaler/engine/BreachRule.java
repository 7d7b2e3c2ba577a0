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
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Scales in one direction once enough recent threshold breaches have accumulated.
 *
 * <p>Applies whenever demand crosses the direction's threshold. The breach is recorded and scored;
 * the rule acts only when the score reaches {@code BREACH_THRESHOLD}, the direction is not cooling
 * down and the pool is not already on the bound.
 */
public final class BreachRule implements ScalingRule {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ScalingDirection direction;
  private final ScalerConfig config;
  private final ThresholdEvaluator thresholdEvaluator;
  private final BreachAccumulator breachAccumulator;
  private final CooldownGuard cooldownGuard;
  private final StepSizer stepSizer;

  private BreachRule(ScalingDirection direction, ScalerConfig config) {
    this.direction = direction;
    this.config = Preconditions.checkNotNull(config, "Scaler config cannot be null.");
    this.thresholdEvaluator = new ThresholdEvaluator(config);
    this.breachAccumulator = new BreachAccumulator(config);
    this.cooldownGuard = new CooldownGuard(config);
    this.stepSizer = new StepSizer(config);
  }

  public static BreachRule scaleUp(ScalerConfig config) {
    return new BreachRule(ScalingDirection.UP, config);
  }

  public static BreachRule scaleDown(ScalerConfig config) {
    return new BreachRule(ScalingDirection.DOWN, config);
  }

  @Override
  public Optional<ScalingDecision> apply(
      ScalingObservation observation, ScalingState state, Instant now) {
    int demand = observation.demand();
    int current = observation.currentInstanceCount();
    if (!thresholdEvaluator.isBreached(direction, demand, current)) {
      return Optional.empty();
    }

    breachAccumulator.recordBreach(state, direction, now);
    double score = breachAccumulator.score(state, direction, now);
    logger.atInfo().log(
        "Scale-%s condition met (demand %d %s %.1f), breach score: %.2f/%s",
        direction.label(),
        demand,
        direction == ScalingDirection.UP ? ">" : "<",
        thresholdEvaluator.limit(direction, current),
        score,
        config.breachThreshold());

    if (score < config.breachThreshold()) {
      return Optional.of(ScalingDecision.none(current));
    }

    if (cooldownGuard.isCooldownActive(state, direction, now)) {
      Duration remaining = cooldownGuard.remaining(state, direction, now);
      logger.atInfo().log(
          "Scale-%s blocked by cooldown (%ds remaining)",
          direction.label(), (long) Math.ceil(remaining.toMillis() / 1000d));
      return Optional.of(ScalingDecision.none(current));
    }

    int target = stepSizer.targetInstanceCount(direction, demand, current);
    boolean moves = direction == ScalingDirection.UP ? target > current : target < current;
    if (!moves) {
      logger.atInfo().log(
          "Already at %s (%d)",
          direction == ScalingDirection.UP ? "MAX_INSTANCES" : "MIN_INSTANCES",
          direction == ScalingDirection.UP ? config.maxInstances() : config.minInstances());
      return Optional.of(ScalingDecision.none(current));
    }
    return Optional.of(ScalingDecision.of(direction, target));
  }
}
