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
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.time.Instant;
import java.util.Optional;

/**
 * A scaling policy made of rules evaluated in a fixed priority order.
 *
 * <p>The first rule that applies decides the tick, so at most one action is returned. When no rule
 * applies the pool is stable and nothing is recorded.
 */
public final class RuleChainPolicy implements ScalingPolicy {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final String name;
  private final ImmutableList<ScalingRule> rules;
  private final boolean usesRunnerCounts;

  public RuleChainPolicy(String name, ImmutableList<ScalingRule> rules, boolean usesRunnerCounts) {
    this.name = Preconditions.checkNotNull(name, "Policy name cannot be null.");
    this.rules = Preconditions.checkNotNull(rules, "Rules cannot be null.");
    this.usesRunnerCounts = usesRunnerCounts;
  }

  @Override
  public ScalingDecision evaluate(ScalingObservation observation, ScalingState state, Instant now) {
    Preconditions.checkNotNull(observation, "Observation cannot be null.");
    Preconditions.checkNotNull(state, "Scaling state cannot be null.");
    Preconditions.checkNotNull(now, "Evaluation time cannot be null.");

    for (ScalingRule rule : rules) {
      Optional<ScalingDecision> decision = rule.apply(observation, state, now);
      if (decision.isPresent()) {
        return decision.get();
      }
    }
    logger.atFine().log("Demand stable (no scaling thresholds met)");
    return ScalingDecision.none(observation.currentInstanceCount());
  }

  @Override
  public boolean usesRunnerCounts() {
    return usesRunnerCounts;
  }

  @Override
  public String toString() {
    return name;
  }
}
