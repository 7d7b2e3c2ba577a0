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

import com.google.common.collect.ImmutableList;
import java.util.Locale;

/** Factories for the supported scaling policies. */
public final class ScalingPolicies {

  public static final String BREACH_SCORE = "breach-score";
  public static final String EPHEMERAL = "ephemeral";

  /**
   * The default policy: scale up on accumulated up-breaches, otherwise scale down on accumulated
   * down-breaches.
   */
  public static ScalingPolicy breachScore(ScalerConfig config) {
    return new RuleChainPolicy(
        BREACH_SCORE,
        ImmutableList.of(BreachRule.scaleUp(config), BreachRule.scaleDown(config)),
        /* usesRunnerCounts= */ false);
  }

  /**
   * Policy for ephemeral runners: keep the minimum of runners online first, then scale up on queued
   * jobs, then remove fully idle instances. No breach history is kept.
   */
  public static ScalingPolicy ephemeral(ScalerConfig config) {
    return new RuleChainPolicy(
        EPHEMERAL,
        ImmutableList.of(
            new MaintainMinimumOnlineRule(config),
            new ScaleUpOnQueuedJobsRule(config),
            new ScaleDownIdleRule(config)),
        /* usesRunnerCounts= */ true);
  }

  /**
   * Returns the policy registered under {@code name}, case-insensitively.
   *
   * @throws IllegalArgumentException if no policy has that name.
   */
  public static ScalingPolicy forName(String name, ScalerConfig config) {
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case BREACH_SCORE:
        return breachScore(config);
      case EPHEMERAL:
        return ephemeral(config);
      default:
        throw new IllegalArgumentException(
            String.format(
                "Unknown SCALING_POLICY '%s'. Expected '%s' or '%s'.",
                name, BREACH_SCORE, EPHEMERAL));
    }
  }

  private ScalingPolicies() {}
}
