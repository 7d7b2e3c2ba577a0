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

import java.time.Instant;
import java.util.Optional;

/** One link of a {@link RuleChainPolicy}. */
public interface ScalingRule {

  /**
   * Returns the decision for this tick if the rule applies, or empty to defer to the next rule.
   *
   * <p>A rule that applies but decides not to act returns {@link ScalingDecision#none}, which
   * still ends the chain.
   */
  Optional<ScalingDecision> apply(
      ScalingObservation observation, ScalingState state, Instant now);
}
