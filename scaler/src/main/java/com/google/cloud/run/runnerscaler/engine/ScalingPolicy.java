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

/**
 * Decides how a worker pool should be scaled on one tick.
 *
 * <p>Implementations perform no I/O and never fail on a valid observation. They may record
 * breaches in {@code state}, but cooldown bookkeeping is left to the caller through {@link
 * ScalingState#markScaleEvent} once the returned action has actually been applied.
 */
public interface ScalingPolicy {

  ScalingDecision evaluate(ScalingObservation observation, ScalingState state, Instant now);

  /** Whether {@link ScalingObservation#runnerCounts()} should be populated for this policy. */
  default boolean usesRunnerCounts() {
    return false;
  }
}
