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

/**
 * Turns raw threshold breaches into a time-decayed confidence score.
 *
 * <p>Each breach recorded in the stabilization window contributes {@code 0.5 ^ (age / halfLife)}
 * to the score of its direction: 1.0 when fresh, 0.5 after one half-life. A single breach never
 * reaches a breach threshold above 1.0 on its own, while a sustained condition does within a few
 * ticks.
 */
public final class BreachAccumulator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final double NANOS_PER_SECOND = 1_000_000_000d;

  private final Duration stabilizationWindow;
  private final double halfLifeSeconds;

  public BreachAccumulator(ScalerConfig config) {
    Preconditions.checkNotNull(config, "Scaler config cannot be null.");
    this.stabilizationWindow = config.stabilizationWindow();
    this.halfLifeSeconds = seconds(config.decayHalfLife());
  }

  public void recordBreach(ScalingState state, ScalingDirection direction, Instant now) {
    state.recordBreach(direction, now);
  }

  /**
   * Returns the decayed breach score for {@code direction} at {@code now}.
   *
   * <p>Always prunes breaches of both directions that fell out of the stabilization window first,
   * so history never grows past one window of ticks.
   */
  public double score(ScalingState state, ScalingDirection direction, Instant now) {
    int pruned = state.pruneBreachesUpTo(now.minus(stabilizationWindow));
    if (pruned > 0) {
      logger.atFine().log("Pruned %d breach(es) older than %s", pruned, stabilizationWindow);
    }

    double score = 0;
    for (ScalingState.Breach breach : state.breaches()) {
      if (breach.direction() == direction) {
        score += weight(Duration.between(breach.timestamp(), now));
      }
    }
    return score;
  }

  /** The contribution of a single breach of the given age. */
  double weight(Duration age) {
    double ageSeconds = Math.max(0, seconds(age));
    return Math.pow(0.5, ageSeconds / halfLifeSeconds);
  }

  private static double seconds(Duration duration) {
    return duration.toNanos() / NANOS_PER_SECOND;
  }
}
