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
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.Optional;

/**
 * Cooldown timestamps and breach history for one worker pool.
 *
 * <p>Owned by a single control loop and never shared between worker pools. State starts empty and
 * lives for the lifetime of the process.
 */
public final class ScalingState {

  /** A tick on which demand crossed a threshold. */
  public record Breach(Instant timestamp, ScalingDirection direction) {}

  // Oldest first.
  private final Deque<Breach> breachHistory = new ArrayDeque<>();
  private Instant lastScaleUpTime;
  private Instant lastScaleDownTime;

  /** Returns when the pool was last scaled in the given direction, or empty if never. */
  public Optional<Instant> lastScaleTime(ScalingDirection direction) {
    return Optional.ofNullable(
        direction == ScalingDirection.UP ? lastScaleUpTime : lastScaleDownTime);
  }

  /**
   * Records that a scaling action in the given direction was applied and verified.
   *
   * <p>Starts the direction's cooldown and forgets the breaches that justified the action. Breaches
   * in the opposite direction are kept so a quick reversal is still detected.
   */
  public void markScaleEvent(ScalingDirection direction, Instant now) {
    Preconditions.checkNotNull(now, "Scale event time cannot be null.");
    if (direction == ScalingDirection.UP) {
      lastScaleUpTime = now;
    } else {
      lastScaleDownTime = now;
    }
    clearBreaches(direction);
  }

  /** Returns a snapshot of the breach history, oldest first. */
  public ImmutableList<Breach> breachHistory() {
    return ImmutableList.copyOf(breachHistory);
  }

  void recordBreach(ScalingDirection direction, Instant now) {
    breachHistory.addLast(new Breach(now, direction));
  }

  /** Drops every breach recorded at or before {@code cutoff}. Returns how many were dropped. */
  int pruneBreachesUpTo(Instant cutoff) {
    int before = breachHistory.size();
    breachHistory.removeIf(breach -> !breach.timestamp().isAfter(cutoff));
    return before - breachHistory.size();
  }

  void clearBreaches(ScalingDirection direction) {
    breachHistory.removeIf(breach -> breach.direction() == direction);
  }

  Collection<Breach> breaches() {
    return Collections.unmodifiableCollection(breachHistory);
  }
}
