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

package com.google.cloud.run.runnerscaler;

import com.google.cloud.run.runnerscaler.clients.CapacityClient;
import com.google.cloud.run.runnerscaler.clients.DemandSource;
import com.google.cloud.run.runnerscaler.clients.RunnerJanitor;
import com.google.cloud.run.runnerscaler.clients.ScalerIoException;
import com.google.cloud.run.runnerscaler.engine.ScalingDecision;
import com.google.cloud.run.runnerscaler.engine.ScalingDirection;
import com.google.cloud.run.runnerscaler.engine.ScalingObservation;
import com.google.cloud.run.runnerscaler.engine.ScalingPolicy;
import com.google.cloud.run.runnerscaler.engine.ScalingState;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.google.common.math.IntMath;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;

/**
 * Performs one scaling tick for a single worker pool.
 *
 * <p>This class gathers demand and capacity from the collaborators, asks the scaling policy for a
 * decision and applies it. Once the new count has been read back, the scale event is recorded at
 * the tick's evaluation time.
 */
public class Scaler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ScalingState scalingState = new ScalingState();
  private final DemandSource demandSource;
  private final CapacityClient capacityClient;
  private final RunnerJanitor runnerJanitor;
  private final ScalingPolicy scalingPolicy;
  private final int runnersPerInstance;
  private final Clock clock;

  public Scaler(
      DemandSource demandSource,
      CapacityClient capacityClient,
      RunnerJanitor runnerJanitor,
      ScalingPolicy scalingPolicy,
      int runnersPerInstance,
      Clock clock) {
    this.demandSource = Preconditions.checkNotNull(demandSource, "Demand source cannot be null.");
    this.capacityClient =
        Preconditions.checkNotNull(capacityClient, "Capacity client cannot be null.");
    this.runnerJanitor =
        Preconditions.checkNotNull(runnerJanitor, "Runner janitor cannot be null.");
    this.scalingPolicy =
        Preconditions.checkNotNull(scalingPolicy, "Scaling policy cannot be null.");
    Preconditions.checkArgument(
        runnersPerInstance >= 1, "Runners per instance must be >= 1: %s", runnersPerInstance);
    this.runnersPerInstance = runnersPerInstance;
    this.clock = Preconditions.checkNotNull(clock, "Clock cannot be null.");
  }

  /**
   * Runs one tick.
   *
   * @return The outcome of the tick.
   * @throws ScalerIoException If demand or capacity could not be read, or the update failed. The
   *     scaling state is left as it was before the failed step.
   */
  public ScalingStatus scale() throws ScalerIoException, InterruptedException {
    runnerJanitor.cleanupDeadRunners();

    DemandSource.JobDemand jobDemand = demandSource.getJobDemand();
    int currentInstanceCount = capacityClient.getInstanceCount();

    // Runner-count policies see in-progress jobs as busy runners, so only queued jobs are demand.
    ScalingObservation observation =
        scalingPolicy.usesRunnerCounts()
            ? ScalingObservation.of(
                instanceDemand(jobDemand.queued()),
                currentInstanceCount,
                demandSource.getRunnerCounts())
            : ScalingObservation.of(instanceDemand(jobDemand.total()), currentInstanceCount);

    Instant now = clock.instant();
    ScalingDecision decision = scalingPolicy.evaluate(observation, scalingState, now);
    if (!decision.isScaling()) {
      logger.atFine().log(
          "No scaling action (%d instances of %s)",
          currentInstanceCount, capacityClient.workerName());
      return ScalingStatus.UNCHANGED;
    }

    int target = decision.targetInstanceCount();
    logger.atInfo().log(
        "Scaling %s: %d -> %d", capacityClient.workerName(), currentInstanceCount, target);
    capacityClient.setInstanceCount(target);

    int actual = capacityClient.getInstanceCount();
    if (actual != target) {
      logger.atWarning().log(
          "Update conflict for %s: expected %d, got %d. Cooldown not started.",
          capacityClient.workerName(), target, actual);
      return ScalingStatus.CONFLICT;
    }

    ScalingDirection direction = decision.direction().orElseThrow();
    scalingState.markScaleEvent(direction, now);
    logger.atInfo().log("Scaled %s to %d instances", capacityClient.workerName(), target);
    return ScalingStatus.SCALED;
  }

  /** Converts a job count into the number of instances needed to host one runner per job. */
  @VisibleForTesting
  int instanceDemand(int jobDemand) {
    return IntMath.divide(jobDemand, runnersPerInstance, RoundingMode.CEILING);
  }

  @VisibleForTesting
  ScalingState scalingState() {
    return scalingState;
  }
}
