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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.google.cloud.run.runnerscaler.clients.ScalerIoException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Runs the scaler on a single thread, one tick at a time, with a fixed delay between ticks.
 *
 * <p>A failed tick is logged and skipped; the loop keeps running. Stopping waits for an in-flight
 * tick so a capacity update is never abandoned halfway.
 */
public final class ScalingLoop {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Duration SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(30);

  private final Scaler scaler;
  private final Duration pollInterval;
  private final ScheduledExecutorService executorService;

  public ScalingLoop(Scaler scaler, Duration pollInterval) {
    this(
        scaler,
        pollInterval,
        Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("scaling-loop-%d").build()));
  }

  @VisibleForTesting
  ScalingLoop(Scaler scaler, Duration pollInterval, ScheduledExecutorService executorService) {
    this.scaler = Preconditions.checkNotNull(scaler, "Scaler cannot be null.");
    this.pollInterval = Preconditions.checkNotNull(pollInterval, "Poll interval cannot be null.");
    Preconditions.checkArgument(
        !pollInterval.isNegative() && !pollInterval.isZero(), "Poll interval must be > 0");
    this.executorService =
        Preconditions.checkNotNull(executorService, "Executor service cannot be null.");
  }

  /** Schedules the first tick immediately and every following tick one poll interval later. */
  public void start() {
    executorService.scheduleWithFixedDelay(
        () -> {
          var unused = runTick();
        },
        0,
        pollInterval.toMillis(),
        MILLISECONDS);
    logger.atInfo().log("Scaling loop started, polling every %s", pollInterval);
  }

  /**
   * Runs a single tick and absorbs its failure so the schedule is not cancelled.
   *
   * @return The tick's status, or empty if the tick failed.
   */
  @VisibleForTesting
  Optional<ScalingStatus> runTick() {
    try {
      return Optional.of(scaler.scale());
    } catch (ScalerIoException e) {
      logger.atWarning().withCause(e).log(
          "%s failed, skipping tick: %s", e.failure(), e.getMessage());
    } catch (InterruptedException e) {
      logger.atWarning().log("Scaling tick interrupted");
      Thread.currentThread().interrupt();
    } catch (RuntimeException e) {
      logger.atSevere().withCause(e).log("Unexpected error during scaling tick");
    }
    return Optional.empty();
  }

  public boolean isRunning() {
    return !executorService.isShutdown();
  }

  /** Cancels future ticks and waits for the in-flight tick, if any, to finish. */
  public void stop() throws InterruptedException {
    executorService.shutdown();
    if (executorService.awaitTermination(SHUTDOWN_GRACE_PERIOD.toMillis(), MILLISECONDS)) {
      logger.atInfo().log("Scaling loop stopped gracefully.");
    } else {
      logger.atWarning().log(
          "Scaling loop did not stop gracefully after %s, interrupting.", SHUTDOWN_GRACE_PERIOD);
      executorService.shutdownNow();
    }
  }
}
