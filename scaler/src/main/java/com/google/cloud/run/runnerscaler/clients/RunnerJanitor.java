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

package com.google.cloud.run.runnerscaler.clients;

import com.google.cloud.run.runnerscaler.clients.GitHubClientWrapper.Runner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;

/**
 * Removes registrations of runners that went away without deregistering, e.g. because their
 * instance was scaled down.
 */
public class RunnerJanitor {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String OFFLINE = "offline";

  private final GitHubClientWrapper gitHubClientWrapper;
  private final RunnerNameFilter runnerNameFilter;

  public RunnerJanitor(GitHubClientWrapper gitHubClientWrapper, RunnerNameFilter runnerNameFilter) {
    this.gitHubClientWrapper =
        Preconditions.checkNotNull(gitHubClientWrapper, "GitHub client cannot be null.");
    this.runnerNameFilter =
        Preconditions.checkNotNull(runnerNameFilter, "Runner name filter cannot be null.");
  }

  /**
   * Deletes offline runners that are not busy.
   *
   * <p>Failures are logged and never propagated: a failed cleanup must not block scaling.
   *
   * @return The number of runners deleted.
   */
  public int cleanupDeadRunners() throws InterruptedException {
    ImmutableList<Runner> runners;
    try {
      runners = gitHubClientWrapper.listRunners();
    } catch (IOException e) {
      logger.atSevere().withCause(e).log("Failed to get runners");
      return 0;
    }

    int deleted = 0;
    for (Runner runner : runners) {
      if (!OFFLINE.equals(runner.status())
          || runner.busy()
          || runner.id() == 0
          || !runnerNameFilter.matches(runner.name())) {
        continue;
      }
      logger.atInfo().log("Removing dead runner: %s (ID: %d)", runner.name(), runner.id());
      try {
        if (gitHubClientWrapper.deleteRunner(runner.id())) {
          deleted++;
          logger.atInfo().log("Deleted runner %s", runner.name());
        } else {
          logger.atWarning().log("Failed to delete runner %s", runner.name());
        }
      } catch (IOException e) {
        logger.atSevere().withCause(e).log("Error deleting runner %s", runner.name());
      }
    }

    if (deleted > 0) {
      logger.atInfo().log("Cleaned up %d dead runner(s)", deleted);
    }
    return deleted;
  }
}
