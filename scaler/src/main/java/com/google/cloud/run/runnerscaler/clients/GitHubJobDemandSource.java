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
import com.google.cloud.run.runnerscaler.clients.GitHubClientWrapper.WorkflowJob;
import com.google.cloud.run.runnerscaler.clients.GitHubClientWrapper.WorkflowRun;
import com.google.cloud.run.runnerscaler.engine.ScalingObservation.RunnerCounts;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;

/**
 * Counts GitHub Actions jobs that need a self-hosted runner.
 *
 * <p>Demand is queued jobs targeting self-hosted runners plus in-progress jobs already running on
 * our runners. In-progress jobs are included because they occupy capacity that must not be scaled
 * away.
 */
public class GitHubJobDemandSource implements DemandSource {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String SELF_HOSTED_LABEL = "self-hosted";
  private static final String QUEUED = "queued";
  private static final String IN_PROGRESS = "in_progress";
  private static final String ONLINE = "online";

  private final GitHubClientWrapper gitHubClientWrapper;
  private final RunnerNameFilter runnerNameFilter;

  public GitHubJobDemandSource(
      GitHubClientWrapper gitHubClientWrapper, RunnerNameFilter runnerNameFilter) {
    this.gitHubClientWrapper =
        Preconditions.checkNotNull(gitHubClientWrapper, "GitHub client cannot be null.");
    this.runnerNameFilter =
        Preconditions.checkNotNull(runnerNameFilter, "Runner name filter cannot be null.");
  }

  @Override
  public JobDemand getJobDemand() throws ScalerIoException, InterruptedException {
    ImmutableList.Builder<WorkflowRun> runs = ImmutableList.builder();
    try {
      runs.addAll(gitHubClientWrapper.listWorkflowRuns(QUEUED));
      runs.addAll(gitHubClientWrapper.listWorkflowRuns(IN_PROGRESS));
    } catch (IOException e) {
      throw new ScalerIoException(
          ScalerIoException.Failure.DEMAND_QUERY, "Failed to list workflow runs", e);
    }

    int queued = 0;
    int inProgress = 0;
    for (WorkflowRun run : runs.build()) {
      ImmutableList<WorkflowJob> jobs;
      try {
        jobs = gitHubClientWrapper.listJobs(run);
      } catch (IOException e) {
        logger.atWarning().withCause(e).log("Failed to get jobs for run %d", run.id());
        continue;
      }
      for (WorkflowJob job : jobs) {
        if (QUEUED.equals(job.status()) && job.labels().contains(SELF_HOSTED_LABEL)) {
          queued++;
        } else if (IN_PROGRESS.equals(job.status()) && runnerNameFilter.matches(job.runnerName())) {
          inProgress++;
        }
      }
    }

    JobDemand demand = new JobDemand(queued, inProgress);
    logger.atInfo().log(
        "Job demand: %d (queued=%d, in_progress=%d)", demand.total(), queued, inProgress);
    return demand;
  }

  @Override
  public RunnerCounts getRunnerCounts() throws ScalerIoException, InterruptedException {
    ImmutableList<Runner> runners;
    try {
      runners = gitHubClientWrapper.listRunners();
    } catch (IOException e) {
      throw new ScalerIoException(
          ScalerIoException.Failure.DEMAND_QUERY, "Failed to list runners", e);
    }

    int online = 0;
    int idle = 0;
    for (Runner runner : runners) {
      if (!runnerNameFilter.matches(runner.name()) || !ONLINE.equals(runner.status())) {
        continue;
      }
      online++;
      if (!runner.busy()) {
        idle++;
      }
    }
    logger.atInfo().log("Runners: online=%d, idle=%d", online, idle);
    return new RunnerCounts(online, idle);
  }
}
