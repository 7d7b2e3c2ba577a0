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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.google.cloud.run.runnerscaler.clients.GitHubClientWrapper.Runner;
import com.google.cloud.run.runnerscaler.clients.GitHubClientWrapper.WorkflowJob;
import com.google.cloud.run.runnerscaler.clients.GitHubClientWrapper.WorkflowRun;
import com.google.cloud.run.runnerscaler.engine.ScalingObservation.RunnerCounts;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class GitHubJobDemandSourceTest {

  private static final WorkflowRun QUEUED_RUN = new WorkflowRun(1, Optional.of("acme/app"));
  private static final WorkflowRun RUNNING_RUN = new WorkflowRun(2, Optional.of("acme/app"));

  private GitHubClientWrapper gitHubClientWrapper;
  private GitHubJobDemandSource demandSource;

  @Before
  public void setUp() throws Exception {
    gitHubClientWrapper = mock(GitHubClientWrapper.class);
    demandSource = new GitHubJobDemandSource(gitHubClientWrapper, new RunnerNameFilter("do-"));

    when(gitHubClientWrapper.listWorkflowRuns("queued")).thenReturn(ImmutableList.of(QUEUED_RUN));
    when(gitHubClientWrapper.listWorkflowRuns("in_progress"))
        .thenReturn(ImmutableList.of(RUNNING_RUN));
  }

  private static WorkflowJob job(String status, String runnerName, String... labels) {
    return new WorkflowJob(status, ImmutableList.copyOf(labels), runnerName);
  }

  @Test
  public void getJobDemand_countsSelfHostedQueuedAndOwnInProgressJobs() throws Exception {
    when(gitHubClientWrapper.listJobs(QUEUED_RUN))
        .thenReturn(
            ImmutableList.of(
                job("queued", null, "self-hosted", "linux"),
                job("queued", null, "ubuntu-latest"),
                job("completed", "do-1", "self-hosted")));
    when(gitHubClientWrapper.listJobs(RUNNING_RUN))
        .thenReturn(
            ImmutableList.of(
                job("in_progress", "do-1", "self-hosted"),
                job("in_progress", "laptop", "self-hosted"),
                job("queued", null, "self-hosted")));

    DemandSource.JobDemand demand = demandSource.getJobDemand();

    assertThat(demand.queued()).isEqualTo(2);
    assertThat(demand.inProgress()).isEqualTo(1);
    assertThat(demand.total()).isEqualTo(3);
  }

  @Test
  public void getJobDemand_jobListingFails_skipsThatRun() throws Exception {
    when(gitHubClientWrapper.listJobs(QUEUED_RUN)).thenThrow(new IOException("error"));
    when(gitHubClientWrapper.listJobs(RUNNING_RUN))
        .thenReturn(ImmutableList.of(job("in_progress", "do-2", "self-hosted")));

    assertThat(demandSource.getJobDemand()).isEqualTo(new DemandSource.JobDemand(0, 1));
  }

  @Test
  public void getJobDemand_runListingFails_throwsDemandQueryFailure() throws Exception {
    when(gitHubClientWrapper.listWorkflowRuns("queued")).thenThrow(new IOException("error"));

    ScalerIoException e = assertThrows(ScalerIoException.class, demandSource::getJobDemand);

    assertThat(e.failure()).isEqualTo(ScalerIoException.Failure.DEMAND_QUERY);
  }

  @Test
  public void getJobDemand_noRuns_returnsZero() throws Exception {
    when(gitHubClientWrapper.listWorkflowRuns("queued")).thenReturn(ImmutableList.of());
    when(gitHubClientWrapper.listWorkflowRuns("in_progress")).thenReturn(ImmutableList.of());

    assertThat(demandSource.getJobDemand().total()).isEqualTo(0);
  }

  @Test
  public void getRunnerCounts_countsOwnOnlineRunners() throws Exception {
    when(gitHubClientWrapper.listRunners())
        .thenReturn(
            ImmutableList.of(
                new Runner(1, "do-1", "online", true),
                new Runner(2, "do-2", "online", false),
                new Runner(3, "do-3", "offline", false),
                new Runner(4, "laptop", "online", false)));

    assertThat(demandSource.getRunnerCounts()).isEqualTo(new RunnerCounts(2, 1));
  }

  @Test
  public void getRunnerCounts_listingFails_throwsDemandQueryFailure() throws Exception {
    when(gitHubClientWrapper.listRunners()).thenThrow(new IOException("error"));

    ScalerIoException e = assertThrows(ScalerIoException.class, demandSource::getRunnerCounts);

    assertThat(e.failure()).isEqualTo(ScalerIoException.Failure.DEMAND_QUERY);
  }
}
