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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/** Thin wrapper around the GitHub Actions REST API. */
public class GitHubClientWrapper {

  @VisibleForTesting static final String DEFAULT_API_URL = "https://api.github.com";

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
  private static final int PAGE_SIZE = 100;

  /**
   * The organization or repository whose runners are scaled.
   *
   * @param organization Organization login, or null for a repository scope.
   * @param owner Repository owner, set together with {@code repository}.
   * @param repository Repository name.
   */
  public record Scope(String organization, String owner, String repository) {
    public static Scope organization(String organization) {
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(organization), "Organization cannot be empty.");
      return new Scope(organization, null, null);
    }

    public static Scope repository(String owner, String repository) {
      Preconditions.checkArgument(
          !Strings.isNullOrEmpty(owner) && !Strings.isNullOrEmpty(repository),
          "Owner and repository cannot be empty.");
      return new Scope(null, owner, repository);
    }

    public boolean isOrganization() {
      return organization != null;
    }

    String apiPath() {
      return isOrganization() ? "orgs/" + organization : "repos/" + owner + "/" + repository;
    }
  }

  /** A workflow run. {@code repositoryFullName} is empty when GitHub did not report it. */
  public record WorkflowRun(long id, Optional<String> repositoryFullName) {}

  /** A job of a workflow run. {@code runnerName} is null until a runner picks the job up. */
  public record WorkflowJob(String status, ImmutableList<String> labels, String runnerName) {}

  /** A self-hosted runner registration. */
  public record Runner(long id, String name, String status, boolean busy) {}

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String apiUrl;
  private final String token;
  private final Scope scope;

  public GitHubClientWrapper(String token, Scope scope) {
    this(
        HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(),
        new ObjectMapper(),
        DEFAULT_API_URL,
        token,
        scope);
  }

  public GitHubClientWrapper(
      HttpClient httpClient, ObjectMapper objectMapper, String apiUrl, String token, Scope scope) {
    this.httpClient = Preconditions.checkNotNull(httpClient, "HTTP client cannot be null.");
    this.objectMapper = Preconditions.checkNotNull(objectMapper, "Object mapper cannot be null.");
    this.apiUrl = Preconditions.checkNotNull(apiUrl, "API URL cannot be null.");
    this.token = Preconditions.checkNotNull(token, "GitHub token cannot be null.");
    this.scope = Preconditions.checkNotNull(scope, "Scope cannot be null.");
  }

  public Scope scope() {
    return scope;
  }

  /**
   * Returns the first page of workflow runs with the given status.
   *
   * @param status A run status such as {@code queued} or {@code in_progress}.
   */
  public ImmutableList<WorkflowRun> listWorkflowRuns(String status)
      throws IOException, InterruptedException {
    JsonNode root =
        get(
            String.format(
                "%s/actions/runs?status=%s&per_page=%d", scope.apiPath(), status, PAGE_SIZE));
    ImmutableList.Builder<WorkflowRun> runs = ImmutableList.builder();
    for (JsonNode run : root.path("workflow_runs")) {
      long id = run.path("id").asLong(0);
      if (id == 0) {
        continue;
      }
      String fullName = run.path("repository").path("full_name").asText("");
      runs.add(new WorkflowRun(id, fullName.isEmpty() ? Optional.empty() : Optional.of(fullName)));
    }
    return runs.build();
  }

  /**
   * Returns the jobs of a workflow run.
   *
   * <p>In an organization scope the repository is taken from the run itself. Runs that do not name
   * their repository have no reachable jobs and yield an empty list.
   */
  public ImmutableList<WorkflowJob> listJobs(WorkflowRun run)
      throws IOException, InterruptedException {
    String repositoryPath;
    if (scope.isOrganization()) {
      if (run.repositoryFullName().isEmpty()) {
        return ImmutableList.of();
      }
      repositoryPath = "repos/" + run.repositoryFullName().get();
    } else {
      repositoryPath = scope.apiPath();
    }

    JsonNode root =
        get(
            String.format(
                "%s/actions/runs/%d/jobs?per_page=%d", repositoryPath, run.id(), PAGE_SIZE));
    ImmutableList.Builder<WorkflowJob> jobs = ImmutableList.builder();
    for (JsonNode job : root.path("jobs")) {
      ImmutableList.Builder<String> labels = ImmutableList.builder();
      for (JsonNode label : job.path("labels")) {
        labels.add(label.asText());
      }
      JsonNode runnerName = job.path("runner_name");
      jobs.add(
          new WorkflowJob(
              job.path("status").asText(""),
              labels.build(),
              runnerName.isTextual() ? runnerName.asText() : null));
    }
    return jobs.build();
  }

  /** Returns the first page of self-hosted runners registered in the scope. */
  public ImmutableList<Runner> listRunners() throws IOException, InterruptedException {
    JsonNode root =
        get(String.format("%s/actions/runners?per_page=%d", scope.apiPath(), PAGE_SIZE));
    ImmutableList.Builder<Runner> runners = ImmutableList.builder();
    for (JsonNode runner : root.path("runners")) {
      runners.add(
          new Runner(
              runner.path("id").asLong(0),
              runner.path("name").asText("unknown"),
              runner.path("status").asText(""),
              runner.path("busy").asBoolean(false)));
    }
    return runners.build();
  }

  /**
   * Removes a runner registration.
   *
   * @return true if GitHub confirmed the deletion with 204 No Content.
   */
  public boolean deleteRunner(long runnerId) throws IOException, InterruptedException {
    HttpRequest request =
        requestBuilder(String.format("%s/actions/runners/%d", scope.apiPath(), runnerId))
            .DELETE()
            .build();
    HttpResponse<String> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    return response.statusCode() == 204;
  }

  private JsonNode get(String path) throws IOException, InterruptedException {
    HttpRequest request = requestBuilder(path).GET().build();
    HttpResponse<String> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    if (response.statusCode() / 100 != 2) {
      throw new IOException(
          String.format("GET %s returned HTTP %d", request.uri(), response.statusCode()));
    }
    return objectMapper.readTree(response.body());
  }

  private HttpRequest.Builder requestBuilder(String path) {
    return HttpRequest.newBuilder(URI.create(apiUrl + "/" + path))
        .timeout(REQUEST_TIMEOUT)
        .header("Authorization", "token " + token)
        .header("Accept", "application/vnd.github.v3+json");
  }
}
