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
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Scales a worker component of a DigitalOcean App Platform app.
 *
 * <p>The App Platform API has no per-component scaling call, so writes replace the whole app spec
 * with a copy in which only the worker's {@code instance_count} differs.
 */
public class DigitalOceanAppClient implements CapacityClient {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @VisibleForTesting static final String DEFAULT_API_URL = "https://api.digitalocean.com/v2";

  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
  private static final int DEFAULT_INSTANCE_COUNT = 1;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String apiUrl;
  private final String token;
  private final String appId;
  private final String workerName;

  public DigitalOceanAppClient(String token, String appId, String workerName) {
    this(
        HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(),
        new ObjectMapper(),
        DEFAULT_API_URL,
        token,
        appId,
        workerName);
  }

  public DigitalOceanAppClient(
      HttpClient httpClient,
      ObjectMapper objectMapper,
      String apiUrl,
      String token,
      String appId,
      String workerName) {
    this.httpClient = Preconditions.checkNotNull(httpClient, "HTTP client cannot be null.");
    this.objectMapper = Preconditions.checkNotNull(objectMapper, "Object mapper cannot be null.");
    this.apiUrl = Preconditions.checkNotNull(apiUrl, "API URL cannot be null.");
    this.token = Preconditions.checkNotNull(token, "DigitalOcean token cannot be null.");
    this.appId = Preconditions.checkNotNull(appId, "App ID cannot be null.");
    this.workerName = Preconditions.checkNotNull(workerName, "Worker name cannot be null.");
  }

  @Override
  public String workerName() {
    return workerName;
  }

  @Override
  public int getInstanceCount() throws ScalerIoException, InterruptedException {
    JsonNode spec = fetchSpec(ScalerIoException.Failure.CAPACITY_QUERY);
    ObjectNode worker =
        findWorker(spec)
            .orElseThrow(
                () ->
                    new ScalerIoException(
                        ScalerIoException.Failure.CAPACITY_QUERY,
                        String.format("Worker '%s' not found in app spec", workerName)));
    int count = worker.path("instance_count").asInt(DEFAULT_INSTANCE_COUNT);
    logger.atInfo().log("Current %s instances: %d", workerName, count);
    return count;
  }

  @Override
  public void setInstanceCount(int instances) throws ScalerIoException, InterruptedException {
    JsonNode spec = fetchSpec(ScalerIoException.Failure.CAPACITY_APPLY);
    ObjectNode updatedSpec =
        withInstanceCount(spec, instances)
            .orElseThrow(
                () ->
                    new ScalerIoException(
                        ScalerIoException.Failure.CAPACITY_APPLY,
                        String.format("Worker '%s' not found", workerName)));

    ObjectNode body = objectMapper.createObjectNode();
    body.set("spec", updatedSpec);
    try {
      HttpRequest request =
          requestBuilder()
              .header("Content-Type", "application/json")
              .PUT(
                  HttpRequest.BodyPublishers.ofString(
                      objectMapper.writeValueAsString(body), StandardCharsets.UTF_8))
              .build();
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      checkSuccess(request, response);
    } catch (IOException e) {
      throw new ScalerIoException(
          ScalerIoException.Failure.CAPACITY_APPLY,
          String.format("Failed to update app %s", appId),
          e);
    }
  }

  /**
   * Returns a copy of {@code spec} with this worker's instance count replaced, or empty if the spec
   * has no worker of that name.
   */
  @VisibleForTesting
  Optional<ObjectNode> withInstanceCount(JsonNode spec, int instances) {
    ObjectNode copy = spec.deepCopy();
    Optional<ObjectNode> worker = findWorker(copy);
    if (worker.isEmpty()) {
      return Optional.empty();
    }
    worker.get().put("instance_count", instances);
    return Optional.of(copy);
  }

  private Optional<ObjectNode> findWorker(JsonNode spec) {
    for (JsonNode worker : spec.path("workers")) {
      if (worker.isObject() && workerName.equals(worker.path("name").asText())) {
        return Optional.of((ObjectNode) worker);
      }
    }
    return Optional.empty();
  }

  private JsonNode fetchSpec(ScalerIoException.Failure failure)
      throws ScalerIoException, InterruptedException {
    try {
      HttpRequest request = requestBuilder().GET().build();
      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
      checkSuccess(request, response);
      JsonNode spec = objectMapper.readTree(response.body()).path("app").path("spec");
      if (!spec.isObject()) {
        throw new IOException(String.format("App %s has no spec", appId));
      }
      return spec;
    } catch (IOException e) {
      throw new ScalerIoException(failure, String.format("Failed to get app %s", appId), e);
    }
  }

  private static void checkSuccess(HttpRequest request, HttpResponse<String> response)
      throws IOException {
    if (response.statusCode() / 100 != 2) {
      throw new IOException(
          String.format(
              "%s %s returned HTTP %d", request.method(), request.uri(), response.statusCode()));
    }
  }

  private HttpRequest.Builder requestBuilder() {
    return HttpRequest.newBuilder(URI.create(apiUrl + "/apps/" + appId))
        .timeout(REQUEST_TIMEOUT)
        .header("Authorization", "Bearer " + token);
  }
}
