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

import static java.util.concurrent.TimeUnit.SECONDS;

import com.google.cloud.run.runnerscaler.clients.CapacityClient;
import com.google.cloud.run.runnerscaler.clients.CloudRunClientWrapper;
import com.google.cloud.run.runnerscaler.clients.DigitalOceanAppClient;
import com.google.cloud.run.runnerscaler.clients.GitHubClientWrapper;
import com.google.cloud.run.runnerscaler.clients.GitHubJobDemandSource;
import com.google.cloud.run.runnerscaler.clients.RunnerJanitor;
import com.google.cloud.run.runnerscaler.clients.RunnerNameFilter;
import com.google.cloud.run.runnerscaler.engine.ScalerConfig;
import com.google.cloud.run.runnerscaler.engine.ScalingPolicies;
import com.google.cloud.run.runnerscaler.engine.ScalingPolicy;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.protobuf.services.HealthStatusManager;
import java.io.IOException;
import java.time.Clock;

/** Runs the scaling loop and reports its health over the standard gRPC health service. */
public class ScalerServer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  @VisibleForTesting static final String SERVICE_NAME = "runner-autoscaler";

  private Server server;
  private final int port;
  private final HealthStatusManager health;
  private final ScalingLoop scalingLoop;

  @VisibleForTesting
  ScalerServer(int port, ScalingLoop scalingLoop) {
    this.port = port;
    this.health = new HealthStatusManager();
    this.scalingLoop = scalingLoop;
  }

  /**
   * Builds the server and its collaborators from the configuration.
   *
   * @throws IllegalArgumentException If a setting is malformed or out of bounds.
   * @throws IllegalStateException If a required setting is missing.
   * @throws IOException If the Cloud Run client cannot be created.
   */
  public static ScalerServer create(ConfigurationProvider configuration) throws IOException {
    ScalerConfig scalerConfig = configuration.scalerConfig();
    ConfigurationProvider.LoopConfig loopConfig = configuration.loopConfig();
    ConfigurationProvider.GitHubConfig gitHubConfig = configuration.gitHubConfig();
    ConfigurationProvider.CapacityConfig capacityConfig = configuration.capacityConfig();
    ScalingPolicy scalingPolicy = ScalingPolicies.forName(loopConfig.scalingPolicy(), scalerConfig);

    logStartupConfiguration(scalerConfig, loopConfig, gitHubConfig, capacityConfig, scalingPolicy);

    GitHubClientWrapper gitHubClientWrapper =
        new GitHubClientWrapper(gitHubConfig.token(), gitHubConfig.scope());
    RunnerNameFilter runnerNameFilter = new RunnerNameFilter(gitHubConfig.runnerNamePrefix());

    Scaler scaler =
        new Scaler(
            new GitHubJobDemandSource(gitHubClientWrapper, runnerNameFilter),
            createCapacityClient(capacityConfig),
            new RunnerJanitor(gitHubClientWrapper, runnerNameFilter),
            scalingPolicy,
            scalerConfig.runnersPerInstance(),
            Clock.systemUTC());
    return new ScalerServer(
        loopConfig.healthPort(), new ScalingLoop(scaler, loopConfig.pollInterval()));
  }

  private static CapacityClient createCapacityClient(
      ConfigurationProvider.CapacityConfig capacityConfig) throws IOException {
    switch (capacityConfig.provider()) {
      case CLOUDRUN:
        return new CloudRunClientWrapper(
            capacityConfig.workerName(),
            capacityConfig.cloudRunProject(),
            capacityConfig.cloudRunRegion());
      case DIGITALOCEAN:
      default:
        return new DigitalOceanAppClient(
            capacityConfig.digitalOceanToken(),
            capacityConfig.appId(),
            capacityConfig.workerName());
    }
  }

  private static void logStartupConfiguration(
      ScalerConfig scalerConfig,
      ConfigurationProvider.LoopConfig loopConfig,
      ConfigurationProvider.GitHubConfig gitHubConfig,
      ConfigurationProvider.CapacityConfig capacityConfig,
      ScalingPolicy scalingPolicy) {
    logger.atInfo().log("Starting GitHub Actions Runner Autoscaler");
    logger.atInfo().log(
        "  Worker: %s (%s)", capacityConfig.workerName(), capacityConfig.provider());
    logger.atInfo().log(
        "  GitHub scope: %s",
        gitHubConfig.scope().isOrganization()
            ? gitHubConfig.scope().organization()
            : gitHubConfig.scope().owner() + "/" + gitHubConfig.scope().repository());
    logger.atInfo().log("  Scaling policy: %s", scalingPolicy);
    logger.atInfo().log("  Poll interval: %s", loopConfig.pollInterval());
    logger.atInfo().log("  Runners per instance: %d", scalerConfig.runnersPerInstance());
    logger.atInfo().log(
        "  Runner name prefix: '%s' (empty=all self-hosted)", gitHubConfig.runnerNamePrefix());
    logger.atInfo().log("  Engine: %s", scalerConfig);
  }

  @VisibleForTesting
  void start() throws IOException {
    server =
        ServerBuilder.forPort(port).addService(health.getHealthService()).build().start();
    logger.atInfo().log("ScalerServer started, health service listening on %d", server.getPort());

    scalingLoop.start();
    health.setStatus(SERVICE_NAME, ServingStatus.SERVING);
    health.setStatus("", ServingStatus.SERVING);

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread() {
              @Override
              public void run() {
                // Use stderr here since the logger may have been reset by its JVM shutdown hook.
                System.err.println("[SCALER] Shutting down since JVM is shutting down");
                try {
                  ScalerServer.this.stop();
                } catch (InterruptedException e) {
                  e.printStackTrace(System.err);
                }
                System.err.println("[SCALER] Server shut down");
              }
            });
  }

  @VisibleForTesting
  void stop() throws InterruptedException {
    health.setStatus(SERVICE_NAME, ServingStatus.NOT_SERVING);
    health.setStatus("", ServingStatus.NOT_SERVING);
    logger.atInfo().log("[SCALER] Stopping scaling loop...");
    scalingLoop.stop();

    if (server != null) {
      server.shutdown();
      if (server.awaitTermination(30, SECONDS)) {
        logger.atInfo().log("[SCALER] Health server stopped gracefully.");
      } else {
        logger.atWarning().log("[SCALER] Health server did not stop gracefully after 30 seconds.");
        server.shutdownNow();
      }
    }
  }

  /** Returns the port the health service is bound to. */
  @VisibleForTesting
  int boundPort() {
    return server.getPort();
  }

  /** Await termination on the main thread since the grpc library uses daemon threads. */
  private void blockUntilShutdown() throws InterruptedException {
    if (server != null) {
      server.awaitTermination();
    }
  }

  public static void main(String[] args) throws IOException, InterruptedException {
    System.out.println("[SCALER] Starting runner autoscaler");
    ScalerServer server;
    try {
      server =
          create(new ConfigurationProvider(new ConfigurationProvider.SystemEnvProvider()));
    } catch (IllegalArgumentException | IllegalStateException e) {
      logger.atSevere().withCause(e).log("Config error: %s", e.getMessage());
      System.exit(1);
      return;
    }
    server.start();
    server.blockUntilShutdown();
  }
}
