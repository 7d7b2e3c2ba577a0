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

import com.google.cloud.run.runnerscaler.clients.GitHubClientWrapper;
import com.google.cloud.run.runnerscaler.engine.ScalerConfig;
import com.google.cloud.run.runnerscaler.engine.ScalingPolicies;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.time.Duration;
import java.util.Locale;

/**
 * Reads the autoscaler configuration from environment variables.
 *
 * <p>Missing required settings raise {@link IllegalStateException}; values that are present but
 * malformed or out of bounds raise {@link IllegalArgumentException}.
 */
public final class ConfigurationProvider {

  /** Source of environment variables. */
  public interface EnvProvider {
    String getEnv(String name);
  }

  /** Reads the real process environment. */
  public static final class SystemEnvProvider implements EnvProvider {
    @Override
    public String getEnv(String name) {
      return System.getenv(name);
    }
  }

  /** Where the worker pool replica count lives. */
  public enum CapacityProvider {
    DIGITALOCEAN,
    CLOUDRUN
  }

  /**
   * Settings of the control loop around the engine.
   *
   * @param pollInterval Delay between the end of one tick and the start of the next.
   * @param scalingPolicy Name of the scaling policy, see {@link ScalingPolicies#forName}.
   * @param healthPort Port of the gRPC health service.
   */
  public record LoopConfig(Duration pollInterval, String scalingPolicy, int healthPort) {}

  /**
   * Settings of the GitHub demand source.
   *
   * @param token GitHub token with access to the runs and runners of the scope.
   * @param scope The organization or repository to watch.
   * @param runnerNamePrefix Prefix of the runners this pool hosts. Empty matches every runner.
   */
  public record GitHubConfig(
      String token, GitHubClientWrapper.Scope scope, String runnerNamePrefix) {}

  /**
   * Settings of the capacity client. Only the fields of the selected provider are set.
   *
   * @param provider The selected provider.
   * @param workerName Name of the DigitalOcean worker component or Cloud Run worker pool.
   * @param digitalOceanToken DigitalOcean API token.
   * @param appId DigitalOcean App Platform app ID.
   * @param cloudRunProject Google Cloud project of the worker pool.
   * @param cloudRunRegion Region of the worker pool.
   */
  public record CapacityConfig(
      CapacityProvider provider,
      String workerName,
      String digitalOceanToken,
      String appId,
      String cloudRunProject,
      String cloudRunRegion) {}

  private static final int DEFAULT_HEALTH_PORT = 50051;

  private final EnvProvider envProvider;

  public ConfigurationProvider(EnvProvider envProvider) {
    this.envProvider = Preconditions.checkNotNull(envProvider, "Env provider cannot be null.");
  }

  /**
   * Returns the validated engine configuration.
   *
   * @throws IllegalArgumentException if a value is not a number or violates a bound.
   */
  public ScalerConfig scalerConfig() {
    return ScalerConfig.builder()
        .minInstances(intValue("MIN_INSTANCES", 1))
        .maxInstances(intValue("MAX_INSTANCES", 5))
        .scaleUpCooldown(Duration.ofSeconds(intValue("SCALE_UP_COOLDOWN", 60)))
        .scaleDownCooldown(Duration.ofSeconds(intValue("SCALE_DOWN_COOLDOWN", 180)))
        .scaleUpThreshold(doubleValue("SCALE_UP_THRESHOLD", 1.5))
        .scaleDownThreshold(doubleValue("SCALE_DOWN_THRESHOLD", 0.25))
        .scaleUpStepMax(intValue("SCALE_UP_STEP", 2))
        .scaleDownStepMax(intValue("SCALE_DOWN_STEP", 1))
        .scaleUpProportion(doubleValue("SCALE_UP_PROPORTION", 0.5))
        .scaleDownProportion(doubleValue("SCALE_DOWN_PROPORTION", 0.5))
        .stabilizationWindow(stabilizationWindow())
        .decayHalfLife(secondsValue("DECAY_HALF_LIFE_SECONDS", 30))
        .breachThreshold(doubleValue("BREACH_THRESHOLD", 2.0))
        .runnersPerInstance(intValue("RUNNERS_PER_INSTANCE", 1))
        .build();
  }

  public LoopConfig loopConfig() {
    String pollIntervalName =
        isSet("POLL_INTERVAL_SECONDS") ? "POLL_INTERVAL_SECONDS" : "POLL_INTERVAL";
    int pollIntervalSeconds = intValue(pollIntervalName, 60);
    Preconditions.checkArgument(pollIntervalSeconds > 0, "%s must be > 0", pollIntervalName);

    String scalingPolicy = stringValue("SCALING_POLICY", ScalingPolicies.BREACH_SCORE);
    int healthPort = intValue("HEALTH_PORT", DEFAULT_HEALTH_PORT);
    Preconditions.checkArgument(
        healthPort > 0 && healthPort <= 65535, "HEALTH_PORT must be in [1, 65535]");

    return new LoopConfig(Duration.ofSeconds(pollIntervalSeconds), scalingPolicy, healthPort);
  }

  /**
   * Returns the GitHub settings.
   *
   * @throws IllegalStateException if the token, or both ORG and OWNER/REPO, are missing.
   */
  public GitHubConfig gitHubConfig() {
    String token = requiredValue("GITHUB_TOKEN");
    GitHubClientWrapper.Scope scope;
    if (isSet("ORG")) {
      scope = GitHubClientWrapper.Scope.organization(envProvider.getEnv("ORG"));
    } else if (isSet("OWNER") && isSet("REPO")) {
      scope =
          GitHubClientWrapper.Scope.repository(
              envProvider.getEnv("OWNER"), envProvider.getEnv("REPO"));
    } else {
      throw new IllegalStateException("ORG or (OWNER and REPO) must be set");
    }
    return new GitHubConfig(token, scope, stringValue("RUNNER_NAME_PREFIX", ""));
  }

  /**
   * Returns the capacity client settings for the provider named by CAPACITY_PROVIDER.
   *
   * @throws IllegalArgumentException if the provider is unknown.
   * @throws IllegalStateException if a setting required by the provider is missing.
   */
  public CapacityConfig capacityConfig() {
    String providerName = stringValue("CAPACITY_PROVIDER", "digitalocean");
    CapacityProvider provider;
    try {
      provider = CapacityProvider.valueOf(providerName.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          String.format(
              "Unknown CAPACITY_PROVIDER '%s'. Expected 'digitalocean' or 'cloudrun'.",
              providerName),
          e);
    }

    String workerName = stringValue("WORKER_NAME", "runner");
    if (provider == CapacityProvider.DIGITALOCEAN) {
      return new CapacityConfig(
          provider, workerName, requiredValue("DO_API_TOKEN"), requiredValue("APP_ID"), null, null);
    }
    return new CapacityConfig(
        provider,
        workerName,
        null,
        null,
        requiredValue("CLOUD_RUN_PROJECT"),
        requiredValue("CLOUD_RUN_REGION"));
  }

  private Duration stabilizationWindow() {
    if (isSet("STABILIZATION_WINDOW_SECONDS")) {
      return secondsValue("STABILIZATION_WINDOW_SECONDS", 180);
    }
    return Duration.ofMinutes(intValue("STABILIZATION_WINDOW_MINUTES", 3));
  }

  private boolean isSet(String name) {
    return !Strings.isNullOrEmpty(envProvider.getEnv(name));
  }

  private String stringValue(String name, String defaultValue) {
    String value = envProvider.getEnv(name);
    return value == null ? defaultValue : value;
  }

  private String requiredValue(String name) {
    String value = envProvider.getEnv(name);
    if (Strings.isNullOrEmpty(value)) {
      throw new IllegalStateException(name + " is required");
    }
    return value;
  }

  private int intValue(String name, int defaultValue) {
    if (!isSet(name)) {
      return defaultValue;
    }
    String value = envProvider.getEnv(name).trim();
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be an integer, got '%s'", name, value), e);
    }
  }

  private double doubleValue(String name, double defaultValue) {
    if (!isSet(name)) {
      return defaultValue;
    }
    String value = envProvider.getEnv(name).trim();
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("%s must be a number, got '%s'", name, value), e);
    }
  }

  /** Reads a possibly fractional number of seconds. */
  private Duration secondsValue(String name, double defaultSeconds) {
    double seconds = doubleValue(name, defaultSeconds);
    Preconditions.checkArgument(
        Double.isFinite(seconds), "%s must be a finite number of seconds", name);
    return Duration.ofNanos(Math.round(seconds * 1_000_000_000d));
  }
}
