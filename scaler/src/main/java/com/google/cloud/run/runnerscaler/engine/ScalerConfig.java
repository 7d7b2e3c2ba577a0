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

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.time.Duration;

/**
 * Immutable configuration of the scaling decision engine.
 *
 * <p>Instances can only be obtained from {@link Builder#build()}, which rejects any value outside
 * its documented bounds. Every component of the engine receives the same validated instance.
 */
public final class ScalerConfig {

  private final int minInstances;
  private final int maxInstances;
  private final double scaleUpThreshold;
  private final double scaleDownThreshold;
  private final Duration scaleUpCooldown;
  private final Duration scaleDownCooldown;
  private final Duration stabilizationWindow;
  private final Duration decayHalfLife;
  private final double breachThreshold;
  private final int scaleUpStepMax;
  private final int scaleDownStepMax;
  private final double scaleUpProportion;
  private final double scaleDownProportion;
  private final int runnersPerInstance;

  private ScalerConfig(Builder builder) {
    this.minInstances = builder.minInstances;
    this.maxInstances = builder.maxInstances;
    this.scaleUpThreshold = builder.scaleUpThreshold;
    this.scaleDownThreshold = builder.scaleDownThreshold;
    this.scaleUpCooldown = builder.scaleUpCooldown;
    this.scaleDownCooldown = builder.scaleDownCooldown;
    this.stabilizationWindow = builder.stabilizationWindow;
    this.decayHalfLife = builder.decayHalfLife;
    this.breachThreshold = builder.breachThreshold;
    this.scaleUpStepMax = builder.scaleUpStepMax;
    this.scaleDownStepMax = builder.scaleDownStepMax;
    this.scaleUpProportion = builder.scaleUpProportion;
    this.scaleDownProportion = builder.scaleDownProportion;
    this.runnersPerInstance = builder.runnersPerInstance;
  }

  public static Builder builder() {
    return new Builder();
  }

  public int minInstances() {
    return minInstances;
  }

  public int maxInstances() {
    return maxInstances;
  }

  public double scaleUpThreshold() {
    return scaleUpThreshold;
  }

  public double scaleDownThreshold() {
    return scaleDownThreshold;
  }

  public Duration stabilizationWindow() {
    return stabilizationWindow;
  }

  public Duration decayHalfLife() {
    return decayHalfLife;
  }

  public double breachThreshold() {
    return breachThreshold;
  }

  public Duration cooldown(ScalingDirection direction) {
    return direction == ScalingDirection.UP ? scaleUpCooldown : scaleDownCooldown;
  }

  public int stepMax(ScalingDirection direction) {
    return direction == ScalingDirection.UP ? scaleUpStepMax : scaleDownStepMax;
  }

  public double proportion(ScalingDirection direction) {
    return direction == ScalingDirection.UP ? scaleUpProportion : scaleDownProportion;
  }

  /** Runner processes hosted by each worker instance. */
  public int runnersPerInstance() {
    return runnersPerInstance;
  }

  /** The number of runners {@code MIN_INSTANCES} instances host. */
  public int minRunners() {
    return minInstances * runnersPerInstance;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("minInstances", minInstances)
        .add("maxInstances", maxInstances)
        .add("scaleUpThreshold", scaleUpThreshold)
        .add("scaleDownThreshold", scaleDownThreshold)
        .add("scaleUpCooldown", scaleUpCooldown)
        .add("scaleDownCooldown", scaleDownCooldown)
        .add("stabilizationWindow", stabilizationWindow)
        .add("decayHalfLife", decayHalfLife)
        .add("breachThreshold", breachThreshold)
        .add("scaleUpStepMax", scaleUpStepMax)
        .add("scaleDownStepMax", scaleDownStepMax)
        .add("scaleUpProportion", scaleUpProportion)
        .add("scaleDownProportion", scaleDownProportion)
        .add("runnersPerInstance", runnersPerInstance)
        .toString();
  }

  /** Builder for {@link ScalerConfig}. Unset values keep the documented defaults. */
  public static final class Builder {
    private int minInstances = 1;
    private int maxInstances = 5;
    private double scaleUpThreshold = 1.5;
    private double scaleDownThreshold = 0.25;
    private Duration scaleUpCooldown = Duration.ofSeconds(60);
    private Duration scaleDownCooldown = Duration.ofSeconds(180);
    private Duration stabilizationWindow = Duration.ofMinutes(3);
    private Duration decayHalfLife = Duration.ofSeconds(30);
    private double breachThreshold = 2.0;
    private int scaleUpStepMax = 2;
    private int scaleDownStepMax = 1;
    private double scaleUpProportion = 0.5;
    private double scaleDownProportion = 0.5;
    private int runnersPerInstance = 1;

    private Builder() {}

    public Builder minInstances(int minInstances) {
      this.minInstances = minInstances;
      return this;
    }

    public Builder maxInstances(int maxInstances) {
      this.maxInstances = maxInstances;
      return this;
    }

    public Builder scaleUpThreshold(double scaleUpThreshold) {
      this.scaleUpThreshold = scaleUpThreshold;
      return this;
    }

    public Builder scaleDownThreshold(double scaleDownThreshold) {
      this.scaleDownThreshold = scaleDownThreshold;
      return this;
    }

    public Builder scaleUpCooldown(Duration scaleUpCooldown) {
      this.scaleUpCooldown = scaleUpCooldown;
      return this;
    }

    public Builder scaleDownCooldown(Duration scaleDownCooldown) {
      this.scaleDownCooldown = scaleDownCooldown;
      return this;
    }

    public Builder stabilizationWindow(Duration stabilizationWindow) {
      this.stabilizationWindow = stabilizationWindow;
      return this;
    }

    public Builder decayHalfLife(Duration decayHalfLife) {
      this.decayHalfLife = decayHalfLife;
      return this;
    }

    public Builder breachThreshold(double breachThreshold) {
      this.breachThreshold = breachThreshold;
      return this;
    }

    public Builder scaleUpStepMax(int scaleUpStepMax) {
      this.scaleUpStepMax = scaleUpStepMax;
      return this;
    }

    public Builder scaleDownStepMax(int scaleDownStepMax) {
      this.scaleDownStepMax = scaleDownStepMax;
      return this;
    }

    public Builder scaleUpProportion(double scaleUpProportion) {
      this.scaleUpProportion = scaleUpProportion;
      return this;
    }

    public Builder scaleDownProportion(double scaleDownProportion) {
      this.scaleDownProportion = scaleDownProportion;
      return this;
    }

    public Builder runnersPerInstance(int runnersPerInstance) {
      this.runnersPerInstance = runnersPerInstance;
      return this;
    }

    /**
     * Validates every bound and returns the configuration.
     *
     * @throws IllegalArgumentException listing all violated bounds, not just the first one.
     */
    public ScalerConfig build() {
      ImmutableList<String> errors = validate();
      if (!errors.isEmpty()) {
        throw new IllegalArgumentException(
            "Invalid scaler configuration: " + Joiner.on("; ").join(errors));
      }
      return new ScalerConfig(this);
    }

    private ImmutableList<String> validate() {
      ImmutableList.Builder<String> errors = ImmutableList.builder();
      if (minInstances < 0) {
        errors.add("MIN_INSTANCES must be >= 0");
      }
      if (minInstances > maxInstances) {
        errors.add(
            String.format(
                "MIN_INSTANCES (%d) > MAX_INSTANCES (%d)", minInstances, maxInstances));
      }
      if (!(scaleUpThreshold > 0)) {
        errors.add("SCALE_UP_THRESHOLD must be > 0");
      }
      if (!(scaleDownThreshold >= 0)) {
        errors.add("SCALE_DOWN_THRESHOLD must be >= 0");
      }
      if (scaleUpCooldown == null || scaleUpCooldown.isNegative()) {
        errors.add("SCALE_UP_COOLDOWN must be >= 0");
      }
      if (scaleDownCooldown == null || scaleDownCooldown.isNegative()) {
        errors.add("SCALE_DOWN_COOLDOWN must be >= 0");
      }
      if (!isPositive(stabilizationWindow)) {
        errors.add("STABILIZATION_WINDOW_SECONDS must be > 0");
      }
      if (!isPositive(decayHalfLife)) {
        errors.add("DECAY_HALF_LIFE_SECONDS must be > 0");
      }
      if (!(breachThreshold > 0)) {
        errors.add("BREACH_THRESHOLD must be > 0");
      }
      if (scaleUpStepMax < 1) {
        errors.add("SCALE_UP_STEP must be >= 1");
      }
      if (scaleDownStepMax < 1) {
        errors.add("SCALE_DOWN_STEP must be >= 1");
      }
      if (!(scaleUpProportion > 0 && scaleUpProportion <= 1)) {
        errors.add("SCALE_UP_PROPORTION must be > 0 and <= 1");
      }
      if (!(scaleDownProportion > 0 && scaleDownProportion <= 1)) {
        errors.add("SCALE_DOWN_PROPORTION must be > 0 and <= 1");
      }
      if (runnersPerInstance < 1) {
        errors.add("RUNNERS_PER_INSTANCE must be >= 1");
      }
      return errors.build();
    }

    private static boolean isPositive(Duration duration) {
      return duration != null && !duration.isNegative() && !duration.isZero();
    }
  }
}
