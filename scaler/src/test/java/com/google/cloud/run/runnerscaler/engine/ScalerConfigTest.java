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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.time.Duration;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScalerConfigTest {

  @Test
  public void build_noOverrides_usesDefaults() {
    ScalerConfig config = ScalerConfig.builder().build();

    assertThat(config.minInstances()).isEqualTo(1);
    assertThat(config.maxInstances()).isEqualTo(5);
    assertThat(config.scaleUpThreshold()).isEqualTo(1.5);
    assertThat(config.scaleDownThreshold()).isEqualTo(0.25);
    assertThat(config.cooldown(ScalingDirection.UP)).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.cooldown(ScalingDirection.DOWN)).isEqualTo(Duration.ofSeconds(180));
    assertThat(config.stabilizationWindow()).isEqualTo(Duration.ofMinutes(3));
    assertThat(config.decayHalfLife()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.breachThreshold()).isEqualTo(2.0);
    assertThat(config.stepMax(ScalingDirection.UP)).isEqualTo(2);
    assertThat(config.stepMax(ScalingDirection.DOWN)).isEqualTo(1);
    assertThat(config.proportion(ScalingDirection.UP)).isEqualTo(0.5);
    assertThat(config.proportion(ScalingDirection.DOWN)).isEqualTo(0.5);
    assertThat(config.runnersPerInstance()).isEqualTo(1);
  }

  @Test
  public void minRunners_isMinimumTimesRunnersPerInstance() {
    ScalerConfig config = ScalerConfig.builder().minInstances(2).runnersPerInstance(4).build();

    assertThat(config.minRunners()).isEqualTo(8);
  }

  @Test
  public void build_minEqualsMax_isAccepted() {
    ScalerConfig config = ScalerConfig.builder().minInstances(3).maxInstances(3).build();

    assertThat(config.minInstances()).isEqualTo(3);
    assertThat(config.maxInstances()).isEqualTo(3);
  }

  @Test
  public void build_zeroMinimum_isAccepted() {
    assertThat(ScalerConfig.builder().minInstances(0).build().minInstances()).isEqualTo(0);
  }

  @Test
  public void build_minAboveMax_throwsIllegalArgumentException() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ScalerConfig.builder().minInstances(6).maxInstances(5).build());

    assertThat(e).hasMessageThat().contains("MIN_INSTANCES (6) > MAX_INSTANCES (5)");
  }

  @Test
  public void build_severalInvalidValues_reportsAllOfThem() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                ScalerConfig.builder()
                    .minInstances(-1)
                    .scaleUpStepMax(0)
                    .scaleDownProportion(1.5)
                    .decayHalfLife(Duration.ZERO)
                    .build());

    assertThat(e).hasMessageThat().startsWith("Invalid scaler configuration: ");
    assertThat(e).hasMessageThat().contains("MIN_INSTANCES must be >= 0");
    assertThat(e).hasMessageThat().contains("SCALE_UP_STEP must be >= 1");
    assertThat(e).hasMessageThat().contains("SCALE_DOWN_PROPORTION must be > 0 and <= 1");
    assertThat(e).hasMessageThat().contains("DECAY_HALF_LIFE_SECONDS must be > 0");
  }

  @Test
  public void build_nonPositiveThresholds_throwsIllegalArgumentException() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ScalerConfig.builder().scaleUpThreshold(0).breachThreshold(-1).build());

    assertThat(e).hasMessageThat().contains("SCALE_UP_THRESHOLD must be > 0");
    assertThat(e).hasMessageThat().contains("BREACH_THRESHOLD must be > 0");
  }

  @Test
  public void build_negativeCooldown_throwsIllegalArgumentException() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ScalerConfig.builder().scaleDownCooldown(Duration.ofSeconds(-1)).build());

    assertThat(e).hasMessageThat().contains("SCALE_DOWN_COOLDOWN must be >= 0");
  }

  @Test
  public void build_zeroWindow_throwsIllegalArgumentException() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> ScalerConfig.builder().stabilizationWindow(Duration.ZERO).build());

    assertThat(e).hasMessageThat().contains("STABILIZATION_WINDOW_SECONDS must be > 0");
  }
}
