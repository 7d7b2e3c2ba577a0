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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ThresholdEvaluatorTest {

  private static final ScalerConfig CONFIG =
      ScalerConfig.builder().scaleUpThreshold(1.5).scaleDownThreshold(0.25).build();

  private final ThresholdEvaluator thresholdEvaluator = new ThresholdEvaluator(CONFIG);

  @Test
  public void shouldScaleUp_demandAboveThreshold_returnsTrue() {
    // 4 > 2 * 1.5
    assertThat(thresholdEvaluator.shouldScaleUp(/* demand= */ 4, /* currentInstanceCount= */ 2))
        .isTrue();
  }

  @Test
  public void shouldScaleUp_demandExactlyOnThreshold_returnsFalse() {
    // 3 == 2 * 1.5 is stable.
    assertThat(thresholdEvaluator.shouldScaleUp(/* demand= */ 3, /* currentInstanceCount= */ 2))
        .isFalse();
  }

  @Test
  public void shouldScaleDown_demandBelowThreshold_returnsTrue() {
    // 0 < 4 * 0.25
    assertThat(thresholdEvaluator.shouldScaleDown(/* demand= */ 0, /* currentInstanceCount= */ 4))
        .isTrue();
  }

  @Test
  public void shouldScaleDown_demandExactlyOnThreshold_returnsFalse() {
    // 1 == 4 * 0.25 is stable.
    assertThat(thresholdEvaluator.shouldScaleDown(/* demand= */ 1, /* currentInstanceCount= */ 4))
        .isFalse();
  }

  @Test
  public void shouldScaleDown_zeroThreshold_neverBreaches() {
    ThresholdEvaluator evaluator =
        new ThresholdEvaluator(ScalerConfig.builder().scaleDownThreshold(0).build());

    assertThat(evaluator.shouldScaleDown(/* demand= */ 0, /* currentInstanceCount= */ 5)).isFalse();
  }

  @Test
  public void shouldScaleUp_zeroInstances_anyDemandBreaches() {
    assertThat(thresholdEvaluator.shouldScaleUp(/* demand= */ 1, /* currentInstanceCount= */ 0))
        .isTrue();
    assertThat(thresholdEvaluator.shouldScaleUp(/* demand= */ 0, /* currentInstanceCount= */ 0))
        .isFalse();
  }

  @Test
  public void isBreached_matchesDirectionSpecificChecks() {
    assertThat(thresholdEvaluator.isBreached(ScalingDirection.UP, 10, 2)).isTrue();
    assertThat(thresholdEvaluator.isBreached(ScalingDirection.DOWN, 10, 2)).isFalse();
    assertThat(thresholdEvaluator.isBreached(ScalingDirection.DOWN, 0, 8)).isTrue();
  }

  @Test
  public void limit_returnsCapacityTimesRatio() {
    assertThat(thresholdEvaluator.limit(ScalingDirection.UP, 4)).isEqualTo(6.0);
    assertThat(thresholdEvaluator.limit(ScalingDirection.DOWN, 4)).isEqualTo(1.0);
  }
}
