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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RunnerNameFilterTest {

  @Test
  public void matches_prefix_acceptsOnlyPrefixedNames() {
    RunnerNameFilter filter = new RunnerNameFilter("do-runner-");

    assertThat(filter.matches("do-runner-abc123")).isTrue();
    assertThat(filter.matches("laptop-runner")).isFalse();
  }

  @Test
  public void matches_emptyPrefix_acceptsAnyNamedRunner() {
    RunnerNameFilter filter = new RunnerNameFilter(null);

    assertThat(filter.prefix()).isEmpty();
    assertThat(filter.matches("anything")).isTrue();
  }

  @Test
  public void matches_missingName_isRejected() {
    RunnerNameFilter filter = new RunnerNameFilter("");

    assertThat(filter.matches(null)).isFalse();
    assertThat(filter.matches("")).isFalse();
  }
}
