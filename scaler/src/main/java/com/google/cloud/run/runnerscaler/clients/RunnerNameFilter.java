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

import com.google.common.base.Strings;

/**
 * Decides whether a runner belongs to the scaled worker pool.
 *
 * @param prefix Runner name prefix. Empty matches every named runner.
 */
public record RunnerNameFilter(String prefix) {

  public RunnerNameFilter {
    prefix = Strings.nullToEmpty(prefix);
  }

  public boolean matches(String runnerName) {
    if (Strings.isNullOrEmpty(runnerName)) {
      return false;
    }
    return runnerName.startsWith(prefix);
  }
}
