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

/** The direction of a threshold breach or a scaling action. */
public enum ScalingDirection {
  UP("up"),
  DOWN("down");

  private final String label;

  ScalingDirection(String label) {
    this.label = label;
  }

  /** Lower-case name used in log lines, e.g. "Scale-up". */
  public String label() {
    return label;
  }
}
