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

/** Result of a completed scaling tick. Failed ticks surface as exceptions instead. */
public enum ScalingStatus {
  /** The new instance count was applied and read back. */
  SCALED,
  /** The policy decided not to act. */
  UNCHANGED,
  /** The update was sent but a different count was read back, e.g. after a racing write. */
  CONFLICT
}
