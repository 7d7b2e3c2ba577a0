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

import java.util.Optional;

/**
 * The outcome of a single evaluation tick.
 *
 * @param action Whether to scale up, scale down or leave the worker pool alone.
 * @param targetInstanceCount The instance count to apply. Equal to the current count when the
 *     action is {@link Action#NONE}.
 */
public record ScalingDecision(Action action, int targetInstanceCount) {

  /** The action returned by a scaling policy. */
  public enum Action {
    UP,
    DOWN,
    NONE
  }

  public static ScalingDecision up(int targetInstanceCount) {
    return new ScalingDecision(Action.UP, targetInstanceCount);
  }

  public static ScalingDecision down(int targetInstanceCount) {
    return new ScalingDecision(Action.DOWN, targetInstanceCount);
  }

  public static ScalingDecision none(int currentInstanceCount) {
    return new ScalingDecision(Action.NONE, currentInstanceCount);
  }

  static ScalingDecision of(ScalingDirection direction, int targetInstanceCount) {
    return direction == ScalingDirection.UP
        ? up(targetInstanceCount)
        : down(targetInstanceCount);
  }

  public boolean isScaling() {
    return action != Action.NONE;
  }

  /** Returns the direction of the action, or empty for {@link Action#NONE}. */
  public Optional<ScalingDirection> direction() {
    switch (action) {
      case UP:
        return Optional.of(ScalingDirection.UP);
      case DOWN:
        return Optional.of(ScalingDirection.DOWN);
      default:
        return Optional.empty();
    }
  }
}
