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

import static com.google.common.truth.Truth.assertThat;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.cloud.run.runnerscaler.clients.ScalerIoException;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScalingLoopTest {

  private Scaler scaler;
  private ScheduledExecutorService executorService;
  private ScalingLoop scalingLoop;

  @Before
  public void setUp() {
    scaler = mock(Scaler.class);
    executorService = mock(ScheduledExecutorService.class);
    scalingLoop = new ScalingLoop(scaler, Duration.ofSeconds(15), executorService);
  }

  @After
  public void tearDown() {
    // Clears the interrupt flag set by the interrupted tick test.
    var unused = Thread.interrupted();
  }

  @Test
  public void start_schedulesFirstTickImmediatelyWithFixedDelay() {
    scalingLoop.start();

    verify(executorService)
        .scheduleWithFixedDelay(any(Runnable.class), eq(0L), eq(15_000L), eq(MILLISECONDS));
  }

  @Test
  public void runTick_successfulTick_returnsStatus() throws Exception {
    when(scaler.scale()).thenReturn(ScalingStatus.SCALED);

    assertThat(scalingLoop.runTick()).hasValue(ScalingStatus.SCALED);
  }

  @Test
  public void runTick_ioFailure_isAbsorbed() throws Exception {
    when(scaler.scale())
        .thenThrow(
            new ScalerIoException(ScalerIoException.Failure.CAPACITY_QUERY, "test exception"));

    assertThat(scalingLoop.runTick()).isEmpty();
  }

  @Test
  public void runTick_unexpectedFailure_isAbsorbed() throws Exception {
    when(scaler.scale()).thenThrow(new IllegalStateException("test exception"));

    assertThat(scalingLoop.runTick()).isEmpty();
  }

  @Test
  public void runTick_interrupted_restoresInterruptFlag() throws Exception {
    when(scaler.scale()).thenThrow(new InterruptedException("test interrupt"));

    assertThat(scalingLoop.runTick()).isEmpty();
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  public void runTick_failedTick_nextTickStillRuns() throws Exception {
    when(scaler.scale())
        .thenThrow(new ScalerIoException(ScalerIoException.Failure.DEMAND_QUERY, "test exception"))
        .thenReturn(ScalingStatus.UNCHANGED);

    assertThat(scalingLoop.runTick()).isEmpty();
    assertThat(scalingLoop.runTick()).hasValue(ScalingStatus.UNCHANGED);
  }

  @Test
  public void stop_tickFinishesInTime_doesNotInterrupt() throws Exception {
    when(executorService.awaitTermination(anyLong(), any())).thenReturn(true);

    scalingLoop.stop();

    verify(executorService).shutdown();
    verify(executorService, never()).shutdownNow();
  }

  @Test
  public void stop_tickExceedsGracePeriod_interrupts() throws Exception {
    when(executorService.awaitTermination(anyLong(), any())).thenReturn(false);

    scalingLoop.stop();

    verify(executorService).shutdownNow();
  }

  @Test
  public void isRunning_reflectsExecutorState() {
    when(executorService.isShutdown()).thenReturn(false, true);

    assertThat(scalingLoop.isRunning()).isTrue();
    assertThat(scalingLoop.isRunning()).isFalse();
  }
}
