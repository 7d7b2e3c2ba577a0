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
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.google.common.collect.ImmutableMap;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.health.v1.HealthGrpc;
import java.util.concurrent.TimeUnit;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ScalerServerTest {

  @Test
  public void create_validConfiguration_returnsServer() throws Exception {
    ConfigurationProvider configuration =
        new ConfigurationProvider(
            ImmutableMap.of(
                    "GITHUB_TOKEN", "token",
                    "ORG", "acme",
                    "DO_API_TOKEN", "do-token",
                    "APP_ID", "app-123",
                    "SCALING_POLICY", "ephemeral")
                ::get);

    assertThat(ScalerServer.create(configuration)).isNotNull();
  }

  @Test
  public void create_unknownPolicy_throwsIllegalArgumentException() {
    ConfigurationProvider configuration =
        new ConfigurationProvider(
            ImmutableMap.of(
                    "GITHUB_TOKEN", "token",
                    "ORG", "acme",
                    "DO_API_TOKEN", "do-token",
                    "APP_ID", "app-123",
                    "SCALING_POLICY", "fastest")
                ::get);

    assertThrows(IllegalArgumentException.class, () -> ScalerServer.create(configuration));
  }

  @Test
  public void create_missingToken_throwsIllegalStateException() {
    ConfigurationProvider configuration =
        new ConfigurationProvider(ImmutableMap.of("ORG", "acme")::get);

    assertThrows(IllegalStateException.class, () -> ScalerServer.create(configuration));
  }

  @Test
  public void startAndStop_reportsHealthAndDrivesLoop() throws Exception {
    ScalingLoop scalingLoop = mock(ScalingLoop.class);
    ScalerServer server = new ScalerServer(0, scalingLoop);
    server.start();
    ManagedChannel channel =
        ManagedChannelBuilder.forAddress("localhost", server.boundPort()).usePlaintext().build();
    try {
      ServingStatus status =
          HealthGrpc.newBlockingStub(channel)
              .check(
                  HealthCheckRequest.newBuilder().setService(ScalerServer.SERVICE_NAME).build())
              .getStatus();

      assertThat(status).isEqualTo(ServingStatus.SERVING);
      verify(scalingLoop).start();
    } finally {
      channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
      server.stop();
    }
    verify(scalingLoop).stop();
  }
}
