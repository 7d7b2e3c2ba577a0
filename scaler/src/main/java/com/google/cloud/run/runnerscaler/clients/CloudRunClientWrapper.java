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

import com.google.api.gax.longrunning.OperationFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.cloud.run.v2.GetWorkerPoolRequest;
import com.google.cloud.run.v2.UpdateWorkerPoolRequest;
import com.google.cloud.run.v2.WorkerPool;
import com.google.cloud.run.v2.WorkerPoolName;
import com.google.cloud.run.v2.WorkerPoolScaling;
import com.google.cloud.run.v2.WorkerPoolsClient;
import com.google.common.base.Preconditions;
import com.google.common.flogger.FluentLogger;
import com.google.protobuf.FieldMask;
import java.io.IOException;
import java.util.concurrent.ExecutionException;

/** Thin wrapper around the Cloud Run Admin API for a single manually scaled worker pool. */
public class CloudRunClientWrapper implements CapacityClient {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final String MANUAL_INSTANCE_COUNT_PATH = "scaling.manual_instance_count";

  private final WorkerPoolsClient workerPoolsClient;
  private final String workerPoolName;
  private final String projectId;
  private final String region;

  public CloudRunClientWrapper(String workerPoolName, String projectId, String region)
      throws IOException {
    this(WorkerPoolsClient.create(), workerPoolName, projectId, region);
  }

  public CloudRunClientWrapper(
      WorkerPoolsClient workerPoolsClient, String workerPoolName, String projectId, String region) {
    this.workerPoolsClient =
        Preconditions.checkNotNull(workerPoolsClient, "Worker pools client cannot be null.");
    this.workerPoolName = Preconditions.checkNotNull(workerPoolName, "Worker pool cannot be null.");
    this.projectId = Preconditions.checkNotNull(projectId, "Project ID cannot be null.");
    this.region = Preconditions.checkNotNull(region, "Region cannot be null.");
  }

  @Override
  public String workerName() {
    return workerPoolName;
  }

  /**
   * Returns the manual instance count of the worker pool.
   *
   * <p>Cloud Run Admin API omits scaling when it was never set. In this case, translate the missing
   * value to 0.
   */
  @Override
  public int getInstanceCount() throws ScalerIoException {
    WorkerPool workerPool;
    try {
      workerPool = getWorkerPool();
    } catch (ApiException e) {
      throw new ScalerIoException(
          ScalerIoException.Failure.CAPACITY_QUERY,
          String.format("Failed to get worker pool %s", workerPoolName),
          e);
    }
    int count = workerPool.hasScaling() ? workerPool.getScaling().getManualInstanceCount() : 0;
    logger.atInfo().log("Current %s instances: %d", workerPoolName, count);
    return count;
  }

  /**
   * Updates the manual instance count and waits for the update operation to complete.
   *
   * @throws ScalerIoException If the read or the update operation fails.
   * @throws InterruptedException If interrupted while waiting for the operation.
   */
  @Override
  public void setInstanceCount(int instances) throws ScalerIoException, InterruptedException {
    try {
      WorkerPool currentWorkerPool = getWorkerPool();

      WorkerPoolScaling newScaling =
          currentWorkerPool.getScaling().toBuilder().setManualInstanceCount(instances).build();
      WorkerPool workerPoolToUpdate = currentWorkerPool.toBuilder().setScaling(newScaling).build();

      FieldMask updateMask = FieldMask.newBuilder().addPaths(MANUAL_INSTANCE_COUNT_PATH).build();

      UpdateWorkerPoolRequest updateRequest =
          UpdateWorkerPoolRequest.newBuilder()
              .setWorkerPool(workerPoolToUpdate)
              .setUpdateMask(updateMask)
              .build();

      OperationFuture<WorkerPool, WorkerPool> operation =
          workerPoolsClient.updateWorkerPoolAsync(updateRequest);
      operation.get(); // Wait for completion
    } catch (ApiException | ExecutionException e) {
      throw new ScalerIoException(
          ScalerIoException.Failure.CAPACITY_APPLY,
          String.format("Failed to update worker pool %s", workerPoolName),
          e);
    }
  }

  private WorkerPool getWorkerPool() {
    WorkerPoolName name = WorkerPoolName.of(projectId, region, workerPoolName);
    GetWorkerPoolRequest request =
        GetWorkerPoolRequest.newBuilder().setName(name.toString()).build();
    return workerPoolsClient.getWorkerPool(request);
  }
}
