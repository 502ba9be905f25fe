/*
 * Copyright 2017 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.spinnaker.reclaimer.aws.provider;

import com.netflix.spinnaker.reclaimer.provider.DeleteResult;
import com.netflix.spinnaker.reclaimer.provider.MutationProvider;
import com.netflix.spinnaker.reclaimer.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DeleteSnapshotRequest;
import software.amazon.awssdk.services.ec2.model.DeleteVolumeRequest;

public class Ec2MutationProvider implements MutationProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(Ec2MutationProvider.class);

  private final Ec2Client ec2Client;

  public Ec2MutationProvider(Ec2Client ec2Client) {
    this.ec2Client = ec2Client;
  }

  @Override
  public DeleteResult deleteVolume(String volumeId) {
    return delete(volumeId, () -> ec2Client.deleteVolume(DeleteVolumeRequest.builder().volumeId(volumeId).build()));
  }

  @Override
  public DeleteResult deleteSnapshot(String snapshotId) {
    return delete(snapshotId, () -> ec2Client.deleteSnapshot(DeleteSnapshotRequest.builder().snapshotId(snapshotId).build()));
  }

  /**
   * Maps the EC2 outcome of a delete call.
   * Error codes the engine knows how to report become a {@link DeleteResult}; anything else is a
   * {@link ProviderException}.
   */

  private DeleteResult delete(String id, Runnable request) {
    try {
      request.run();
      LOGGER.debug("Deleted {}", id);
      return DeleteResult.deleted();
    } catch (AwsServiceException e) {
      String code = Ec2Errors.errorCode(e);
      String message = Ec2Errors.describe(e);
      if (Ec2Errors.NOT_FOUND.contains(code)) {
        return DeleteResult.notFound(message);
      }

      if (Ec2Errors.IN_USE.contains(code)) {
        return DeleteResult.inUse(message);
      }

      if (Ec2Errors.PERMISSION_DENIED.contains(code)) {
        return DeleteResult.permissionDenied(message);
      }

      throw new ProviderException(String.format("Failed to delete %s: %s", id, message), e);
    } catch (SdkException e) {
      throw new ProviderException(String.format("Failed to delete %s: %s", id, e.getMessage()), e);
    }
  }
}
