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

import com.netflix.spinnaker.reclaimer.model.Attachment;
import com.netflix.spinnaker.reclaimer.model.Image;
import com.netflix.spinnaker.reclaimer.model.Snapshot;
import com.netflix.spinnaker.reclaimer.model.Volume;
import com.netflix.spinnaker.reclaimer.provider.InventoryException;
import com.netflix.spinnaker.reclaimer.provider.InventoryProvider;
import com.netflix.spinnaker.reclaimer.provider.Page;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.BlockDeviceMapping;
import software.amazon.awssdk.services.ec2.model.DescribeImagesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeImagesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeSnapshotsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSnapshotsResponse;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeVolumesResponse;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.VolumeAttachment;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Lists the region's EBS volumes, and the snapshots and images of the configured owner, one page
 * per call.
 */

public class Ec2InventoryProvider implements InventoryProvider {
  private static final Logger LOGGER = LoggerFactory.getLogger(Ec2InventoryProvider.class);

  private final Ec2Client ec2Client;
  private final String owner;
  private final Integer pageSize;

  public Ec2InventoryProvider(Ec2Client ec2Client, String owner, Integer pageSize) {
    this.ec2Client = ec2Client;
    this.owner = owner;
    this.pageSize = pageSize;
  }

  @Override
  public Page<Volume> listVolumes(String nextToken) {
    DescribeVolumesResponse response = call("volumes", () -> ec2Client.describeVolumes(
      DescribeVolumesRequest.builder()
        .maxResults(pageSize)
        .nextToken(nextToken)
        .build()
    ));

    LOGGER.debug("Listed {} volumes", response.volumes().size());
    return Page.of(
      response.volumes().stream().map(Ec2InventoryProvider::toVolume).collect(Collectors.toList()),
      response.nextToken()
    );
  }

  @Override
  public Page<Snapshot> listSnapshots(String nextToken) {
    DescribeSnapshotsResponse response = call("snapshots", () -> ec2Client.describeSnapshots(
      DescribeSnapshotsRequest.builder()
        .ownerIds(owner)
        .maxResults(pageSize)
        .nextToken(nextToken)
        .build()
    ));

    LOGGER.debug("Listed {} snapshots", response.snapshots().size());
    return Page.of(
      response.snapshots().stream().map(Ec2InventoryProvider::toSnapshot).collect(Collectors.toList()),
      response.nextToken()
    );
  }

  /**
   * Disabled images are still registered and keep their snapshots, so they are listed too
   */

  @Override
  public Page<Image> listImages(String nextToken) {
    DescribeImagesResponse response = call("images", () -> ec2Client.describeImages(
      DescribeImagesRequest.builder()
        .owners(owner)
        .includeDisabled(true)
        .maxResults(pageSize)
        .nextToken(nextToken)
        .build()
    ));

    LOGGER.debug("Listed {} images", response.images().size());
    return Page.of(
      response.images().stream().map(Ec2InventoryProvider::toImage).collect(Collectors.toList()),
      response.nextToken()
    );
  }

  private static <T> T call(String listing, Supplier<T> request) {
    try {
      return request.get();
    } catch (AwsServiceException e) {
      throw new InventoryException(
        String.format("Failed to list %s: %s", listing, Ec2Errors.describe(e)), e, Ec2Errors.isThrottled(e)
      );
    } catch (SdkException e) {
      throw new InventoryException(String.format("Failed to list %s: %s", listing, e.getMessage()), e);
    }
  }

  static Volume toVolume(software.amazon.awssdk.services.ec2.model.Volume ec2Volume) {
    Volume volume = new Volume(ec2Volume.volumeId())
      .withState(ec2Volume.stateAsString())
      .withCreatedAt(ec2Volume.createTime())
      .withSizeGib(ec2Volume.size());

    for (VolumeAttachment attachment : ec2Volume.attachments()) {
      volume.withAttachment(
        new Attachment(attachment.instanceId())
          .withDevice(attachment.device())
          .withState(attachment.stateAsString())
      );
    }

    for (Tag tag : ec2Volume.tags()) {
      volume.withTag(tag.key(), tag.value());
    }

    return volume;
  }

  static Snapshot toSnapshot(software.amazon.awssdk.services.ec2.model.Snapshot ec2Snapshot) {
    Snapshot snapshot = new Snapshot(ec2Snapshot.snapshotId())
      .withVolumeId(ec2Snapshot.volumeId())
      .withCreatedAt(ec2Snapshot.startTime())
      .withOwnerId(ec2Snapshot.ownerId())
      .withDescription(ec2Snapshot.description())
      .withVolumeSizeGib(ec2Snapshot.volumeSize());

    for (Tag tag : ec2Snapshot.tags()) {
      snapshot.withTag(tag.key(), tag.value());
    }

    return snapshot;
  }

  static Image toImage(software.amazon.awssdk.services.ec2.model.Image ec2Image) {
    Image image = new Image(ec2Image.imageId()).withName(ec2Image.name());
    List<BlockDeviceMapping> mappings = ec2Image.blockDeviceMappings();
    for (BlockDeviceMapping mapping : mappings) {
      // instance store and no-device mappings carry no ebs block
      if (mapping.ebs() != null) {
        image.withSnapshotId(mapping.ebs().snapshotId());
      }
    }

    return image;
  }
}
