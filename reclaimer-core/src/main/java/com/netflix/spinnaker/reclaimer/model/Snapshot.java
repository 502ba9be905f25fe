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

package com.netflix.spinnaker.reclaimer.model;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public class Snapshot implements Resource {
  private final String id;
  private String volumeId;
  private Instant createdAt;
  private String ownerId;
  private String description;
  private Integer volumeSizeGib;
  private Map<String, String> tags = new HashMap<>();

  public Snapshot(String id) {
    this.id = id;
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public String getResourceType() {
    return ResourceTypes.SNAPSHOT;
  }

  /**
   * The volume this snapshot was taken from. It may no longer exist.
   */

  public String getVolumeId() {
    return volumeId;
  }

  public Snapshot withVolumeId(String volumeId) {
    this.volumeId = volumeId;
    return this;
  }

  @Override
  public Instant getCreatedAt() {
    return createdAt;
  }

  public Snapshot withCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
    return this;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public Snapshot withOwnerId(String ownerId) {
    this.ownerId = ownerId;
    return this;
  }

  public String getDescription() {
    return description;
  }

  public Snapshot withDescription(String description) {
    this.description = description;
    return this;
  }

  public Integer getVolumeSizeGib() {
    return volumeSizeGib;
  }

  public Snapshot withVolumeSizeGib(Integer volumeSizeGib) {
    this.volumeSizeGib = volumeSizeGib;
    return this;
  }

  @Override
  public Map<String, String> getTags() {
    return Collections.unmodifiableMap(tags);
  }

  public Snapshot withTag(String key, String value) {
    this.tags.put(key, value);
    return this;
  }

  @Override
  public String toString() {
    return "Snapshot{id=" + id + ", volumeId=" + volumeId + ", createdAt=" + createdAt + "}";
  }
}
