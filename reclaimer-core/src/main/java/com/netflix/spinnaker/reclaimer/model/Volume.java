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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class Volume implements Resource {
  public static final String STATE_AVAILABLE = "available";
  public static final String STATE_IN_USE = "in-use";

  private final String id;
  private String state;
  private Instant createdAt;
  private Integer sizeGib;
  private List<Attachment> attachments = new ArrayList<>();
  private Map<String, String> tags = new HashMap<>();

  public Volume(String id) {
    this.id = id;
  }

  @Override
  public String getId() {
    return id;
  }

  @Override
  public String getResourceType() {
    return ResourceTypes.VOLUME;
  }

  public String getState() {
    return state;
  }

  public Volume withState(String state) {
    this.state = state;
    return this;
  }

  @Override
  public Instant getCreatedAt() {
    return createdAt;
  }

  public Volume withCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
    return this;
  }

  public Integer getSizeGib() {
    return sizeGib;
  }

  public Volume withSizeGib(Integer sizeGib) {
    this.sizeGib = sizeGib;
    return this;
  }

  public List<Attachment> getAttachments() {
    return Collections.unmodifiableList(attachments);
  }

  public Volume withAttachment(Attachment attachment) {
    this.attachments.add(attachment);
    return this;
  }

  @Override
  public Map<String, String> getTags() {
    return Collections.unmodifiableMap(tags);
  }

  public Volume withTag(String key, String value) {
    this.tags.put(key, value);
    return this;
  }

  /**
   * A volume is detached only when the provider reports it {@code available} and lists no attachment
   * @return true if nothing is using this volume
   */

  public boolean isDetached() {
    return STATE_AVAILABLE.equals(state) && attachments.isEmpty();
  }

  @Override
  public String toString() {
    return "Volume{id=" + id + ", state=" + state + ", createdAt=" + createdAt + ", sizeGib=" + sizeGib
      + ", attachments=" + attachments + "}";
  }
}
