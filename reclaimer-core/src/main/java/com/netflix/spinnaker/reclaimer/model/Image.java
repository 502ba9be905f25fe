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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A machine image, reduced to the snapshots its block device mappings depend on
 */

public class Image {
  private final String id;
  private String name;
  private Set<String> snapshotIds = new LinkedHashSet<>();

  public Image(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public Image withName(String name) {
    this.name = name;
    return this;
  }

  public Set<String> getSnapshotIds() {
    return Collections.unmodifiableSet(snapshotIds);
  }

  public Image withSnapshotId(String snapshotId) {
    if (snapshotId != null) {
      this.snapshotIds.add(snapshotId);
    }

    return this;
  }

  @Override
  public String toString() {
    return "Image{id=" + id + ", snapshotIds=" + snapshotIds + "}";
  }
}
