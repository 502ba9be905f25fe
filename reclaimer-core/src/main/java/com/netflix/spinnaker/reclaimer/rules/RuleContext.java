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

package com.netflix.spinnaker.reclaimer.rules;

import org.threeten.extra.Days;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;

/**
 * Facts about the current run that rules evaluate resources against.
 * Built once the image reference set is complete and never mutated afterwards.
 */

public class RuleContext {
  private final Instant now;
  private final int retentionDays;
  private final Set<String> imageSnapshotIds;
  private final Set<String> inUseVolumeIds;

  public RuleContext(Instant now, int retentionDays, Set<String> imageSnapshotIds, Set<String> inUseVolumeIds) {
    this.now = now;
    this.retentionDays = retentionDays;
    this.imageSnapshotIds = Collections.unmodifiableSet(imageSnapshotIds);
    this.inUseVolumeIds = Collections.unmodifiableSet(inUseVolumeIds);
  }

  public RuleContext(Instant now, int retentionDays, Set<String> imageSnapshotIds) {
    this(now, retentionDays, imageSnapshotIds, Collections.emptySet());
  }

  /**
   * Copy of this context that also knows which volumes were found attached
   */

  public RuleContext withInUseVolumeIds(Set<String> inUseVolumeIds) {
    return new RuleContext(now, retentionDays, imageSnapshotIds, inUseVolumeIds);
  }

  public Instant getNow() {
    return now;
  }

  public int getRetentionDays() {
    return retentionDays;
  }

  public Set<String> getImageSnapshotIds() {
    return imageSnapshotIds;
  }

  public Set<String> getInUseVolumeIds() {
    return inUseVolumeIds;
  }

  /**
   * Whole days elapsed since {@code createdAt}, rounded down
   */

  public int ageInDays(Instant createdAt) {
    return Days.between(createdAt, now).getAmount();
  }
}
