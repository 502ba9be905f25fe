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

package com.netflix.spinnaker.reclaimer.engine;

import com.netflix.spinnaker.reclaimer.model.Attachment;
import com.netflix.spinnaker.reclaimer.model.Image;
import com.netflix.spinnaker.reclaimer.model.Resource;
import com.netflix.spinnaker.reclaimer.model.Snapshot;
import com.netflix.spinnaker.reclaimer.model.Volume;
import com.netflix.spinnaker.reclaimer.provider.DeleteResult;
import com.netflix.spinnaker.reclaimer.provider.InventoryException;
import com.netflix.spinnaker.reclaimer.provider.ProviderException;
import com.netflix.spinnaker.reclaimer.rules.AttachedVolumeRule;
import com.netflix.spinnaker.reclaimer.rules.BasicRulesEngine;
import com.netflix.spinnaker.reclaimer.rules.ImageReferencedSnapshotRule;
import com.netflix.spinnaker.reclaimer.rules.InUseSourceVolumeRule;
import com.netflix.spinnaker.reclaimer.rules.Result;
import com.netflix.spinnaker.reclaimer.rules.RetentionAgeRule;
import com.netflix.spinnaker.reclaimer.rules.RulesEngine;
import com.netflix.spinnaker.reclaimer.rules.UnknownAgeRule;
import com.netflix.spinnaker.reclaimer.testutil.InMemoryInventory;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReclamationEngineTest {
  private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");
  private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

  @Test
  void reclaimsOnlyDetachedExpiredVolumesAndUnreferencedSnapshots() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-10d", 10))
      .add(availableVolume("vol-3d", 3))
      .add(attachedVolume("vol-30d", 30))
      .add(new Snapshot("snap-referenced").withCreatedAt(daysAgo(20)))
      .add(new Snapshot("snap-unreferenced").withCreatedAt(daysAgo(20)))
      .add(new Image("ami-1").withSnapshotId("snap-referenced"));

    RunReport report = engine(inventory).run(7);

    assertThat(report.getState()).isEqualTo(RunState.DONE);
    assertThat(report.getState().isTerminal()).isTrue();
    assertThat(report.getRetentionDays()).isEqualTo(7);
    assertThat(report.getVolumesInspected()).isEqualTo(3);
    assertThat(report.getVolumesDeleted()).containsExactly("vol-10d");
    assertThat(report.getVolumesSkipped()).containsExactly(
      new RunReport.Skipped("vol-3d", "too-young"),
      new RunReport.Skipped("vol-30d", "in-use")
    );
    assertThat(report.getSnapshotsInspected()).isEqualTo(2);
    assertThat(report.getSnapshotsDeleted()).containsExactly("snap-unreferenced");
    assertThat(report.getSnapshotsSkipped()).containsExactly(
      new RunReport.Skipped("snap-referenced", "referenced-by-image")
    );
    assertThat(report.getFailures()).isEmpty();
    assertThat(inventory.contains("vol-10d")).isFalse();
    assertThat(inventory.contains("snap-referenced")).isTrue();
  }

  @Test
  void followsContinuationTokensAcrossEveryPage() {
    InMemoryInventory inventory = new InMemoryInventory(2);
    for (int i = 1; i <= 5; i++) {
      inventory.add(availableVolume("vol-" + i, 30));
      inventory.add(new Snapshot("snap-" + i).withCreatedAt(daysAgo(30)));
    }

    RunReport report = engine(inventory).run(7);

    assertThat(inventory.listCalls("volumes")).isEqualTo(3);
    assertThat(inventory.listCalls("snapshots")).isEqualTo(3);
    assertThat(report.getVolumesInspected()).isEqualTo(5);
    assertThat(report.getVolumesDeleted()).containsExactly("vol-1", "vol-2", "vol-3", "vol-4", "vol-5");
    assertThat(report.getSnapshotsDeleted()).containsExactly("snap-1", "snap-2", "snap-3", "snap-4", "snap-5");
  }

  @Test
  void imageReferencesOnLaterPagesStillProtectSnapshots() {
    InMemoryInventory inventory = new InMemoryInventory(1)
      .add(new Image("ami-1").withSnapshotId("snap-a"))
      .add(new Image("ami-2"))
      .add(new Image("ami-3").withSnapshotId("snap-c"))
      .add(new Snapshot("snap-a").withCreatedAt(daysAgo(1000)))
      .add(new Snapshot("snap-b").withCreatedAt(daysAgo(1000)))
      .add(new Snapshot("snap-c").withCreatedAt(daysAgo(1000)));

    RunReport report = engine(inventory).run(0);

    assertThat(inventory.listCalls("images")).isEqualTo(3);
    assertThat(report.getSnapshotsDeleted()).containsExactly("snap-b");
    assertThat(report.getSnapshotsSkipped()).extracting(RunReport.Skipped::getReason)
      .containsOnly("referenced-by-image");
    assertThat(inventory.getDeleteCalls()).doesNotContain("snap-a", "snap-c");
  }

  @Test
  void neverDeletesAttachedVolumesRegardlessOfAge() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(attachedVolume("vol-in-use", 400))
      .add(availableVolume("vol-stopped-instance", 400).withAttachment(new Attachment("i-stopped")))
      .add(new Volume("vol-creating").withState("creating").withCreatedAt(daysAgo(400)));

    RunReport report = engine(inventory).run(0);

    assertThat(report.getVolumesDeleted()).isEmpty();
    assertThat(report.getVolumesSkipped()).extracting(RunReport.Skipped::getReason)
      .containsExactly("in-use", "in-use", "in-use");
    assertThat(inventory.getDeleteCalls()).isEmpty();
  }

  @Test
  void retentionBoundaryIsInclusive() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-exactly-7d", 7))
      .add(availableVolume("vol-6d", 6))
      .add(new Volume("vol-almost-7d").withState("available").withCreatedAt(daysAgo(7).plus(Duration.ofHours(1))))
      .add(new Snapshot("snap-exactly-7d").withCreatedAt(daysAgo(7)))
      .add(new Snapshot("snap-6d").withCreatedAt(daysAgo(6)));

    RunReport report = engine(inventory).run(7);

    assertThat(report.getVolumesDeleted()).containsExactly("vol-exactly-7d");
    assertThat(report.getVolumesSkipped()).containsExactly(
      new RunReport.Skipped("vol-6d", "too-young"),
      new RunReport.Skipped("vol-almost-7d", "too-young")
    );
    assertThat(report.getSnapshotsDeleted()).containsExactly("snap-exactly-7d");
    assertThat(report.getSnapshotsSkipped()).containsExactly(new RunReport.Skipped("snap-6d", "too-young"));
  }

  @Test
  void skipsResourcesWithoutCreationTime() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(new Volume("vol-no-date").withState("available"))
      .add(new Snapshot("snap-no-date"));

    RunReport report = engine(inventory).run(0);

    assertThat(report.getVolumesSkipped()).containsExactly(new RunReport.Skipped("vol-no-date", "unknown-age"));
    assertThat(report.getSnapshotsSkipped()).containsExactly(new RunReport.Skipped("snap-no-date", "unknown-age"));
    assertThat(report.getDeletedCount()).isZero();
  }

  @Test
  void keepsSnapshotsOfVolumesThatAreStillAttached() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(attachedVolume("vol-attached", 90))
      .add(availableVolume("vol-detached", 90))
      .add(new Snapshot("snap-of-attached").withVolumeId("vol-attached").withCreatedAt(daysAgo(20)))
      .add(new Snapshot("snap-of-detached").withVolumeId("vol-detached").withCreatedAt(daysAgo(20)))
      .add(new Snapshot("snap-of-missing").withVolumeId("vol-gone").withCreatedAt(daysAgo(20)));

    RunReport report = engine(inventory).run(7);

    assertThat(report.getSnapshotsSkipped())
      .containsExactly(new RunReport.Skipped("snap-of-attached", "source-volume-in-use"));
    assertThat(report.getSnapshotsDeleted()).containsExactly("snap-of-detached", "snap-of-missing");
  }

  @Test
  void continuesPastAFailedDelete() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-1", 10))
      .add(availableVolume("vol-2", 10))
      .add(availableVolume("vol-3", 10))
      .onDelete("vol-2", id -> DeleteResult.permissionDenied("You are not authorized to perform this operation."));

    RunReport report = engine(inventory).run(7);

    assertThat(inventory.getDeleteCalls()).containsExactly("vol-1", "vol-2", "vol-3");
    assertThat(report.getVolumesDeleted()).containsExactly("vol-1", "vol-3");
    assertThat(report.getFailures()).hasSize(1);
    assertThat(report.getFailures().get(0).getId()).isEqualTo("vol-2");
    assertThat(report.getFailures().get(0).getResourceType()).isEqualTo("volume");
    assertThat(report.getFailures().get(0).getError()).startsWith("permission-denied");
    assertThat(report.getState()).isEqualTo(RunState.DONE);
  }

  @Test
  void recordsProviderErrorsAndKeepsGoing() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(new Snapshot("snap-1").withCreatedAt(daysAgo(10)))
      .add(new Snapshot("snap-2").withCreatedAt(daysAgo(10)))
      .add(new Snapshot("snap-3").withCreatedAt(daysAgo(10)))
      .onDelete("snap-1", id -> {
        throw new ProviderException("Connection reset", null);
      })
      .onDelete("snap-2", id -> DeleteResult.inUse("snap-2 is currently in use by ami-9"));

    RunReport report = engine(inventory).run(7);

    assertThat(report.getSnapshotsDeleted()).containsExactly("snap-3");
    assertThat(report.getFailures()).extracting(RunReport.Failure::getId).containsExactly("snap-1", "snap-2");
    assertThat(report.getFailures().get(0).getError()).isEqualTo("Connection reset");
    assertThat(report.getFailures().get(1).getError()).isEqualTo("in-use: snap-2 is currently in use by ami-9");
  }

  @Test
  void treatsAlreadyDeletedResourcesAsReclaimed() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-raced", 10))
      .onDelete("vol-raced", id -> DeleteResult.notFound("The volume 'vol-raced' does not exist."));

    RunReport report = engine(inventory).run(7);

    assertThat(report.getVolumesDeleted()).containsExactly("vol-raced");
    assertThat(report.getFailures()).isEmpty();
  }

  @Test
  void secondRunFindsNothingLeftToDelete() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-old", 10))
      .add(availableVolume("vol-young", 1))
      .add(attachedVolume("vol-attached", 10))
      .add(new Snapshot("snap-old").withCreatedAt(daysAgo(10)))
      .add(new Snapshot("snap-young").withCreatedAt(daysAgo(1)));
    ReclamationEngine engine = engine(inventory);

    RunReport first = engine.run(7);
    RunReport second = engine.run(7);

    assertThat(first.getDeletedCount()).isEqualTo(2);
    assertThat(second.getDeletedCount()).isZero();
    assertThat(second.getFailures()).isEmpty();
    assertThat(second.getVolumesSkipped()).hasSize(2);
    assertThat(second.getSnapshotsSkipped()).hasSize(1);
    assertThat(inventory.getDeleteCalls()).containsExactly("vol-old", "snap-old");
    assertThat(second.getRunId()).isNotEqualTo(first.getRunId());
  }

  @Test
  void deletesVolumesBeforeSnapshots() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(new Snapshot("snap-1").withCreatedAt(daysAgo(10)))
      .add(availableVolume("vol-1", 10))
      .add(new Snapshot("snap-2").withCreatedAt(daysAgo(10)))
      .add(availableVolume("vol-2", 10));

    engine(inventory).run(7);

    assertThat(inventory.getDeleteCalls()).containsExactly("vol-1", "vol-2", "snap-1", "snap-2");
  }

  @Test
  void rejectsNegativeRetentionWithoutTouchingTheProvider() {
    InMemoryInventory inventory = new InMemoryInventory().add(availableVolume("vol-1", 10));
    RecordingListener listener = new RecordingListener();

    RunReport report = engine(inventory, listener).run(-1);

    assertThat(report.getState()).isEqualTo(RunState.ABORTED);
    assertThat(report.getError().getType()).isEqualTo(RunReport.ERROR_CONFIGURATION);
    assertThat(inventory.listCalls("images")).isZero();
    assertThat(inventory.listCalls("volumes")).isZero();
    assertThat(inventory.getDeleteCalls()).isEmpty();
    assertThat(listener.events).containsExactly("started", "completed:ABORTED");
  }

  @Test
  void abortsBeforeScanningWhenImagesCannotBeListed() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-1", 10))
      .failNextListing("images", new InventoryException("AuthFailure: AWS was not able to validate the credentials", null));

    RunReport report = engine(inventory).run(7);

    assertThat(report.getState()).isEqualTo(RunState.ABORTED);
    assertThat(report.getError().getType()).isEqualTo(RunReport.ERROR_ENUMERATION);
    assertThat(report.getError().getMessage()).contains("AuthFailure");
    assertThat(inventory.listCalls("volumes")).isZero();
    assertThat(inventory.getDeleteCalls()).isEmpty();
  }

  @Test
  void deletesNothingWhenSnapshotListingFails() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-1", 10))
      .add(new Snapshot("snap-1").withCreatedAt(daysAgo(10)))
      .failNextListing("snapshots", new InventoryException("Internal error", null));

    RunReport report = engine(inventory).run(7);

    assertThat(report.getState()).isEqualTo(RunState.ABORTED);
    assertThat(report.getVolumesInspected()).isEqualTo(1);
    assertThat(report.getVolumesDeleted()).isEmpty();
    assertThat(inventory.getDeleteCalls()).isEmpty();
    assertThat(inventory.contains("vol-1")).isTrue();
  }

  @Test
  void retriesThrottledListings() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-1", 10))
      .failNextListing("volumes", throttled())
      .failNextListing("volumes", throttled());

    RunReport report = engine(inventory).run(7);

    assertThat(inventory.listCalls("volumes")).isEqualTo(3);
    assertThat(report.getState()).isEqualTo(RunState.DONE);
    assertThat(report.getVolumesDeleted()).containsExactly("vol-1");
  }

  @Test
  void givesUpOnPersistentThrottling() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-1", 10))
      .failNextListing("images", throttled())
      .failNextListing("images", throttled())
      .failNextListing("images", throttled());

    RunReport report = engine(inventory).run(7);

    assertThat(inventory.listCalls("images")).isEqualTo(3);
    assertThat(report.getState()).isEqualTo(RunState.ABORTED);
    assertThat(report.getError().getMessage()).contains("RequestLimitExceeded");
    assertThat(inventory.getDeleteCalls()).isEmpty();
  }

  @Test
  void doesNotRetryNonThrottledListingFailures() {
    InMemoryInventory inventory = new InMemoryInventory()
      .failNextListing("volumes", new InventoryException("UnauthorizedOperation", null));

    RunReport report = engine(inventory).run(7);

    assertThat(inventory.listCalls("volumes")).isEqualTo(1);
    assertThat(report.getState()).isEqualTo(RunState.ABORTED);
  }

  @Test
  void reportsEachDecisionAsItIsMade() {
    InMemoryInventory inventory = new InMemoryInventory()
      .add(availableVolume("vol-old", 10))
      .add(availableVolume("vol-young", 1))
      .add(new Snapshot("snap-old").withCreatedAt(daysAgo(10)))
      .onDelete("snap-old", id -> DeleteResult.permissionDenied("denied"));
    RecordingListener listener = new RecordingListener();

    engine(inventory, listener).run(7);

    assertThat(listener.events).containsExactly(
      "started",
      "eligible:vol-old",
      "skip:vol-young:too-young",
      "eligible:snap-old",
      "deleted:vol-old",
      "failed:snap-old",
      "completed:DONE"
    );
  }

  @Test
  void aFailingListenerDoesNotStopTheRun() {
    InMemoryInventory inventory = new InMemoryInventory().add(availableVolume("vol-1", 10));
    ReclamationListener broken = new ReclamationListener() {
      @Override
      public void onEligible(Resource resource) {
        throw new IllegalStateException("log sink unavailable");
      }
    };

    RunReport report = engine(inventory, broken).run(7);

    assertThat(report.getVolumesDeleted()).containsExactly("vol-1");
  }

  private ReclamationEngine engine(InMemoryInventory inventory, ReclamationListener... listeners) {
    return new ReclamationEngine(
      inventory,
      inventory,
      rulesEngine(),
      clock,
      listeners.length == 0 ? Collections.emptyList() : Arrays.asList(listeners),
      EnumerationRetry.throttling(2, Duration.ofMillis(1), Duration.ofMillis(5))
    );
  }

  private static RulesEngine rulesEngine() {
    return new BasicRulesEngine(Arrays.asList(
      new AttachedVolumeRule(),
      new ImageReferencedSnapshotRule(),
      new InUseSourceVolumeRule(),
      new UnknownAgeRule(),
      new RetentionAgeRule()
    ));
  }

  private static InventoryException throttled() {
    return new InventoryException("RequestLimitExceeded: Request limit exceeded.", null, true);
  }

  private static Instant daysAgo(long days) {
    return NOW.minus(Duration.ofDays(days));
  }

  private static Volume availableVolume(String id, long ageInDays) {
    return new Volume(id).withState(Volume.STATE_AVAILABLE).withCreatedAt(daysAgo(ageInDays)).withSizeGib(8);
  }

  private static Volume attachedVolume(String id, long ageInDays) {
    return new Volume(id)
      .withState(Volume.STATE_IN_USE)
      .withCreatedAt(daysAgo(ageInDays))
      .withSizeGib(8)
      .withAttachment(new Attachment("i-0abc").withDevice("/dev/xvdf").withState("attached"));
  }

  private static class RecordingListener implements ReclamationListener {
    private final List<String> events = new ArrayList<>();

    @Override
    public void onRunStarted(RunReport report) {
      events.add("started");
    }

    @Override
    public void onSkipped(Resource resource, Result result) {
      events.add("skip:" + resource.getId() + ":" + result.getReason());
    }

    @Override
    public void onEligible(Resource resource) {
      events.add("eligible:" + resource.getId());
    }

    @Override
    public void onDeleted(Resource resource, DeleteResult result) {
      events.add("deleted:" + resource.getId());
    }

    @Override
    public void onDeleteFailed(Resource resource, String error) {
      events.add("failed:" + resource.getId());
    }

    @Override
    public void onRunCompleted(RunReport report) {
      events.add("completed:" + report.getState());
    }
  }
}
