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

import com.netflix.spinnaker.reclaimer.model.Attachment;
import com.netflix.spinnaker.reclaimer.model.Resource;
import com.netflix.spinnaker.reclaimer.model.Snapshot;
import com.netflix.spinnaker.reclaimer.model.Volume;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class BasicRulesEngineTest {
  private static final Instant NOW = Instant.parse("2026-10-19T12:00:00Z");

  private final RulesEngine rulesEngine = new BasicRulesEngine(Arrays.asList(
    new RetentionAgeRule(),
    new UnknownAgeRule(),
    new InUseSourceVolumeRule(),
    new ImageReferencedSnapshotRule(),
    new AttachedVolumeRule()
  ));

  private final RuleContext context = new RuleContext(
    NOW, 7, Collections.singleton("snap-ami"), Collections.singleton("vol-attached")
  );

  @Test
  void ordersRulesByPriorityRegardlessOfRegistrationOrder() {
    assertThat(rulesEngine.getRules()).extracting(Rule::getName).containsExactly(
      "in-use", "referenced-by-image", "source-volume-in-use", "unknown-age", "too-young"
    );
  }

  @Test
  void reportsHighestPriorityMatchAsReason() {
    Volume volume = new Volume("vol-1")
      .withState(Volume.STATE_IN_USE)
      .withAttachment(new Attachment("i-1"))
      .withCreatedAt(NOW.minus(Duration.ofDays(1)));

    Result result = rulesEngine.run(volume, context);

    assertThat(result.isReclaimable()).isFalse();
    assertThat(result.getReason()).isEqualTo("in-use");
    assertThat(result.getSummaries()).extracting(Result.Summary::getRuleName)
      .containsExactly("in-use", "too-young");
  }

  @Test
  void snapshotReferencedByImageOutranksEveryOtherReason() {
    Snapshot snapshot = new Snapshot("snap-ami").withVolumeId("vol-attached");

    Result result = rulesEngine.run(snapshot, context);

    assertThat(result.getReason()).isEqualTo("referenced-by-image");
    assertThat(result.getSummaries()).extracting(Result.Summary::getRuleName)
      .containsExactly("referenced-by-image", "source-volume-in-use", "unknown-age");
  }

  @Test
  void onlyAppliesRulesSupportingTheResourceType() {
    Volume volume = new Volume("snap-ami").withState(Volume.STATE_AVAILABLE).withCreatedAt(NOW.minus(Duration.ofDays(30)));

    Result result = rulesEngine.run(volume, context);

    assertThat(result.isReclaimable()).isTrue();
    assertThat(result.getReason()).isNull();
  }

  @Test
  void oldDetachedSnapshotIsReclaimable() {
    Snapshot snapshot = new Snapshot("snap-1").withVolumeId("vol-gone").withCreatedAt(NOW.minus(Duration.ofDays(8)));

    assertThat(rulesEngine.run(snapshot, context).isReclaimable()).isTrue();
  }

  @Test
  void retentionAgeRuleLeavesUnknownAgeToItsOwnRule() {
    Resource volume = new Volume("vol-1").withState(Volume.STATE_AVAILABLE);

    assertThat(new RetentionAgeRule().checkResource(volume, context)).isFalse();
    assertThat(new UnknownAgeRule().checkResource(volume, context)).isTrue();
  }

  @Test
  void zeroRetentionMakesAnyDatedResourceOldEnough() {
    RuleContext immediate = new RuleContext(NOW, 0, Collections.emptySet());
    Snapshot justTaken = new Snapshot("snap-1").withCreatedAt(NOW);

    assertThat(new RetentionAgeRule().checkResource(justTaken, immediate)).isFalse();
  }
}
