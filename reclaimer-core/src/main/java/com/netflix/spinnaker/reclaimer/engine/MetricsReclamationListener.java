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

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spinnaker.reclaimer.model.Resource;
import com.netflix.spinnaker.reclaimer.provider.DeleteResult;
import com.netflix.spinnaker.reclaimer.rules.Result;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

public class MetricsReclamationListener implements ReclamationListener {
  private final Registry registry;
  private final Id runsId;
  private final Id runDurationId;
  private final Id decisionsId;
  private final Id failuresId;

  public MetricsReclamationListener(Registry registry) {
    this.registry = registry;
    this.runsId = registry.createId("reclaimer.runs");
    this.runDurationId = registry.createId("reclaimer.runDuration");
    this.decisionsId = registry.createId("reclaimer.decisions");
    this.failuresId = registry.createId("reclaimer.failures");
  }

  @Override
  public void onSkipped(Resource resource, Result result) {
    registry.counter(
      decisionsId
        .withTag("resourceType", resource.getResourceType())
        .withTag("decision", "skip")
        .withTag("reason", result.getReason())
    ).increment();
  }

  @Override
  public void onDeleted(Resource resource, DeleteResult result) {
    registry.counter(
      decisionsId
        .withTag("resourceType", resource.getResourceType())
        .withTag("decision", "deleted")
        .withTag("reason", result.getOutcome().name().toLowerCase(Locale.ROOT))
    ).increment();
  }

  @Override
  public void onDeleteFailed(Resource resource, String error) {
    registry.counter(failuresId.withTag("resourceType", resource.getResourceType())).increment();
  }

  @Override
  public void onRunCompleted(RunReport report) {
    String state = report.getState().name().toLowerCase(Locale.ROOT);
    registry.counter(runsId.withTag("state", state)).increment();
    registry.timer(runDurationId.withTag("state", state))
      .record(report.getDuration().toMillis(), TimeUnit.MILLISECONDS);
  }
}
