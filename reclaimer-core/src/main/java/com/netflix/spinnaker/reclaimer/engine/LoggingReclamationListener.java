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

import com.netflix.spinnaker.reclaimer.model.Resource;
import com.netflix.spinnaker.reclaimer.model.Snapshot;
import com.netflix.spinnaker.reclaimer.model.Volume;
import com.netflix.spinnaker.reclaimer.provider.DeleteResult;
import com.netflix.spinnaker.reclaimer.rules.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes one structured log line per decision. The decision fields are also placed in the MDC
 * while the line is written so appenders can emit them as discrete fields.
 */

public class LoggingReclamationListener implements ReclamationListener {
  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingReclamationListener.class);

  static final String MDC_RUN_ID = "reclaimerRunId";
  static final String MDC_RESOURCE_TYPE = "resourceType";
  static final String MDC_RESOURCE_ID = "resourceId";
  static final String MDC_DECISION = "decision";

  @Override
  public void onRunStarted(RunReport report) {
    MDC.put(MDC_RUN_ID, report.getRunId());
    LOGGER.info("event=run-started runId={} retentionDays={}", report.getRunId(), report.getRetentionDays());
  }

  @Override
  public void onSkipped(Resource resource, Result result) {
    try (DecisionScope ignored = decision(resource, "skip")) {
      LOGGER.info("decision=skip resourceType={} resourceId={} reason={} createdAt={}",
        resource.getResourceType(), resource.getId(), result.getReason(), resource.getCreatedAt());
    }
  }

  @Override
  public void onEligible(Resource resource) {
    try (DecisionScope ignored = decision(resource, "eligible")) {
      LOGGER.info("decision=eligible resourceType={} resourceId={} createdAt={}{}",
        resource.getResourceType(), resource.getId(), resource.getCreatedAt(), details(resource));
    }
  }

  @Override
  public void onDeleted(Resource resource, DeleteResult result) {
    String decision = result.getOutcome() == DeleteResult.Outcome.NOT_FOUND ? "already-deleted" : "deleted";
    try (DecisionScope ignored = decision(resource, decision)) {
      LOGGER.info("decision={} resourceType={} resourceId={}{}",
        decision, resource.getResourceType(), resource.getId(), details(resource));
    }
  }

  @Override
  public void onDeleteFailed(Resource resource, String error) {
    try (DecisionScope ignored = decision(resource, "delete-failed")) {
      LOGGER.error("decision=delete-failed resourceType={} resourceId={} error=\"{}\"",
        resource.getResourceType(), resource.getId(), error);
    }
  }

  @Override
  public void onRunCompleted(RunReport report) {
    try {
      if (report.getState() == RunState.ABORTED) {
        LOGGER.error("event=run-aborted runId={} errorType={} error=\"{}\" duration={}",
          report.getRunId(), report.getError().getType(), report.getError().getMessage(), report.getDuration());
      } else {
        LOGGER.info("event=run-completed {}", report);
      }
    } finally {
      MDC.remove(MDC_RUN_ID);
    }
  }

  private static DecisionScope decision(Resource resource, String decision) {
    MDC.put(MDC_RESOURCE_TYPE, resource.getResourceType());
    MDC.put(MDC_RESOURCE_ID, resource.getId());
    MDC.put(MDC_DECISION, decision);
    return new DecisionScope();
  }

  private static String details(Resource resource) {
    if (resource instanceof Volume) {
      return " sizeGib=" + ((Volume) resource).getSizeGib();
    }

    if (resource instanceof Snapshot) {
      Snapshot snapshot = (Snapshot) resource;
      return " volumeId=" + snapshot.getVolumeId() + " description=\"" + snapshot.getDescription() + "\"";
    }

    return "";
  }

  private static class DecisionScope implements AutoCloseable {
    @Override
    public void close() {
      MDC.remove(MDC_RESOURCE_TYPE);
      MDC.remove(MDC_RESOURCE_ID);
      MDC.remove(MDC_DECISION);
    }
  }
}
