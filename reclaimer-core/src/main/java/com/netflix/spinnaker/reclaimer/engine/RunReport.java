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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.netflix.spinnaker.reclaimer.model.Resource;
import com.netflix.spinnaker.reclaimer.model.Snapshot;
import com.netflix.spinnaker.reclaimer.model.Volume;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one run, built up while the run progresses. Not persisted.
 */

@JsonPropertyOrder({
  "run_id", "state", "retention_days_used", "started_at", "duration", "duration_ms",
  "volumes_inspected", "volumes_deleted", "volumes_skipped",
  "snapshots_inspected", "snapshots_deleted", "snapshots_skipped",
  "failures", "reclaimed_volume_gib", "error"
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunReport {
  public static final String ERROR_CONFIGURATION = "configuration";
  public static final String ERROR_ENUMERATION = "enumeration";

  private final String runId = UUID.randomUUID().toString();
  private final Integer retentionDays;
  private final Instant startedAt;
  private RunState state = RunState.SCANNING;
  private Duration duration = Duration.ZERO;

  private int volumesInspected;
  private final List<String> volumesDeleted = new ArrayList<>();
  private final List<Skipped> volumesSkipped = new ArrayList<>();
  private int snapshotsInspected;
  private final List<String> snapshotsDeleted = new ArrayList<>();
  private final List<Skipped> snapshotsSkipped = new ArrayList<>();
  private final List<Failure> failures = new ArrayList<>();
  private long reclaimedVolumeGib;
  private RunError error;

  public RunReport(Integer retentionDays, Instant startedAt) {
    this.retentionDays = retentionDays;
    this.startedAt = startedAt;
  }

  void transitionTo(RunState next) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(String.format("Run %s cannot move from %s to %s", runId, state, next));
    }

    this.state = next;
  }

  void complete(Instant finishedAt) {
    transitionTo(RunState.DONE);
    this.duration = Duration.between(startedAt, finishedAt);
  }

  void abort(String errorType, String message, Instant finishedAt) {
    transitionTo(RunState.ABORTED);
    this.error = new RunError(errorType, message);
    this.duration = Duration.between(startedAt, finishedAt);
  }

  void inspected(Resource resource) {
    if (resource instanceof Volume) {
      volumesInspected++;
    } else if (resource instanceof Snapshot) {
      snapshotsInspected++;
    }
  }

  void skipped(Resource resource, String reason) {
    Skipped skipped = new Skipped(resource.getId(), reason);
    if (resource instanceof Volume) {
      volumesSkipped.add(skipped);
    } else if (resource instanceof Snapshot) {
      snapshotsSkipped.add(skipped);
    }
  }

  void deleted(Resource resource) {
    if (resource instanceof Volume) {
      volumesDeleted.add(resource.getId());
      Integer size = ((Volume) resource).getSizeGib();
      reclaimedVolumeGib += size == null ? 0 : size;
    } else if (resource instanceof Snapshot) {
      snapshotsDeleted.add(resource.getId());
    }
  }

  void failed(Resource resource, String error) {
    failures.add(new Failure(resource.getId(), resource.getResourceType(), error));
  }

  @JsonProperty("run_id")
  public String getRunId() {
    return runId;
  }

  @JsonProperty("state")
  public RunState getState() {
    return state;
  }

  @JsonProperty("retention_days_used")
  public Integer getRetentionDays() {
    return retentionDays;
  }

  @JsonIgnore
  public Instant getStartedAt() {
    return startedAt;
  }

  @JsonProperty("started_at")
  public String getStartedAtText() {
    return startedAt == null ? null : startedAt.toString();
  }

  @JsonIgnore
  public Duration getDuration() {
    return duration;
  }

  @JsonProperty("duration")
  public String getDurationText() {
    return duration.toString();
  }

  @JsonProperty("duration_ms")
  public long getDurationMillis() {
    return duration.toMillis();
  }

  @JsonProperty("volumes_inspected")
  public int getVolumesInspected() {
    return volumesInspected;
  }

  @JsonProperty("volumes_deleted")
  public List<String> getVolumesDeleted() {
    return Collections.unmodifiableList(volumesDeleted);
  }

  @JsonProperty("volumes_skipped")
  public List<Skipped> getVolumesSkipped() {
    return Collections.unmodifiableList(volumesSkipped);
  }

  @JsonProperty("snapshots_inspected")
  public int getSnapshotsInspected() {
    return snapshotsInspected;
  }

  @JsonProperty("snapshots_deleted")
  public List<String> getSnapshotsDeleted() {
    return Collections.unmodifiableList(snapshotsDeleted);
  }

  @JsonProperty("snapshots_skipped")
  public List<Skipped> getSnapshotsSkipped() {
    return Collections.unmodifiableList(snapshotsSkipped);
  }

  @JsonProperty("failures")
  public List<Failure> getFailures() {
    return Collections.unmodifiableList(failures);
  }

  @JsonProperty("reclaimed_volume_gib")
  public long getReclaimedVolumeGib() {
    return reclaimedVolumeGib;
  }

  @JsonProperty("error")
  public RunError getError() {
    return error;
  }

  @JsonIgnore
  public int getDeletedCount() {
    return volumesDeleted.size() + snapshotsDeleted.size();
  }

  @Override
  public String toString() {
    return String.format(
      "RunReport{runId=%s, state=%s, retentionDays=%s, volumes=%d inspected/%d deleted/%d skipped, "
        + "snapshots=%d inspected/%d deleted/%d skipped, failures=%d, duration=%s}",
      runId, state, retentionDays,
      volumesInspected, volumesDeleted.size(), volumesSkipped.size(),
      snapshotsInspected, snapshotsDeleted.size(), snapshotsSkipped.size(),
      failures.size(), duration
    );
  }

  @JsonPropertyOrder({"id", "reason"})
  public static class Skipped {
    private final String id;
    private final String reason;

    public Skipped(String id, String reason) {
      this.id = id;
      this.reason = reason;
    }

    @JsonProperty("id")
    public String getId() {
      return id;
    }

    @JsonProperty("reason")
    public String getReason() {
      return reason;
    }

    @Override
    public boolean equals(Object obj) {
      if (obj instanceof Skipped) {
        Skipped that = (Skipped) obj;
        return that.id.equals(id) && that.reason.equals(reason);
      }

      return false;
    }

    @Override
    public int hashCode() {
      return id.hashCode() * 31 + reason.hashCode();
    }

    @Override
    public String toString() {
      return id + ":" + reason;
    }
  }

  @JsonPropertyOrder({"id", "resource_type", "error"})
  public static class Failure {
    private final String id;
    private final String resourceType;
    private final String error;

    public Failure(String id, String resourceType, String error) {
      this.id = id;
      this.resourceType = resourceType;
      this.error = error;
    }

    @JsonProperty("id")
    public String getId() {
      return id;
    }

    @JsonProperty("resource_type")
    public String getResourceType() {
      return resourceType;
    }

    @JsonProperty("error")
    public String getError() {
      return error;
    }

    @Override
    public String toString() {
      return id + ":" + error;
    }
  }

  @JsonPropertyOrder({"type", "message"})
  public static class RunError {
    private final String type;
    private final String message;

    public RunError(String type, String message) {
      this.type = type;
      this.message = message;
    }

    @JsonProperty("type")
    public String getType() {
      return type;
    }

    @JsonProperty("message")
    public String getMessage() {
      return message;
    }
  }
}
