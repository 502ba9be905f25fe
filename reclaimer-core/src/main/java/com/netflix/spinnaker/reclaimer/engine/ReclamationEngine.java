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

import com.netflix.spinnaker.reclaimer.model.ConfigurationException;
import com.netflix.spinnaker.reclaimer.model.Image;
import com.netflix.spinnaker.reclaimer.model.Resource;
import com.netflix.spinnaker.reclaimer.model.RetentionWindow;
import com.netflix.spinnaker.reclaimer.model.Snapshot;
import com.netflix.spinnaker.reclaimer.model.Volume;
import com.netflix.spinnaker.reclaimer.provider.DeleteResult;
import com.netflix.spinnaker.reclaimer.provider.InventoryProvider;
import com.netflix.spinnaker.reclaimer.provider.MutationProvider;
import com.netflix.spinnaker.reclaimer.provider.Page;
import com.netflix.spinnaker.reclaimer.rules.Result;
import com.netflix.spinnaker.reclaimer.rules.RuleContext;
import com.netflix.spinnaker.reclaimer.rules.RulesEngine;
import dev.failsafe.Failsafe;
import dev.failsafe.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Scans the account for unused volumes and snapshots and deletes the ones past the retention window.
 *
 * <p>A run is strictly sequential: the image reference set is built first, then volumes and
 * snapshots are listed and classified, and only once every listing has completed are the
 * eligible resources deleted, volumes before snapshots. A listing failure aborts the run before
 * anything is deleted. A failed delete is recorded and the run moves on to the next resource.
 *
 * <p>Nothing is kept between runs; every run derives its view from live provider listings.
 */

public class ReclamationEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(ReclamationEngine.class);

  private final InventoryProvider inventoryProvider;
  private final MutationProvider mutationProvider;
  private final RulesEngine rulesEngine;
  private final Clock clock;
  private final List<ReclamationListener> listeners;
  private final RetryPolicy<Object> enumerationRetryPolicy;

  public ReclamationEngine(InventoryProvider inventoryProvider,
                           MutationProvider mutationProvider,
                           RulesEngine rulesEngine,
                           Clock clock,
                           List<ReclamationListener> listeners,
                           RetryPolicy<Object> enumerationRetryPolicy) {
    this.inventoryProvider = inventoryProvider;
    this.mutationProvider = mutationProvider;
    this.rulesEngine = rulesEngine;
    this.clock = clock;
    this.listeners = listeners;
    this.enumerationRetryPolicy = enumerationRetryPolicy;
  }

  /**
   * Runs a full scan, classify and delete cycle
   * @param retentionDays minimum age in days of a reclaimable resource
   * @return the run report; a negative window yields an aborted report without any provider call
   */

  public RunReport run(int retentionDays) {
    RetentionWindow window;
    try {
      window = RetentionWindow.of(retentionDays);
    } catch (ConfigurationException e) {
      return reject(retentionDays, e);
    }

    return run(window);
  }

  public RunReport run(RetentionWindow window) {
    RunReport report = new RunReport(window.getDays(), clock.instant());
    notifyListeners(l -> l.onRunStarted(report));
    LOGGER.info("Starting reclamation run {} with a retention window of {}", report.getRunId(), window);

    List<Volume> eligibleVolumes = new ArrayList<>();
    List<Snapshot> eligibleSnapshots = new ArrayList<>();
    try {
      Set<String> imageSnapshotIds = collectImageSnapshotIds();
      RuleContext context = new RuleContext(report.getStartedAt(), window.getDays(), imageSnapshotIds);

      Set<String> inUseVolumeIds = new HashSet<>();
      forEachItem(inventoryProvider::listVolumes, volume -> {
        if (!volume.isDetached()) {
          inUseVolumeIds.add(volume.getId());
        }

        if (classify(volume, context, report)) {
          eligibleVolumes.add(volume);
        }
      });

      RuleContext snapshotContext = context.withInUseVolumeIds(inUseVolumeIds);
      forEachItem(inventoryProvider::listSnapshots, snapshot -> {
        if (classify(snapshot, snapshotContext, report)) {
          eligibleSnapshots.add(snapshot);
        }
      });
    } catch (RuntimeException e) {
      LOGGER.error("Reclamation run {} aborted while listing resources", report.getRunId(), e);
      report.abort(RunReport.ERROR_ENUMERATION, describe(e), clock.instant());
      notifyListeners(l -> l.onRunCompleted(report));
      return report;
    }

    report.transitionTo(RunState.MUTATING);
    eligibleVolumes.forEach(volume -> delete(volume, mutationProvider::deleteVolume, report));
    eligibleSnapshots.forEach(snapshot -> delete(snapshot, mutationProvider::deleteSnapshot, report));

    report.complete(clock.instant());
    notifyListeners(l -> l.onRunCompleted(report));
    return report;
  }

  /**
   * Produces the report of an invocation refused before any provider call
   * @param retentionDays the requested window if it was numeric, otherwise null
   * @param e why the invocation was refused
   * @return an aborted report
   */

  public RunReport reject(Integer retentionDays, ConfigurationException e) {
    RunReport report = new RunReport(retentionDays, clock.instant());
    LOGGER.warn("Rejecting reclamation run {}: {}", report.getRunId(), e.getMessage());
    notifyListeners(l -> l.onRunStarted(report));
    report.abort(RunReport.ERROR_CONFIGURATION, e.getMessage(), clock.instant());
    notifyListeners(l -> l.onRunCompleted(report));
    return report;
  }

  /**
   * Every snapshot id referenced by any registered image. Must be complete before a single snapshot
   * is classified, otherwise an image could lose its backing snapshot.
   */

  private Set<String> collectImageSnapshotIds() {
    Set<String> snapshotIds = new HashSet<>();
    int[] images = {0};
    forEachItem(inventoryProvider::listImages, (Image image) -> {
      images[0]++;
      snapshotIds.addAll(image.getSnapshotIds());
    });

    LOGGER.info("Found {} snapshots referenced by {} images", snapshotIds.size(), images[0]);
    return snapshotIds;
  }

  /**
   * Follows continuation tokens until the provider reports no further page
   */

  private <T> void forEachItem(Function<String, Page<T>> listing, Consumer<T> consumer) {
    String nextToken = null;
    do {
      final String token = nextToken;
      Page<T> page = Failsafe.with(enumerationRetryPolicy).get(() -> listing.apply(token));
      page.getItems().forEach(consumer);
      nextToken = page.getNextToken();
    } while (nextToken != null);
  }

  private boolean classify(Resource resource, RuleContext context, RunReport report) {
    report.inspected(resource);
    Result result = rulesEngine.run(resource, context);
    if (!result.isReclaimable()) {
      report.skipped(resource, result.getReason());
      notifyListeners(l -> l.onSkipped(resource, result));
      return false;
    }

    notifyListeners(l -> l.onEligible(resource));
    return true;
  }

  private void delete(Resource resource, Function<String, DeleteResult> deleteAction, RunReport report) {
    DeleteResult result;
    try {
      result = deleteAction.apply(resource.getId());
    } catch (RuntimeException e) {
      LOGGER.debug("Delete of {} threw", resource.getId(), e);
      recordFailure(resource, describe(e), report);
      return;
    }

    if (result.isSuccess()) {
      report.deleted(resource);
      notifyListeners(l -> l.onDeleted(resource, result));
    } else {
      recordFailure(resource, result.describe(), report);
    }
  }

  private void recordFailure(Resource resource, String error, RunReport report) {
    report.failed(resource, error);
    notifyListeners(l -> l.onDeleteFailed(resource, error));
  }

  private void notifyListeners(Consumer<ReclamationListener> event) {
    Optional.ofNullable(listeners).ifPresent(list -> list.forEach(listener -> {
      try {
        event.accept(listener);
      } catch (RuntimeException e) {
        LOGGER.warn("Listener {} failed", listener.getClass().getSimpleName(), e);
      }
    }));
  }

  private static String describe(Throwable e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
