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

package com.netflix.spinnaker.reclaimer.trigger;

import com.netflix.spinnaker.reclaimer.config.ReclaimerConfigurationProperties;
import com.netflix.spinnaker.reclaimer.engine.ReclamationEngine;
import com.netflix.spinnaker.reclaimer.engine.RunReport;
import com.netflix.spinnaker.reclaimer.model.ConfigurationException;
import com.netflix.spinnaker.reclaimer.model.RetentionWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point shared by the scheduler and the REST endpoint.
 * Only one run may be in flight per process; an overlapping invocation is refused.
 */

@Component
public class ReclamationInvoker {
  private static final Logger LOGGER = LoggerFactory.getLogger(ReclamationInvoker.class);

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final ReclamationEngine reclamationEngine;
  private final ReclaimerConfigurationProperties reclaimerConfigurationProperties;

  @Autowired
  public ReclamationInvoker(ReclamationEngine reclamationEngine,
                            ReclaimerConfigurationProperties reclaimerConfigurationProperties) {
    this.reclamationEngine = reclamationEngine;
    this.reclaimerConfigurationProperties = reclaimerConfigurationProperties;
  }

  /**
   * Runs the engine for an invocation payload
   * @param input invocation payload, may be null or lack retention_days
   * @return the run report, aborted without side effects when the payload is invalid
   * @throws RunInProgressException if another run has not finished yet
   */

  public RunReport invoke(Map<String, ?> input) {
    RetentionWindow window;
    try {
      window = RetentionWindow.fromInput(input, reclaimerConfigurationProperties.getDefaultRetentionDays());
    } catch (ConfigurationException e) {
      return reclamationEngine.reject(null, e);
    }

    if (!running.compareAndSet(false, true)) {
      throw new RunInProgressException("A reclamation run is already in progress");
    }

    try {
      return reclamationEngine.run(window);
    } finally {
      running.set(false);
      LOGGER.debug("Reclamation run finished, accepting new invocations");
    }
  }

  public boolean isRunning() {
    return running.get();
  }
}
