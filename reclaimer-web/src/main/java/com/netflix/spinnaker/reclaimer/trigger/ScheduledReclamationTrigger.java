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

import com.netflix.spinnaker.reclaimer.engine.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Collections;

@Component
@ConditionalOnExpression("${reclaimer.schedule.enabled:true}")
public class ScheduledReclamationTrigger {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduledReclamationTrigger.class);

  private final ReclamationInvoker reclamationInvoker;

  @Autowired
  public ScheduledReclamationTrigger(ReclamationInvoker reclamationInvoker) {
    this.reclamationInvoker = reclamationInvoker;
  }

  @Scheduled(cron = "${reclaimer.schedule.cron:0 0 3 * * *}")
  public void trigger() {
    try {
      RunReport report = reclamationInvoker.invoke(Collections.emptyMap());
      LOGGER.info("Scheduled reclamation run {} ended {}", report.getRunId(), report.getState());
    } catch (RunInProgressException e) {
      LOGGER.warn("Skipping scheduled reclamation run: {}", e.getMessage());
    }
  }
}
