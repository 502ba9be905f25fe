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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents the rules engine findings for one resource
 */

public class Result {
  private final List<Summary> summaries = new ArrayList<>();

  void addSummary(Summary summary) {
    summaries.add(summary);
  }

  /**
   * Every rule that protected the resource, highest priority first
   */

  public List<Summary> getSummaries() {
    return Collections.unmodifiableList(summaries);
  }

  public boolean isReclaimable() {
    return summaries.isEmpty();
  }

  /**
   * The reason reported for keeping the resource
   * @return the name of the highest priority matching rule, or null when the resource is reclaimable
   */

  public String getReason() {
    return summaries.isEmpty() ? null : summaries.get(0).getRuleName();
  }

  @Override
  public String toString() {
    return isReclaimable() ? "reclaimable" : "retained " + summaries;
  }

  public static class Summary {
    private final String ruleName;
    private final String description;

    public Summary(String ruleName, String description) {
      this.ruleName = ruleName;
      this.description = description;
    }

    public String getRuleName() {
      return ruleName;
    }

    public String getDescription() {
      return description;
    }

    @Override
    public String toString() {
      return String.format("%s (%s)", ruleName, description);
    }
  }
}
