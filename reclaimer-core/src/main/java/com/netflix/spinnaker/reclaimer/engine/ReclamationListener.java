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
import com.netflix.spinnaker.reclaimer.provider.DeleteResult;
import com.netflix.spinnaker.reclaimer.rules.Result;

/**
 * Receives every decision the engine takes, at the moment it is taken
 */

public interface ReclamationListener {
  default void onRunStarted(RunReport report) {}

  /**
   * A rule protected the resource
   */

  default void onSkipped(Resource resource, Result result) {}

  /**
   * No rule protected the resource; it will be deleted once scanning completes
   */

  default void onEligible(Resource resource) {}

  /**
   * The delete call succeeded, or the resource was already gone
   */

  default void onDeleted(Resource resource, DeleteResult result) {}

  default void onDeleteFailed(Resource resource, String error) {}

  default void onRunCompleted(RunReport report) {}
}
