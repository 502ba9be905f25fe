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

package com.netflix.spinnaker.reclaimer.model;

import java.time.Instant;
import java.util.Map;

/**
 * A cloud resource as seen by the reclaimer during a single run.
 * Instances are read-only views of provider state and are never persisted.
 */

public interface Resource {

  /**
   * Provider identifier, i.e vol-0a1b2c or snap-0a1b2c
   * @return the resource id
   */

  String getId();

  /**
   * One of {@link ResourceTypes}
   * @return the resource type
   */

  String getResourceType();

  /**
   * Creation time as reported by the provider
   * @return the creation time, or null when the provider did not report a usable one
   */

  Instant getCreatedAt();

  Map<String, String> getTags();
}
