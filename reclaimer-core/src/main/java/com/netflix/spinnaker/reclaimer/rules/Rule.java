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

import com.netflix.spinnaker.reclaimer.model.Resource;

/**
 * A rule deciding whether a resource must be kept.
 * A resource that no supported rule protects is a reclamation candidate.
 */

public interface Rule extends Comparable<Rule> {

  /**
   * Getter for rule name. The name is reported as the skip reason.
   * @return rule name
   */

  String getName();

  /**
   * Getter for rule description
   * @return rule description
   */

  String getDescription();

  /**
   * Determines if this rule protects the resource
   * @param resource cloud resource to apply the rule on
   * @param context facts gathered for the current run
   * @return true if the resource must be kept
   */

  boolean checkResource(Resource resource, RuleContext context);

  /**
   * The priority of this rule in the engine, lower runs first
   * @return the priority
   */

  int getPriority();

  /**
   * Checks if this rule applies
   * @param resourceType the resource type to match
   * @return true if the rule applies to this resource type
   */

  boolean supports(String resourceType);

  @Override
  default int compareTo(final Rule rule) {
    int byPriority = Integer.compare(getPriority(), rule.getPriority());
    if (byPriority != 0) {
      return byPriority;
    }

    return getName().compareTo(rule.getName());
  }
}
