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

import java.util.List;
import java.util.Set;

/**
 * Decides whether a resource is a reclamation candidate based on a collection of rules
 */

public interface RulesEngine {

  /**
   * Adds a new rule to the engine
   * @param rule a rule to apply on a resource
   * @return this engine
   */

  RulesEngine addRule(Rule rule);

  /**
   * Adds a list of rules
   * @param rules rules to apply on resources
   */

  void addRules(List<Rule> rules);

  /**
   * Fires all rules supporting the resource type, in priority order
   */

  Result run(Resource resource, RuleContext context);

  /**
   * Gets the current rules, in the order they will be executed
   */

  Set<Rule> getRules();
}
