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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A basic Rules Engine
 */

public class BasicRulesEngine implements RulesEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(BasicRulesEngine.class);
  private final Set<Rule> rules = new TreeSet<>();

  public BasicRulesEngine(List<Rule> rules) {
    addRules(rules);
  }

  @Override
  public BasicRulesEngine addRule(Rule rule) {
    rules.add(rule);
    return this;
  }

  @Override
  public void addRules(List<Rule> rules) {
    this.rules.addAll(rules);
  }

  @Override
  public Result run(Resource resource, RuleContext context) {
    Result result = new Result();
    for (Rule rule : rules) {
      if (rule.supports(resource.getResourceType()) && rule.checkResource(resource, context)) {
        result.addSummary(new Result.Summary(rule.getName(), rule.getDescription()));
      }
    }

    LOGGER.debug("completed run for resource {}: {}", resource.getId(), result);
    return result;
  }

  @Override
  public Set<Rule> getRules() {
    return Collections.unmodifiableSet(rules);
  }
}
