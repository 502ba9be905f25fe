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

package com.netflix.spinnaker.reclaimer.config;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import com.netflix.spinnaker.reclaimer.engine.EnumerationRetry;
import com.netflix.spinnaker.reclaimer.engine.LoggingReclamationListener;
import com.netflix.spinnaker.reclaimer.engine.MetricsReclamationListener;
import com.netflix.spinnaker.reclaimer.engine.ReclamationEngine;
import com.netflix.spinnaker.reclaimer.engine.ReclamationListener;
import com.netflix.spinnaker.reclaimer.provider.InventoryProvider;
import com.netflix.spinnaker.reclaimer.provider.MutationProvider;
import com.netflix.spinnaker.reclaimer.rules.BasicRulesEngine;
import com.netflix.spinnaker.reclaimer.rules.Rule;
import com.netflix.spinnaker.reclaimer.rules.RulesEngine;
import dev.failsafe.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
@EnableScheduling
@ComponentScan("com.netflix.spinnaker.reclaimer")
@EnableConfigurationProperties(ReclaimerConfigurationProperties.class)
public class ReclaimerConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  Registry registry() {
    return new DefaultRegistry();
  }

  @Bean
  public RulesEngine rulesEngine(List<Rule> rules) {
    return new BasicRulesEngine(rules);
  }

  @Bean
  LoggingReclamationListener loggingReclamationListener() {
    return new LoggingReclamationListener();
  }

  @Bean
  MetricsReclamationListener metricsReclamationListener(Registry registry) {
    return new MetricsReclamationListener(registry);
  }

  @Bean
  public ReclamationEngine reclamationEngine(InventoryProvider inventoryProvider,
                                             MutationProvider mutationProvider,
                                             RulesEngine rulesEngine,
                                             Clock clock,
                                             List<ReclamationListener> reclamationListeners,
                                             ReclaimerConfigurationProperties reclaimerConfigurationProperties) {
    return new ReclamationEngine(
      inventoryProvider,
      mutationProvider,
      rulesEngine,
      clock,
      reclamationListeners,
      enumerationRetryPolicy(reclaimerConfigurationProperties.getEnumeration())
    );
  }

  private static RetryPolicy<Object> enumerationRetryPolicy(ReclaimerConfigurationProperties.Enumeration enumeration) {
    if (enumeration.getMaxRetries() <= 0) {
      return EnumerationRetry.none();
    }

    return EnumerationRetry.throttling(
      enumeration.getMaxRetries(),
      Duration.ofMillis(enumeration.getInitialBackoffMs()),
      Duration.ofMillis(enumeration.getMaxBackoffMs())
    );
  }
}
