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

import com.netflix.spinnaker.reclaimer.provider.InventoryException;
import dev.failsafe.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Retry policies for inventory listing calls.
 * Only throttled failures are retried; any other listing failure ends the run straight away.
 */

public final class EnumerationRetry {
  private static final Logger LOGGER = LoggerFactory.getLogger(EnumerationRetry.class);

  private EnumerationRetry() {}

  public static RetryPolicy<Object> throttling(int maxRetries, Duration initialBackoff, Duration maxBackoff) {
    return RetryPolicy.builder()
      .handleIf(e -> e instanceof InventoryException && ((InventoryException) e).isThrottled())
      .withMaxRetries(maxRetries)
      .withBackoff(initialBackoff, maxBackoff)
      .onRetry(event -> LOGGER.warn("Listing throttled, retrying (attempt {} of {})",
        event.getAttemptCount(), maxRetries + 1, event.getLastException()))
      .build();
  }

  public static RetryPolicy<Object> none() {
    return RetryPolicy.builder()
      .withMaxRetries(0)
      .build();
  }
}
