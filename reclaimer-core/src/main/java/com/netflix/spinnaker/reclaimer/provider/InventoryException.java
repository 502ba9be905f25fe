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

package com.netflix.spinnaker.reclaimer.provider;

/**
 * A listing call failed. Throttled failures are worth retrying, anything else ends the run.
 */

public class InventoryException extends RuntimeException {
  private final boolean throttled;

  public InventoryException(String message, Throwable cause, boolean throttled) {
    super(message, cause);
    this.throttled = throttled;
  }

  public InventoryException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public boolean isThrottled() {
    return throttled;
  }
}
