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

/**
 * Lifecycle of a single run. There are no backward transitions.
 */

public enum RunState {
  SCANNING,
  MUTATING,
  DONE,
  ABORTED;

  public boolean canTransitionTo(RunState next) {
    switch (this) {
      case SCANNING:
        return next == MUTATING || next == ABORTED;
      case MUTATING:
        return next == DONE;
      default:
        return false;
    }
  }

  public boolean isTerminal() {
    return this == DONE || this == ABORTED;
  }
}
