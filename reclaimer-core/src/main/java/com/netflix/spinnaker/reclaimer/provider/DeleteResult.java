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

import java.util.Locale;

public class DeleteResult {
  private static final DeleteResult DELETED = new DeleteResult(Outcome.DELETED, null);

  private final Outcome outcome;
  private final String message;

  public DeleteResult(Outcome outcome, String message) {
    this.outcome = outcome;
    this.message = message;
  }

  public static DeleteResult deleted() {
    return DELETED;
  }

  public static DeleteResult notFound(String message) {
    return new DeleteResult(Outcome.NOT_FOUND, message);
  }

  public static DeleteResult inUse(String message) {
    return new DeleteResult(Outcome.IN_USE, message);
  }

  public static DeleteResult permissionDenied(String message) {
    return new DeleteResult(Outcome.PERMISSION_DENIED, message);
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public String getMessage() {
    return message;
  }

  /**
   * A resource that is already gone counts as reclaimed
   */

  public boolean isSuccess() {
    return outcome == Outcome.DELETED || outcome == Outcome.NOT_FOUND;
  }

  public String describe() {
    String label = outcome.name().toLowerCase(Locale.ROOT).replace('_', '-');
    return message == null ? label : label + ": " + message;
  }

  @Override
  public String toString() {
    return describe();
  }

  public enum Outcome {
    DELETED,
    NOT_FOUND,
    IN_USE,
    PERMISSION_DENIED
  }
}
