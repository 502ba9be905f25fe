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

import java.math.BigDecimal;
import java.util.Map;

/**
 * Minimum age, in days, a resource must reach before it can be reclaimed.
 * A resource whose age equals the window is eligible.
 */

public final class RetentionWindow {
  public static final int DEFAULT_DAYS = 7;
  public static final String INPUT_FIELD = "retention_days";

  private final int days;

  private RetentionWindow(int days) {
    this.days = days;
  }

  public static RetentionWindow of(int days) {
    if (days < 0) {
      throw new ConfigurationException(
        String.format("%s must be a non-negative integer, got %d", INPUT_FIELD, days)
      );
    }

    return new RetentionWindow(days);
  }

  public static RetentionWindow defaultWindow() {
    return new RetentionWindow(DEFAULT_DAYS);
  }

  /**
   * Reads the window from an invocation payload.
   * The default only applies when the field is missing altogether. The value must be a whole
   * number; null, negative, fractional and string values are rejected.
   * @param input invocation payload, may be null
   * @param defaultDays window to use when the field is absent
   * @return the retention window
   */

  public static RetentionWindow fromInput(Map<String, ?> input, int defaultDays) {
    if (input == null || !input.containsKey(INPUT_FIELD)) {
      return of(defaultDays);
    }

    return of(toDays(input.get(INPUT_FIELD)));
  }

  private static int toDays(Object value) {
    if (value instanceof Number) {
      BigDecimal decimal = parse(value);
      if (decimal.stripTrailingZeros().scale() > 0) {
        throw notNumeric(value);
      }

      return toInt(decimal, value);
    }

    throw notNumeric(value);
  }

  private static BigDecimal parse(Object value) {
    try {
      return new BigDecimal(value.toString());
    } catch (NumberFormatException e) {
      throw notNumeric(value);
    }
  }

  private static int toInt(BigDecimal decimal, Object original) {
    try {
      return decimal.intValueExact();
    } catch (ArithmeticException e) {
      throw notNumeric(original);
    }
  }

  private static ConfigurationException notNumeric(Object value) {
    return new ConfigurationException(
      String.format("%s must be a non-negative integer, got '%s'", INPUT_FIELD, value)
    );
  }

  public int getDays() {
    return days;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof RetentionWindow && ((RetentionWindow) obj).days == days;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(days);
  }

  @Override
  public String toString() {
    return days + " days";
  }
}
