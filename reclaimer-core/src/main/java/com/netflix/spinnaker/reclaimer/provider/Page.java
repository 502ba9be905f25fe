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

import java.util.Collections;
import java.util.List;

/**
 * One bounded page of a provider listing
 * @param <T> item type
 */

public class Page<T> {
  private final List<T> items;
  private final String nextToken;

  public Page(List<T> items, String nextToken) {
    this.items = items == null ? Collections.emptyList() : items;
    this.nextToken = nextToken == null || nextToken.isEmpty() ? null : nextToken;
  }

  public static <T> Page<T> of(List<T> items, String nextToken) {
    return new Page<>(items, nextToken);
  }

  public static <T> Page<T> last(List<T> items) {
    return new Page<>(items, null);
  }

  public List<T> getItems() {
    return items;
  }

  /**
   * Continuation token for the next page
   * @return the token, or null when this is the last page
   */

  public String getNextToken() {
    return nextToken;
  }

  public boolean hasNext() {
    return nextToken != null;
  }
}
