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

import com.netflix.spinnaker.reclaimer.model.RetentionWindow;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

@ConfigurationProperties("reclaimer")
public class ReclaimerConfigurationProperties {
  private int defaultRetentionDays = RetentionWindow.DEFAULT_DAYS;

  @NestedConfigurationProperty
  private Schedule schedule = new Schedule();

  @NestedConfigurationProperty
  private Enumeration enumeration = new Enumeration();

  /**
   * Window used when an invocation does not carry retention_days
   */

  public int getDefaultRetentionDays() {
    return defaultRetentionDays;
  }

  public void setDefaultRetentionDays(int defaultRetentionDays) {
    this.defaultRetentionDays = defaultRetentionDays;
  }

  public Schedule getSchedule() {
    return schedule;
  }

  public void setSchedule(Schedule schedule) {
    this.schedule = schedule;
  }

  public Enumeration getEnumeration() {
    return enumeration;
  }

  public void setEnumeration(Enumeration enumeration) {
    this.enumeration = enumeration;
  }

  public static class Schedule {
    private Boolean enabled = true;
    private String cron = "0 0 3 * * *";

    public Boolean getEnabled() {
      return enabled;
    }

    public void setEnabled(Boolean enabled) {
      this.enabled = enabled;
    }

    public String getCron() {
      return cron;
    }

    public void setCron(String cron) {
      this.cron = cron;
    }
  }

  /**
   * Backoff applied to throttled listing calls
   */

  public static class Enumeration {
    private int maxRetries = 3;
    private long initialBackoffMs = 500;
    private long maxBackoffMs = 10000;

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public long getInitialBackoffMs() {
      return initialBackoffMs;
    }

    public void setInitialBackoffMs(long initialBackoffMs) {
      this.initialBackoffMs = initialBackoffMs;
    }

    public long getMaxBackoffMs() {
      return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
      this.maxBackoffMs = maxBackoffMs;
    }
  }
}
