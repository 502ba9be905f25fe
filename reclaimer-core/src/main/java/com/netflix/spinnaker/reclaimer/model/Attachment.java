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

/**
 * A volume attachment record. The instance may be stopped; the attachment still counts.
 */

public class Attachment {
  private final String instanceId;
  private String device;
  private String state;

  public Attachment(String instanceId) {
    this.instanceId = instanceId;
  }

  public String getInstanceId() {
    return instanceId;
  }

  public String getDevice() {
    return device;
  }

  public Attachment withDevice(String device) {
    this.device = device;
    return this;
  }

  public String getState() {
    return state;
  }

  public Attachment withState(String state) {
    this.state = state;
    return this;
  }

  @Override
  public String toString() {
    return instanceId + ":" + device;
  }
}
