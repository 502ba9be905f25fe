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
import com.netflix.spinnaker.reclaimer.model.ResourceTypes;
import com.netflix.spinnaker.reclaimer.model.Volume;
import org.springframework.stereotype.Component;

@Component
public class AttachedVolumeRule implements Rule {
  public static final String NAME = "in-use";
  private static final String DESCRIPTION = "Volume is attached to an instance or not in the available state";

  @Override
  public String getName() {
    return NAME;
  }

  @Override
  public String getDescription() {
    return DESCRIPTION;
  }

  @Override
  public boolean checkResource(Resource resource, RuleContext context) {
    return resource instanceof Volume && !((Volume) resource).isDetached();
  }

  @Override
  public int getPriority() {
    return 0;
  }

  @Override
  public boolean supports(String resourceType) {
    return ResourceTypes.VOLUME.equals(resourceType);
  }
}
