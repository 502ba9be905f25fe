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
import org.springframework.stereotype.Component;

@Component
public class ImageReferencedSnapshotRule implements Rule {
  public static final String NAME = "referenced-by-image";
  private static final String DESCRIPTION = "Snapshot backs a block device mapping of a registered image";

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
    return context.getImageSnapshotIds().contains(resource.getId());
  }

  @Override
  public int getPriority() {
    return 0;
  }

  @Override
  public boolean supports(String resourceType) {
    return ResourceTypes.SNAPSHOT.equals(resourceType);
  }
}
