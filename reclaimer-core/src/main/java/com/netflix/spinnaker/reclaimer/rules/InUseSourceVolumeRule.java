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
import com.netflix.spinnaker.reclaimer.model.Snapshot;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

/**
 * Keeps snapshots of volumes that are still attached.
 * Only volumes listed earlier in the same run are considered; a source volume that no longer
 * exists, or that is itself detached, does not protect its snapshots.
 */

@ConditionalOnExpression("${reclaimer.snapshots.protect-in-use-source-volumes:true}")
@Component
public class InUseSourceVolumeRule implements Rule {
  public static final String NAME = "source-volume-in-use";
  private static final String DESCRIPTION = "Snapshot was taken from a volume that is still attached";

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
    if (resource instanceof Snapshot) {
      String volumeId = ((Snapshot) resource).getVolumeId();
      return volumeId != null && context.getInUseVolumeIds().contains(volumeId);
    }

    return false;
  }

  @Override
  public int getPriority() {
    return 5;
  }

  @Override
  public boolean supports(String resourceType) {
    return ResourceTypes.SNAPSHOT.equals(resourceType);
  }
}
