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

import com.netflix.spinnaker.reclaimer.model.Image;
import com.netflix.spinnaker.reclaimer.model.Snapshot;
import com.netflix.spinnaker.reclaimer.model.Volume;

/**
 * Read access to the account's live block storage inventory.
 * Every listing is paginated; callers keep passing the returned token until a page comes back without one.
 * Implementations throw {@link InventoryException} when a page cannot be fetched.
 */

public interface InventoryProvider {

  /**
   * Lists volumes in the configured region
   * @param nextToken continuation token from the previous page, null for the first page
   * @return a page of volumes
   */

  Page<Volume> listVolumes(String nextToken);

  /**
   * Lists snapshots owned by the configured owner
   * @param nextToken continuation token from the previous page, null for the first page
   * @return a page of snapshots
   */

  Page<Snapshot> listSnapshots(String nextToken);

  /**
   * Lists machine images owned by the configured owner
   * @param nextToken continuation token from the previous page, null for the first page
   * @return a page of images
   */

  Page<Image> listImages(String nextToken);
}
