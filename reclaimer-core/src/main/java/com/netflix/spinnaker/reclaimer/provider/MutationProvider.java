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

/**
 * Delete access to block storage resources.
 * Expected provider refusals come back as a {@link DeleteResult}; anything else is thrown as a {@link ProviderException}.
 */

public interface MutationProvider {
  DeleteResult deleteVolume(String volumeId);

  DeleteResult deleteSnapshot(String snapshotId);
}
