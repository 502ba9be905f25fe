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

package com.netflix.spinnaker.reclaimer.aws.provider;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * EC2 error codes the providers act on
 */

final class Ec2Errors {
  static final Set<String> THROTTLING = new HashSet<>(Arrays.asList("RequestLimitExceeded", "Throttling"));
  static final Set<String> NOT_FOUND = new HashSet<>(Arrays.asList("InvalidVolume.NotFound", "InvalidSnapshot.NotFound"));
  static final Set<String> IN_USE = new HashSet<>(Arrays.asList("VolumeInUse", "InvalidSnapshot.InUse"));
  static final Set<String> PERMISSION_DENIED = new HashSet<>(Arrays.asList("UnauthorizedOperation", "AuthFailure"));

  private Ec2Errors() {}

  static String errorCode(AwsServiceException e) {
    AwsErrorDetails details = e.awsErrorDetails();
    return details == null ? null : details.errorCode();
  }

  static boolean isThrottled(AwsServiceException e) {
    return e.isThrottlingException() || THROTTLING.contains(errorCode(e));
  }

  static String describe(AwsServiceException e) {
    AwsErrorDetails details = e.awsErrorDetails();
    if (details == null || details.errorCode() == null) {
      return e.getMessage();
    }

    return details.errorCode() + ": " + details.errorMessage();
  }
}
