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

package com.netflix.spinnaker.reclaimer.aws.config;

import com.netflix.spinnaker.reclaimer.aws.provider.Ec2InventoryProvider;
import com.netflix.spinnaker.reclaimer.aws.provider.Ec2MutationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;

@Configuration
@ConditionalOnExpression("${aws.enabled:true}")
@EnableConfigurationProperties(AwsConfigurationProperties.class)
public class AwsConfiguration {
  private static final Logger LOGGER = LoggerFactory.getLogger(AwsConfiguration.class);

  @Bean
  Ec2Client ec2Client(AwsConfigurationProperties awsConfigurationProperties) {
    LOGGER.info("Using EC2 in region {} for owner {}",
      awsConfigurationProperties.getRegion(), awsConfigurationProperties.getOwner());
    return Ec2Client.builder()
      .region(Region.of(awsConfigurationProperties.getRegion()))
      .credentialsProvider(credentialsProvider(awsConfigurationProperties))
      .overrideConfiguration(clientOverrideConfiguration())
      .build();
  }

  /**
   * Throttled listings are retried by the reclamation engine, so the client itself never retries
   */

  static ClientOverrideConfiguration clientOverrideConfiguration() {
    return ClientOverrideConfiguration.builder()
      .retryPolicy(RetryPolicy.none())
      .build();
  }

  @Bean
  Ec2InventoryProvider ec2InventoryProvider(Ec2Client ec2Client, AwsConfigurationProperties awsConfigurationProperties) {
    return new Ec2InventoryProvider(
      ec2Client, awsConfigurationProperties.getOwner(), awsConfigurationProperties.getPageSize()
    );
  }

  @Bean
  Ec2MutationProvider ec2MutationProvider(Ec2Client ec2Client) {
    return new Ec2MutationProvider(ec2Client);
  }

  private static AwsCredentialsProvider credentialsProvider(AwsConfigurationProperties awsConfigurationProperties) {
    String profile = awsConfigurationProperties.getProfile();
    if (profile == null || profile.isEmpty()) {
      return DefaultCredentialsProvider.create();
    }

    return ProfileCredentialsProvider.create(profile);
  }
}
