package io.prometheus.awstags;

import software.amazon.awssdk.services.apigateway.ApiGatewayClient;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.resourcegroupstaggingapi.ResourceGroupsTaggingApiClient;

/** Region scoped AWS clients used by the discovery strategies. */
interface AwsClientProvider {
  ResourceGroupsTaggingApiClient taggingClient(String region);

  AutoScalingClient autoScalingClient(String region);

  ApiGatewayClient apiGatewayClient(String region);

  Ec2Client ec2Client(String region);
}
