package io.prometheus.awstags;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.hamcrest.MockitoHamcrest.argThat;

import io.prometheus.awstags.RequestsMatchers.GetResourcesRequestMatcher;
import io.prometheus.awstags.TagDiscoveryTest.FixedClientProvider;
import io.prometheus.client.CollectorRegistry;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.apigateway.ApiGatewayClient;
import software.amazon.awssdk.services.apigateway.model.GetRestApisRequest;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.autoscaling.model.AutoScalingGroup;
import software.amazon.awssdk.services.autoscaling.model.DescribeAutoScalingGroupsRequest;
import software.amazon.awssdk.services.autoscaling.model.DescribeAutoScalingGroupsResponse;
import software.amazon.awssdk.services.autoscaling.model.TagDescription;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.resourcegroupstaggingapi.ResourceGroupsTaggingApiClient;
import software.amazon.awssdk.services.resourcegroupstaggingapi.model.GetResourcesRequest;
import software.amazon.awssdk.services.resourcegroupstaggingapi.model.GetResourcesResponse;

public class TagsCollectorTest {
  ResourceGroupsTaggingApiClient taggingClient;
  AutoScalingClient autoScalingClient;
  ApiGatewayClient apiGatewayClient;
  Ec2Client ec2Client;
  AwsClientProvider clients;
  CollectorRegistry registry;

  @Before
  public void setUp() {
    taggingClient = Mockito.mock(ResourceGroupsTaggingApiClient.class);
    autoScalingClient = Mockito.mock(AutoScalingClient.class);
    apiGatewayClient = Mockito.mock(ApiGatewayClient.class);
    ec2Client = Mockito.mock(Ec2Client.class);
    clients = new FixedClientProvider(taggingClient, autoScalingClient, apiGatewayClient, ec2Client);
    registry = new CollectorRegistry();
  }

  @Test
  public void exportsInfoMetricPerResource() {
    new TagsCollector(
            "---\nregion: us-east-1\njobs:\n- type: ec2\n  search_tags:\n  - key: Environment\n    value: production\n",
            clients)
        .register(registry);

    Mockito.when(
            taggingClient.getResources(
                (GetResourcesRequest)
                    argThat(new GetResourcesRequestMatcher().ResourceTypeFilter("ec2:instance"))))
        .thenReturn(
            GetResourcesResponse.builder()
                .resourceTagMappingList(
                    TaggingApiDiscoveryTest.mapping(
                        "arn:aws:ec2:us-east-1:121212121212:instance/i-1",
                        "Environment",
                        "production",
                        "Team",
                        "payments"),
                    TaggingApiDiscoveryTest.mapping(
                        "arn:aws:ec2:us-east-1:121212121212:instance/i-2",
                        "Environment",
                        "production"),
                    TaggingApiDiscoveryTest.mapping(
                        "arn:aws:ec2:us-east-1:121212121212:instance/i-3",
                        "Environment",
                        "staging",
                        "Owner",
                        "bob"))
                .build());

    String[] labelNames = new String[] {"name", "tag_environment", "tag_team"};
    assertEquals(
        0.0,
        registry.getSampleValue(
            "aws_ec2_info",
            labelNames,
            new String[] {
              "arn:aws:ec2:us-east-1:121212121212:instance/i-1", "production", "payments"
            }),
        .01);
    assertEquals(
        0.0,
        registry.getSampleValue(
            "aws_ec2_info",
            labelNames,
            new String[] {"arn:aws:ec2:us-east-1:121212121212:instance/i-2", "production", ""}),
        .01);
    assertNull(
        registry.getSampleValue(
            "aws_ec2_info",
            new String[] {"name", "tag_environment", "tag_owner"},
            new String[] {"arn:aws:ec2:us-east-1:121212121212:instance/i-3", "staging", "bob"}));
    assertEquals(0.0, registry.getSampleValue("aws_tags_exporter_scrape_error"), .01);
  }

  @Test
  public void jobsRunInEveryConfiguredRegion() {
    new TagsCollector(
            "---\njobs:\n- type: asg\n  regions: [us-east-1, eu-west-1]\n", clients)
        .register(registry);

    Mockito.when(autoScalingClient.describeAutoScalingGroups(any(DescribeAutoScalingGroupsRequest.class)))
        .thenReturn(
            DescribeAutoScalingGroupsResponse.builder()
                .autoScalingGroups(
                    AutoScalingGroup.builder()
                        .autoScalingGroupARN(
                            "arn:aws:autoscaling:us-east-1:1:autoScalingGroup:u:autoScalingGroupName/a")
                        .tags(TagDescription.builder().key("Team").value("infra").build())
                        .build())
                .build());

    assertEquals(
        0.0,
        registry.getSampleValue(
            "aws_asg_info",
            new String[] {"name", "tag_team"},
            new String[] {"arn:aws:autoscaling:us-east-1:1:autoScalingGroupName/a", "infra"}),
        .01);
    Mockito.verify(autoScalingClient, Mockito.times(2))
        .describeAutoScalingGroups(any(DescribeAutoScalingGroupsRequest.class));
  }

  @Test
  public void failedJobIsReportedAndOthersStillExported() {
    new TagsCollector("---\nregion: us-east-1\njobs:\n- type: sqs\n- type: asg\n", clients)
        .register(registry);

    Mockito.when(taggingClient.getResources(any(GetResourcesRequest.class)))
        .thenThrow(SdkClientException.create("access denied"));
    Mockito.when(autoScalingClient.describeAutoScalingGroups(any(DescribeAutoScalingGroupsRequest.class)))
        .thenReturn(
            DescribeAutoScalingGroupsResponse.builder()
                .autoScalingGroups(
                    AutoScalingGroup.builder()
                        .autoScalingGroupARN(
                            "arn:aws:autoscaling:us-east-1:1:autoScalingGroup:u:autoScalingGroupName/a")
                        .build())
                .build());

    assertEquals(1.0, registry.getSampleValue("aws_tags_exporter_scrape_error"), .01);
    assertEquals(
        0.0,
        registry.getSampleValue(
            "aws_asg_info",
            new String[] {"name"},
            new String[] {"arn:aws:autoscaling:us-east-1:1:autoScalingGroupName/a"}),
        .01);
  }

  @Test
  public void apiGatewayWithoutRestApiListingExportsNoRawArns() {
    new TagsCollector("---\nregion: us-east-1\njobs:\n- type: apigateway\n", clients)
        .register(registry);

    Mockito.when(taggingClient.getResources(any(GetResourcesRequest.class)))
        .thenReturn(
            GetResourcesResponse.builder()
                .resourceTagMappingList(
                    TaggingApiDiscoveryTest.mapping(
                        "arn:aws:apigateway:us-east-1::/restapis/abc/stages/prod"),
                    TaggingApiDiscoveryTest.mapping("arn:aws:apigateway:us-east-1::/apis/http1"))
                .build());
    Mockito.when(apiGatewayClient.getRestApis(any(GetRestApisRequest.class)))
        .thenThrow(SdkClientException.create("timeout"));

    assertEquals(1.0, registry.getSampleValue("aws_tags_exporter_scrape_error"), .01);
    assertNull(
        registry.getSampleValue(
            "aws_apigateway_info",
            new String[] {"name"},
            new String[] {"arn:aws:apigateway:us-east-1::/restapis/abc/stages/prod"}));
    assertNull(
        registry.getSampleValue(
            "aws_apigateway_info",
            new String[] {"name"},
            new String[] {"arn:aws:apigateway:us-east-1::/apis/http1"}));
  }

  @Test
  public void malformedAutoScalingGroupDoesNotHideOtherJobs() {
    new TagsCollector("---\nregion: us-east-1\njobs:\n- type: sqs\n- type: asg\n", clients)
        .register(registry);

    Mockito.when(taggingClient.getResources(any(GetResourcesRequest.class)))
        .thenReturn(
            GetResourcesResponse.builder()
                .resourceTagMappingList(
                    TaggingApiDiscoveryTest.mapping("arn:aws:sqs:us-east-1:1:queue-1"))
                .build());
    Mockito.when(autoScalingClient.describeAutoScalingGroups(any(DescribeAutoScalingGroupsRequest.class)))
        .thenReturn(
            DescribeAutoScalingGroupsResponse.builder()
                .autoScalingGroups(
                    AutoScalingGroup.builder().autoScalingGroupARN("arn:aws:autoscaling").build(),
                    AutoScalingGroup.builder()
                        .autoScalingGroupARN(
                            "arn:aws:autoscaling:us-east-1:1:autoScalingGroup:u:autoScalingGroupName/a")
                        .build())
                .build());

    assertEquals(0.0, registry.getSampleValue("aws_tags_exporter_scrape_error"), .01);
    assertEquals(
        0.0,
        registry.getSampleValue(
            "aws_sqs_info", new String[] {"name"}, new String[] {"arn:aws:sqs:us-east-1:1:queue-1"}),
        .01);
    assertEquals(
        0.0,
        registry.getSampleValue(
            "aws_asg_info",
            new String[] {"name"},
            new String[] {"arn:aws:autoscaling:us-east-1:1:autoScalingGroupName/a"}),
        .01);
  }

  @Test
  public void snakeCaseLabelsCanBeEnabled() {
    new TagsCollector(
            "---\nregion: us-east-1\nlabels_snake_case: true\njobs:\n- type: dynamodb\n", clients)
        .register(registry);

    Mockito.when(taggingClient.getResources(any(GetResourcesRequest.class)))
        .thenReturn(
            GetResourcesResponse.builder()
                .resourceTagMappingList(
                    TaggingApiDiscoveryTest.mapping(
                        "arn:aws:dynamodb:us-east-1:1:table/t", "CostCenter", "42"))
                .build());

    assertEquals(
        0.0,
        registry.getSampleValue(
            "aws_dynamodb_info",
            new String[] {"name", "tag_cost_center"},
            new String[] {"arn:aws:dynamodb:us-east-1:1:table/t", "42"}),
        .01);
  }

  @Test
  public void unsupportedTypeFailsConfigLoading() {
    try {
      new TagsCollector("---\nregion: us-east-1\njobs:\n- type: mainframe\n", clients);
      fail("Expected an UnsupportedResourceTypeException");
    } catch (UnsupportedResourceTypeException e) {
      // expected
    }
  }

  @Test
  public void invalidConfigIsRejected() {
    String[] configs =
        new String[] {
          "---\nregion: us-east-1\n",
          "---\nregion: us-east-1\njobs:\n- regions: [us-east-1]\n",
          "---\njobs:\n- type: ec2\n",
          "---\nregion: us-east-1\njobs:\n- type: ec2\n  search_tags:\n  - key: Team\n",
        };
    for (String config : configs) {
      try {
        new TagsCollector(config, clients);
        fail("Expected an IllegalArgumentException for " + config);
      } catch (IllegalArgumentException e) {
        // expected
      }
    }
  }
}
