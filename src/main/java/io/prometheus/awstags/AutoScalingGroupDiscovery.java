package io.prometheus.awstags;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.autoscaling.model.AutoScalingGroup;
import software.amazon.awssdk.services.autoscaling.model.DescribeAutoScalingGroupsRequest;
import software.amazon.awssdk.services.autoscaling.model.DescribeAutoScalingGroupsResponse;
import software.amazon.awssdk.services.autoscaling.model.TagDescription;

/**
 * Lists autoscaling groups directly, since the tagging API does not return them, and filters
 * their tags locally.
 */
final class AutoScalingGroupDiscovery implements DiscoveryStrategy {
  private static final Logger LOGGER = Logger.getLogger(AutoScalingGroupDiscovery.class.getName());

  private final AutoScalingClient autoScalingClient;
  private final RequestCounter requestCounter;

  AutoScalingGroupDiscovery(AutoScalingClient autoScalingClient, RequestCounter requestCounter) {
    this.autoScalingClient = autoScalingClient;
    this.requestCounter = requestCounter;
  }

  @Override
  public List<TaggedResource> discover(Job job, String region) {
    DescribeAutoScalingGroupsRequest.Builder requestBuilder =
        DescribeAutoScalingGroupsRequest.builder();

    List<TaggedResource> resources = new ArrayList<>();
    String nextToken = null;
    int pageNum = 0;
    try {
      do {
        requestBuilder.nextToken(nextToken);
        DescribeAutoScalingGroupsResponse response =
            autoScalingClient.describeAutoScalingGroups(requestBuilder.build());
        pageNum++;
        requestCounter.inc("autoscaling", "describeAutoScalingGroups");

        for (AutoScalingGroup asg : response.autoScalingGroups()) {
          List<Tag> tags = new ArrayList<>(asg.tags().size());
          for (TagDescription t : asg.tags()) {
            tags.add(new Tag(t.key(), t.value()));
          }
          String id = toTaggingApiArn(asg.autoScalingGroupARN());
          if (id == null) {
            LOGGER.warning(
                String.format(
                    "Skipping autoscaling group %s: unexpected ARN %s",
                    asg.autoScalingGroupName(), asg.autoScalingGroupARN()));
            continue;
          }
          TaggedResource resource = new TaggedResource(id, tags, job.type, region);
          if (TagFilter.matches(resource.tags, job.searchTags)) {
            resources.add(resource);
          }
        }
        nextToken = response.nextToken();
      } while (nextToken != null && !nextToken.isEmpty() && pageNum < MAX_PAGES);
    } catch (SdkException e) {
      throw new DiscoveryException(
          String.format("describeAutoScalingGroups failed in %s", region), resources, e);
    }
    return resources;
  }

  /**
   * Rewrite a native autoscaling group ARN into the shorter form the tagging API uses for other
   * resources.
   *
   * <p>Keeps fields 1, 3, 4 and 7 of the {@code :} separated ARN, so
   *
   * <pre>
   * arn:aws:autoscaling:us-east-1:123456789012:autoScalingGroup:uuid:autoScalingGroupName/my-asg
   * </pre>
   *
   * becomes {@code arn:aws:autoscaling:us-east-1:123456789012:autoScalingGroupName/my-asg}.
   * Returns null if the ARN has fewer fields.
   */
  static String toTaggingApiArn(String autoScalingGroupArn) {
    if (autoScalingGroupArn == null) {
      return null;
    }
    String[] parts = autoScalingGroupArn.split(":");
    if (parts.length < 8) {
      return null;
    }
    return String.format(
        "arn:%s:autoscaling:%s:%s:%s", parts[1], parts[3], parts[4], parts[7]);
  }
}
