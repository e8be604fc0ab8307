package io.prometheus.awstags;

import java.util.ArrayList;
import java.util.List;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayAttachmentsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeTransitGatewayAttachmentsResponse;
import software.amazon.awssdk.services.ec2.model.TransitGatewayAttachment;

/**
 * Lists transit gateway attachments through EC2. Attachments have no ARN of their own, so they
 * are identified as {@code <transitGatewayId>/<transitGatewayAttachmentId>}.
 */
final class TransitGatewayAttachmentDiscovery implements DiscoveryStrategy {
  private final Ec2Client ec2Client;
  private final RequestCounter requestCounter;

  TransitGatewayAttachmentDiscovery(Ec2Client ec2Client, RequestCounter requestCounter) {
    this.ec2Client = ec2Client;
    this.requestCounter = requestCounter;
  }

  @Override
  public List<TaggedResource> discover(Job job, String region) {
    DescribeTransitGatewayAttachmentsRequest.Builder requestBuilder =
        DescribeTransitGatewayAttachmentsRequest.builder();

    List<TaggedResource> resources = new ArrayList<>();
    String nextToken = null;
    int pageNum = 0;
    try {
      do {
        requestBuilder.nextToken(nextToken);
        DescribeTransitGatewayAttachmentsResponse response =
            ec2Client.describeTransitGatewayAttachments(requestBuilder.build());
        pageNum++;
        requestCounter.inc("ec2", "describeTransitGatewayAttachments");

        for (TransitGatewayAttachment attachment : response.transitGatewayAttachments()) {
          List<Tag> tags = new ArrayList<>(attachment.tags().size());
          for (software.amazon.awssdk.services.ec2.model.Tag t : attachment.tags()) {
            tags.add(new Tag(t.key(), t.value()));
          }
          TaggedResource resource =
              new TaggedResource(attachmentId(attachment), tags, job.type, region);
          if (TagFilter.matches(resource.tags, job.searchTags)) {
            resources.add(resource);
          }
        }
        nextToken = response.nextToken();
      } while (nextToken != null && !nextToken.isEmpty() && pageNum < MAX_PAGES);
    } catch (SdkException e) {
      throw new DiscoveryException(
          String.format("describeTransitGatewayAttachments failed in %s", region), resources, e);
    }
    return resources;
  }

  static String attachmentId(TransitGatewayAttachment attachment) {
    return attachment.transitGatewayId() + "/" + attachment.transitGatewayAttachmentId();
  }
}
