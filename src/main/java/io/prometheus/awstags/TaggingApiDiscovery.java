package io.prometheus.awstags;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.resourcegroupstaggingapi.ResourceGroupsTaggingApiClient;
import software.amazon.awssdk.services.resourcegroupstaggingapi.model.GetResourcesRequest;
import software.amazon.awssdk.services.resourcegroupstaggingapi.model.GetResourcesResponse;
import software.amazon.awssdk.services.resourcegroupstaggingapi.model.ResourceTagMapping;

/** Finds resources through the Resource Groups Tagging API. */
final class TaggingApiDiscovery implements DiscoveryStrategy {
  private static final Logger LOGGER = Logger.getLogger(TaggingApiDiscovery.class.getName());

  private final ResourceGroupsTaggingApiClient taggingClient;
  private final RequestCounter requestCounter;

  TaggingApiDiscovery(ResourceGroupsTaggingApiClient taggingClient, RequestCounter requestCounter) {
    this.taggingClient = taggingClient;
    this.requestCounter = requestCounter;
  }

  @Override
  public List<TaggedResource> discover(Job job, String region) {
    ResourceType type = ResourceType.fromKey(job.type);
    GetResourcesRequest.Builder requestBuilder =
        GetResourcesRequest.builder().resourceTypeFilters(type.filters());

    List<TaggedResource> resources = new ArrayList<>();
    String paginationToken = null;
    int pageNum = 0;
    try {
      do {
        requestBuilder.paginationToken(paginationToken);
        GetResourcesResponse response = taggingClient.getResources(requestBuilder.build());
        pageNum++;
        requestCounter.inc("tagging", "getResources");

        for (ResourceTagMapping resourceTagMapping : response.resourceTagMappingList()) {
          String arn = resourceTagMapping.resourceARN();
          if (arn == null || arn.isEmpty()) {
            LOGGER.warning(String.format("Skipping %s resource without an ARN", job.type));
            continue;
          }
          TaggedResource resource =
              new TaggedResource(
                  arn,
                  toTags(resourceTagMapping.tags()),
                  job.type,
                  region);
          if (TagFilter.matches(resource.tags, job.searchTags)) {
            resources.add(resource);
          }
        }
        paginationToken = response.paginationToken();
      } while (paginationToken != null && !paginationToken.isEmpty() && pageNum < MAX_PAGES);
    } catch (SdkException e) {
      throw new DiscoveryException(
          String.format("getResources failed for %s in %s", job.type, region), resources, e);
    }
    return resources;
  }

  private static List<Tag> toTags(
      List<software.amazon.awssdk.services.resourcegroupstaggingapi.model.Tag> awsTags) {
    List<Tag> tags = new ArrayList<>(awsTags.size());
    for (software.amazon.awssdk.services.resourcegroupstaggingapi.model.Tag t : awsTags) {
      tags.add(new Tag(t.key(), t.value()));
    }
    return tags;
  }
}
