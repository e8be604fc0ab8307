package io.prometheus.awstags;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Picks the discovery strategy for a job's resource type and runs it against one region. */
class TagDiscovery {
  private static final Logger LOGGER = Logger.getLogger(TagDiscovery.class.getName());

  private final Map<ResourceType.Source, Function<String, DiscoveryStrategy>> strategies =
      new EnumMap<>(ResourceType.Source.class);

  TagDiscovery(AwsClientProvider clients, RequestCounter requestCounter) {
    strategies.put(
        ResourceType.Source.TAGGING_API,
        region -> new TaggingApiDiscovery(clients.taggingClient(region), requestCounter));
    strategies.put(
        ResourceType.Source.API_GATEWAY,
        region ->
            new ApiGatewayDiscovery(
                new TaggingApiDiscovery(clients.taggingClient(region), requestCounter),
                clients.apiGatewayClient(region),
                requestCounter));
    strategies.put(
        ResourceType.Source.AUTOSCALING,
        region -> new AutoScalingGroupDiscovery(clients.autoScalingClient(region), requestCounter));
    strategies.put(
        ResourceType.Source.TRANSIT_GATEWAY_ATTACHMENT,
        region -> new TransitGatewayAttachmentDiscovery(clients.ec2Client(region), requestCounter));
  }

  /**
   * Discover the tagged resources of one job in one region.
   *
   * @throws UnsupportedResourceTypeException if the job's type is unknown
   * @throws DiscoveryException if an AWS call fails, carrying what was found until then
   */
  List<TaggedResource> discover(Job job, String region) {
    ResourceType type = ResourceType.fromKey(job.type);
    DiscoveryStrategy strategy = strategies.get(type.source()).apply(region);
    List<TaggedResource> resources = strategy.discover(job, region);
    if (LOGGER.isLoggable(Level.FINE)) {
      LOGGER.fine(
          String.format("Discovered %d %s resource(s) in %s", resources.size(), job.type, region));
    }
    return resources;
  }
}
