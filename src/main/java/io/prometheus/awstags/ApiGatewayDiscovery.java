package io.prometheus.awstags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.apigateway.ApiGatewayClient;
import software.amazon.awssdk.services.apigateway.model.GetRestApisRequest;
import software.amazon.awssdk.services.apigateway.model.GetRestApisResponse;
import software.amazon.awssdk.services.apigateway.model.RestApi;

/**
 * Finds API gateways through the tagging API and replaces their ids with the REST API names.
 *
 * <p>The tagging API returns REST APIs as {@code arn:aws:apigateway:<region>::/restapis/<id>/...}.
 * Resources without a {@code /restapis} path, or whose REST API cannot be found, are dropped.
 */
final class ApiGatewayDiscovery implements DiscoveryStrategy {
  private static final Logger LOGGER = Logger.getLogger(ApiGatewayDiscovery.class.getName());

  // 500 is the largest page getRestApis accepts
  static final int REST_API_PAGE_SIZE = 500;
  static final int MAX_REST_API_PAGES = 10;

  private final DiscoveryStrategy taggingApiDiscovery;
  private final ApiGatewayClient apiGatewayClient;
  private final RequestCounter requestCounter;

  ApiGatewayDiscovery(
      DiscoveryStrategy taggingApiDiscovery,
      ApiGatewayClient apiGatewayClient,
      RequestCounter requestCounter) {
    this.taggingApiDiscovery = taggingApiDiscovery;
    this.apiGatewayClient = apiGatewayClient;
    this.requestCounter = requestCounter;
  }

  @Override
  public List<TaggedResource> discover(Job job, String region) {
    List<TaggedResource> resources;
    DiscoveryException taggingFailure = null;
    try {
      resources = taggingApiDiscovery.discover(job, region);
    } catch (DiscoveryException e) {
      taggingFailure = e;
      resources = e.getPartialResources();
    }

    Map<String, String> restApiNames = new HashMap<>();
    try {
      for (RestApi restApi : listRestApis()) {
        restApiNames.putIfAbsent(restApi.id(), restApi.name());
      }
    } catch (SdkException e) {
      // Unnamed resources are never exported, so nothing survives a failed listing
      throw new DiscoveryException(
          String.format("getRestApis failed in %s", region), Collections.emptyList(), e);
    }

    List<TaggedResource> namedResources = nameResources(resources, restApiNames);
    if (taggingFailure != null) {
      throw new DiscoveryException(
          taggingFailure.getMessage(), namedResources, taggingFailure.getCause());
    }
    return namedResources;
  }

  private static List<TaggedResource> nameResources(
      List<TaggedResource> resources, Map<String, String> restApiNames) {
    List<TaggedResource> namedResources = new ArrayList<>();
    for (TaggedResource resource : resources) {
      if (!resource.id.contains("/restapis")) {
        continue;
      }
      String restApiId = restApiId(resource.id);
      String name = restApiId != null ? restApiNames.get(restApiId) : null;
      if (name == null) {
        LOGGER.warning(
            String.format(
                "Dropping API gateway resource %s: no REST API found for id %s",
                resource.id, restApiId));
        continue;
      }
      resource.matcher(name);
      namedResources.add(resource);
    }
    return namedResources;
  }

  /** The third {@code /} separated segment of the ARN, or null if there is none. */
  static String restApiId(String arn) {
    String[] segments = arn.split("/");
    if (segments.length < 3) {
      return null;
    }
    return segments[2];
  }

  private List<RestApi> listRestApis() {
    requestCounter.inc("apigateway", "getRestApis");

    List<RestApi> restApis = new ArrayList<>();
    GetRestApisRequest.Builder requestBuilder =
        GetRestApisRequest.builder().limit(REST_API_PAGE_SIZE);
    String position = null;
    int pageNum = 0;
    do {
      requestBuilder.position(position);
      GetRestApisResponse response = apiGatewayClient.getRestApis(requestBuilder.build());
      pageNum++;
      restApis.addAll(response.items());
      position = response.position();
    } while (position != null && !position.isEmpty() && pageNum < MAX_REST_API_PAGES);
    return restApis;
  }
}
