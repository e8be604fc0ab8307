package io.prometheus.awstags;

import java.util.List;

interface DiscoveryStrategy {
  int MAX_PAGES = 100;

  List<TaggedResource> discover(Job job, String region);
}
