package io.prometheus.awstags;

import java.util.Collections;
import java.util.List;

/**
 * An AWS call failed part way through a discovery. The resources collected before the failure
 * are kept; callers must treat them as incomplete.
 */
class DiscoveryException extends RuntimeException {
  private static final long serialVersionUID = 2650385237744104613L;

  private final transient List<TaggedResource> partialResources;

  DiscoveryException(String message, List<TaggedResource> partialResources, Throwable cause) {
    super(message, cause);
    this.partialResources = Collections.unmodifiableList(partialResources);
  }

  List<TaggedResource> getPartialResources() {
    return partialResources;
  }
}
