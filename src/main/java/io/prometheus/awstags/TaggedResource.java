package io.prometheus.awstags;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A discovered resource in the shape shared by every discovery path.
 *
 * <p>{@link #id} is the ARN, or a synthesized equivalent where the service has none. {@link
 * #matcher} replaces it as the display identity once set.
 */
final class TaggedResource {
  final String id;
  final List<Tag> tags;
  final String service;
  final String region;
  private String matcher;

  TaggedResource(String id, List<Tag> tags, String service, String region) {
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("Resource id must not be empty");
    }
    this.id = id;
    this.tags = Collections.unmodifiableList(tags);
    this.service = service;
    this.region = region;
  }

  String matcher() {
    return matcher;
  }

  void matcher(String matcher) {
    if (this.matcher != null) {
      throw new IllegalStateException("Matcher already set for " + id);
    }
    this.matcher = matcher;
  }

  String displayName() {
    return matcher != null ? matcher : id;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    TaggedResource that = (TaggedResource) o;

    if (!id.equals(that.id)) return false;
    if (!Objects.equals(matcher, that.matcher)) return false;
    if (!tags.equals(that.tags)) return false;
    if (!Objects.equals(service, that.service)) return false;
    return Objects.equals(region, that.region);
  }

  @Override
  public int hashCode() {
    int result = id.hashCode();
    result = 31 * result + (matcher != null ? matcher.hashCode() : 0);
    result = 31 * result + tags.hashCode();
    result = 31 * result + (service != null ? service.hashCode() : 0);
    result = 31 * result + (region != null ? region.hashCode() : 0);
    return result;
  }

  @Override
  public String toString() {
    return service + "/" + region + "/" + displayName() + tags;
  }
}
