package io.prometheus.awstags;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** One configured discovery: a resource type, the regions to scan and the tags to require. */
final class Job {
  final String type;
  final List<String> regions;
  final List<Tag> searchTags;

  Job(String type, List<String> regions, List<Tag> searchTags) {
    this.type = type;
    this.regions = Collections.unmodifiableList(regions);
    this.searchTags = Collections.unmodifiableList(searchTags);
  }

  Job(String type, List<Tag> searchTags) {
    this(type, Collections.emptyList(), searchTags);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Job that = (Job) o;

    if (!Objects.equals(type, that.type)) return false;
    if (!Objects.equals(regions, that.regions)) return false;
    return Objects.equals(searchTags, that.searchTags);
  }

  @Override
  public int hashCode() {
    int result = type != null ? type.hashCode() : 0;
    result = 31 * result + (regions != null ? regions.hashCode() : 0);
    result = 31 * result + (searchTags != null ? searchTags.hashCode() : 0);
    return result;
  }
}
