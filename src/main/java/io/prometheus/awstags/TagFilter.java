package io.prometheus.awstags;

import java.util.List;

final class TagFilter {
  private TagFilter() {}

  /** Check that every search tag is present on the resource with exactly the same value */
  static boolean matches(List<Tag> tags, List<Tag> searchTags) {
    for (Tag searchTag : searchTags) {
      if (!tags.contains(searchTag)) {
        return false;
      }
    }
    return true;
  }
}
