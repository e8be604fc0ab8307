package io.prometheus.awstags;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a scrape's tagged resources into {@code aws_<service>_info} metrics.
 *
 * <p>All metrics of a service get the same label names: {@code name} plus one {@code tag_<key>}
 * label for every tag key seen on any resource of that service. A resource without one of those
 * tags gets an empty value for it. The label names are only known once the whole batch has been
 * seen, so this is done in two passes.
 */
final class InfoMetricMaterializer {
  static final String NAME_LABEL = "name";

  private final boolean snakeCaseTagLabels;

  InfoMetricMaterializer(boolean snakeCaseTagLabels) {
    this.snakeCaseTagLabels = snakeCaseTagLabels;
  }

  List<InfoMetric> materialize(List<TaggedResource> resources) {
    Map<String, Set<String>> tagKeysByService = new HashMap<>();
    for (TaggedResource resource : resources) {
      Set<String> tagKeys =
          tagKeysByService.computeIfAbsent(resource.service, s -> new LinkedHashSet<>());
      for (Tag tag : resource.tags) {
        tagKeys.add(tag.key);
      }
    }

    List<InfoMetric> metrics = new ArrayList<>(resources.size());
    for (TaggedResource resource : resources) {
      Map<String, String> labels = new LinkedHashMap<>();
      labels.put(NAME_LABEL, resource.displayName());
      for (String tagKey : tagKeysByService.get(resource.service)) {
        // keys that only differ in case share a label, don't let a missing one blank the other
        labels.putIfAbsent(LabelNames.tagLabelName(tagKey, snakeCaseTagLabels), "");
      }
      for (Tag tag : resource.tags) {
        labels.put(
            LabelNames.tagLabelName(tag.key, snakeCaseTagLabels),
            tag.value != null ? tag.value : "");
      }
      metrics.add(new InfoMetric(LabelNames.infoMetricName(resource.service), labels, 0));
    }
    return metrics;
  }
}
