package io.prometheus.awstags;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** A label-only sample describing one tagged resource. */
final class InfoMetric {
  final String name;
  final Map<String, String> labels;
  final double value;

  InfoMetric(String name, Map<String, String> labels, double value) {
    this.name = name;
    this.labels = Collections.unmodifiableMap(labels);
    this.value = value;
  }

  List<String> labelNames() {
    return new ArrayList<>(labels.keySet());
  }

  List<String> labelValues() {
    return new ArrayList<>(labels.values());
  }
}
