package io.prometheus.awstags;

final class LabelNames {
  private LabelNames() {}

  static String toSnakeCase(String str) {
    return str.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
  }

  static String safeName(String s) {
    // Change invalid chars to underscore, and merge underscores.
    return s.replaceAll("[^a-zA-Z0-9:_]", "_").replaceAll("__+", "_");
  }

  static String safeLabelName(String s) {
    // Change invalid chars to underscore, and merge underscores.
    return s.replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("__+", "_");
  }

  /** {@code ecs-svc} becomes {@code aws_ecs_svc_info}. */
  static String infoMetricName(String service) {
    return safeName("aws_" + service.toLowerCase() + "_info");
  }

  /**
   * The label carrying a tag's value. Tag keys are lower cased; with {@code snakeCase} camel case
   * keys are split first, so {@code CostCenter} becomes {@code tag_cost_center} instead of {@code
   * tag_costcenter}.
   */
  static String tagLabelName(String tagKey, boolean snakeCase) {
    String key = snakeCase ? toSnakeCase(tagKey) : tagKey.toLowerCase();
    return safeLabelName("tag_" + key);
  }
}
