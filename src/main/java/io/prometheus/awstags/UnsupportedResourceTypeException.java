package io.prometheus.awstags;

class UnsupportedResourceTypeException extends IllegalArgumentException {
  private static final long serialVersionUID = -4417393047751320316L;

  UnsupportedResourceTypeException(String type) {
    super("Not implemented resource type: " + type);
  }
}
