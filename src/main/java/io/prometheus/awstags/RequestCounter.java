package io.prometheus.awstags;

/** Receives one increment per AWS API page (or bulk listing) a discovery requests. */
interface RequestCounter {
  RequestCounter NOOP = (api, action) -> {};

  void inc(String api, String action);
}
