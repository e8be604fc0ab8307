package io.prometheus.awstags;

import java.util.logging.Level;
import java.util.logging.Logger;
import sun.misc.Signal;

/** Reloads the configuration on SIGHUP. */
class ReloadSignalHandler {
  private static final Logger LOGGER = Logger.getLogger(ReloadSignalHandler.class.getName());

  protected static void start(final TagsCollector collector) {
    Signal.handle(
        new Signal("HUP"),
        signal -> {
          try {
            collector.reloadConfig();
          } catch (Exception e) {
            LOGGER.log(Level.WARNING, "Configuration reload failed", e);
          }
        });
  }
}
