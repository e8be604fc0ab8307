package io.prometheus.awstags;

import io.prometheus.client.Collector;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

public class BuildInfoCollector extends Collector {
  private static final Logger LOGGER = Logger.getLogger(BuildInfoCollector.class.getName());

  static final String BUILD_INFO_RESOURCE = "aws_tags_exporter.properties";

  public List<MetricFamilySamples> collect() {
    List<MetricFamilySamples> mfs = new ArrayList<>();
    List<String> labelNames = new ArrayList<>();
    List<String> labelValues = new ArrayList<>();

    String buildVersion = "unknown";
    String releaseDate = "unknown";
    try (InputStream in =
        BuildInfoCollector.class.getClassLoader().getResourceAsStream(BUILD_INFO_RESOURCE)) {
      if (in == null) {
        throw new IOException(BUILD_INFO_RESOURCE + " not found on the classpath");
      }
      Properties properties = new Properties();
      properties.load(in);
      buildVersion = properties.getProperty("BuildVersion", buildVersion);
      releaseDate = properties.getProperty("ReleaseDate", releaseDate);
    } catch (IOException e) {
      LOGGER.log(Level.WARNING, "AWS tags exporter build info scrape failed", e);
    }

    labelNames.add("build_version");
    labelValues.add(buildVersion);
    labelNames.add("release_date");
    labelValues.add(releaseDate);

    List<MetricFamilySamples.Sample> samples = new ArrayList<>();
    samples.add(
        new MetricFamilySamples.Sample(
            "aws_tags_exporter_build_info", labelNames, labelValues, 1));
    mfs.add(
        new MetricFamilySamples(
            "aws_tags_exporter_build_info",
            Type.GAUGE,
            "Build information of the AWS tags exporter.",
            samples));

    return mfs;
  }
}
