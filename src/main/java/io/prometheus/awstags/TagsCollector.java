package io.prometheus.awstags;

import io.prometheus.client.Collector;
import io.prometheus.client.Collector.Describable;
import io.prometheus.client.Counter;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

public class TagsCollector extends Collector implements Describable {
  private static final Logger LOGGER = Logger.getLogger(TagsCollector.class.getName());

  static class ActiveConfig {
    List<Job> jobs;
    AwsClientProvider clients;
    TagDiscovery discovery;
    InfoMetricMaterializer materializer;

    public ActiveConfig(ActiveConfig cfg) {
      this.jobs = new ArrayList<>(cfg.jobs);
      this.clients = cfg.clients;
      this.discovery = cfg.discovery;
      this.materializer = cfg.materializer;
    }

    public ActiveConfig() {}
  }

  ActiveConfig activeConfig = new ActiveConfig();

  private static final Counter awsApiRequests =
      Counter.build()
          .labelNames("api", "action")
          .name("aws_tags_api_requests_total")
          .help("API requests made to AWS to discover tagged resources")
          .register();

  private static final RequestCounter REQUEST_COUNTER =
      (api, action) -> awsApiRequests.labels(api, action).inc();

  public TagsCollector(Reader in) {
    loadConfig(in, null);
  }

  public TagsCollector(String yamlConfig) {
    this(yamlConfig, null);
  }

  /* For unittests. */
  protected TagsCollector(String yamlConfig, AwsClientProvider clients) {
    this(
        (Map<String, Object>) new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlConfig),
        clients);
  }

  private TagsCollector(Map<String, Object> config, AwsClientProvider clients) {
    loadConfig(config, clients);
  }

  @Override
  public List<MetricFamilySamples> describe() {
    return Collections.emptyList();
  }

  protected void reloadConfig() throws IOException {
    LOGGER.log(Level.INFO, "Reloading configuration");
    try (FileReader reader = new FileReader(WebServer.configFilePath); ) {
      loadConfig(reader, activeConfig.clients);
    }
  }

  protected void loadConfig(Reader in, AwsClientProvider clients) {
    loadConfig(
        (Map<String, Object>) new Yaml(new SafeConstructor(new LoaderOptions())).load(in), clients);
  }

  private void loadConfig(Map<String, Object> config, AwsClientProvider clients) {
    if (config == null) { // Yaml config empty, set config to empty map.
      config = new HashMap<>();
    }

    String defaultRegion = (String) config.get("region");

    boolean labelsSnakeCase = false;
    if (config.containsKey("labels_snake_case")) {
      labelsSnakeCase = (Boolean) config.get("labels_snake_case");
    }

    if (clients == null) {
      clients =
          new DefaultAwsClientProvider(
              (String) config.get("role_arn"), (String) config.get("assume_role_web_identity"));
    }

    if (!config.containsKey("jobs")) {
      throw new IllegalArgumentException("Must provide jobs");
    }

    List<Job> jobs = new ArrayList<>();
    for (Object jobObject : (List<Object>) config.get("jobs")) {
      Map<String, Object> yamlJob = (Map<String, Object>) jobObject;
      if (!yamlJob.containsKey("type")) {
        throw new IllegalArgumentException("Must provide type for every job");
      }
      String type = (String) yamlJob.get("type");
      // Unknown types are a configuration mistake, fail now rather than on every scrape
      ResourceType.fromKey(type);

      List<String> regions;
      if (yamlJob.containsKey("regions")) {
        regions = (List<String>) yamlJob.get("regions");
      } else if (defaultRegion != null) {
        regions = Collections.singletonList(defaultRegion);
      } else {
        throw new IllegalArgumentException("Must provide regions for job " + type + " or region");
      }

      List<Tag> searchTags = new ArrayList<>();
      if (yamlJob.containsKey("search_tags")) {
        for (Object tagObject : (List<Object>) yamlJob.get("search_tags")) {
          Map<String, Object> yamlTag = (Map<String, Object>) tagObject;
          if (!yamlTag.containsKey("key") || !yamlTag.containsKey("value")) {
            throw new IllegalArgumentException("Must provide key and value for search_tags");
          }
          searchTags.add(
              new Tag(String.valueOf(yamlTag.get("key")), String.valueOf(yamlTag.get("value"))));
        }
      }
      jobs.add(new Job(type, regions, searchTags));
    }

    loadConfig(
        jobs,
        clients,
        new TagDiscovery(clients, REQUEST_COUNTER),
        new InfoMetricMaterializer(labelsSnakeCase));
  }

  private void loadConfig(
      List<Job> jobs,
      AwsClientProvider clients,
      TagDiscovery discovery,
      InfoMetricMaterializer materializer) {
    synchronized (activeConfig) {
      activeConfig.jobs = jobs;
      activeConfig.clients = clients;
      activeConfig.discovery = discovery;
      activeConfig.materializer = materializer;
    }
  }

  /** @return true if every job was discovered completely */
  private boolean scrape(List<MetricFamilySamples> mfs) {
    ActiveConfig config;
    synchronized (activeConfig) {
      config = new ActiveConfig(activeConfig);
    }

    boolean complete = true;
    List<TaggedResource> resources = new ArrayList<>();
    for (Job job : config.jobs) {
      for (String region : job.regions) {
        try {
          resources.addAll(config.discovery.discover(job, region));
        } catch (DiscoveryException e) {
          complete = false;
          resources.addAll(e.getPartialResources());
          LOGGER.log(
              Level.WARNING,
              String.format(
                  "Discovery of %s in %s failed, resources may be missing", job.type, region),
              e);
        }
      }
    }

    Map<String, List<MetricFamilySamples.Sample>> samplesByName = new LinkedHashMap<>();
    for (InfoMetric metric : config.materializer.materialize(resources)) {
      samplesByName
          .computeIfAbsent(metric.name, n -> new ArrayList<>())
          .add(
              new MetricFamilySamples.Sample(
                  metric.name, metric.labelNames(), metric.labelValues(), metric.value));
    }
    for (Map.Entry<String, List<MetricFamilySamples.Sample>> entry : samplesByName.entrySet()) {
      mfs.add(
          new MetricFamilySamples(
              entry.getKey(),
              Type.GAUGE,
              "Tags of AWS resources, one sample per resource",
              entry.getValue()));
    }
    return complete;
  }

  public List<MetricFamilySamples> collect() {
    long start = System.nanoTime();
    double error = 0;
    List<MetricFamilySamples> mfs = new ArrayList<>();
    try {
      if (!scrape(mfs)) {
        error = 1;
      }
    } catch (Exception e) {
      error = 1;
      LOGGER.log(Level.WARNING, "AWS tags scrape failed", e);
    }
    List<MetricFamilySamples.Sample> samples = new ArrayList<>();
    samples.add(
        new MetricFamilySamples.Sample(
            "aws_tags_exporter_scrape_duration_seconds",
            new ArrayList<>(),
            new ArrayList<>(),
            (System.nanoTime() - start) / 1.0E9));
    mfs.add(
        new MetricFamilySamples(
            "aws_tags_exporter_scrape_duration_seconds",
            Type.GAUGE,
            "Time this AWS tags scrape took, in seconds.",
            samples));

    samples = new ArrayList<>();
    samples.add(
        new MetricFamilySamples.Sample(
            "aws_tags_exporter_scrape_error", new ArrayList<>(), new ArrayList<>(), error));
    mfs.add(
        new MetricFamilySamples(
            "aws_tags_exporter_scrape_error",
            Type.GAUGE,
            "Non-zero if this scrape failed.",
            samples));
    return mfs;
  }
}
