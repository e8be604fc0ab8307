package io.prometheus.awstags;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The resource types the exporter can discover. Adding a type means adding a constant here.
 *
 * <p>Most types are found through the Resource Groups Tagging API using the listed resource type
 * filters. The tagging API does not index autoscaling groups or transit gateway attachments, and
 * API gateways need their names resolved, so those have their own {@link Source}.
 */
enum ResourceType {
  ALB("alb", "elasticloadbalancing:loadbalancer/app", "elasticloadbalancing:targetgroup"),
  API_GATEWAY("apigateway", Source.API_GATEWAY, "apigateway"),
  APPSYNC("appsync", "appsync"),
  CLOUDFRONT("cf", "cloudfront"),
  DYNAMODB("dynamodb", "dynamodb:table"),
  EBS("ebs", "ec2:volume"),
  ELASTICACHE("ec", "elasticache:cluster"),
  EC2("ec2", "ec2:instance"),
  ECS_SERVICE("ecs-svc", "ecs:cluster", "ecs:service"),
  ECS_CONTAINER_INSIGHTS("ecs-containerinsights", "ecs:cluster", "ecs:service"),
  EFS("efs", "elasticfilesystem:file-system"),
  ELB("elb", "elasticloadbalancing:loadbalancer"),
  EMR("emr", "elasticmapreduce:cluster"),
  ELASTICSEARCH("es", "es:domain"),
  FIREHOSE("firehose", "firehose"),
  FSX("fsx", "fsx:file-system"),
  KINESIS("kinesis", "kinesis:stream"),
  LAMBDA("lambda", "lambda:function"),
  NAT_GATEWAY("ngw", "ec2:natgateway"),
  NLB("nlb", "elasticloadbalancing:loadbalancer/net"),
  RDS("rds", "rds:db"),
  REDSHIFT("redshift", "redshift:cluster"),
  ROUTE53_RESOLVER("r53r", "route53resolver"),
  S3("s3", "s3"),
  STEP_FUNCTIONS("sfn", "states"),
  SNS("sns", "sns"),
  SQS("sqs", "sqs"),
  TRANSIT_GATEWAY("tgw", "ec2:transit-gateway"),
  VPN("vpn", "ec2:vpn-connection"),
  KAFKA("kafka", "kafka:cluster"),
  AUTOSCALING_GROUP("asg", Source.AUTOSCALING),
  TRANSIT_GATEWAY_ATTACHMENT("tgwa", Source.TRANSIT_GATEWAY_ATTACHMENT);

  enum Source {
    TAGGING_API,
    API_GATEWAY,
    AUTOSCALING,
    TRANSIT_GATEWAY_ATTACHMENT
  }

  private static final Map<String, ResourceType> BY_KEY = new HashMap<>();

  static {
    for (ResourceType type : values()) {
      BY_KEY.put(type.key, type);
    }
  }

  private final String key;
  private final Source source;
  private final List<String> filters;

  ResourceType(String key, String... filters) {
    this(key, Source.TAGGING_API, filters);
  }

  ResourceType(String key, Source source, String... filters) {
    this.key = key;
    this.source = source;
    this.filters = Collections.unmodifiableList(Arrays.asList(filters));
  }

  String key() {
    return key;
  }

  Source source() {
    return source;
  }

  /** Resource type filters for the tagging API, empty for types discovered elsewhere. */
  List<String> filters() {
    return filters;
  }

  static ResourceType fromKey(String key) {
    ResourceType type = BY_KEY.get(key);
    if (type == null) {
      throw new UnsupportedResourceTypeException(key);
    }
    return type;
  }
}
