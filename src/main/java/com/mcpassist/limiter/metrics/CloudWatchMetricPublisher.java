package com.mcpassist.limiter.metrics;

import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.MetricDatum;
import software.amazon.awssdk.services.cloudwatch.model.PutMetricDataRequest;
import software.amazon.awssdk.services.cloudwatch.model.StandardUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal CloudWatch MetricPublisher. Labels become metric dimensions. This
 * implementation sends individual PutMetricData requests; for high request rates,
 * consider batching to avoid throttling and cost.
 */
public class CloudWatchMetricPublisher implements MetricPublisher {
  private final CloudWatchClient client;
  private final String namespace;
  private static final Logger logger = LoggerFactory.getLogger(CloudWatchMetricPublisher.class);

  public CloudWatchMetricPublisher(CloudWatchClient client, String namespace) {
    this.client = client;
    this.namespace = namespace == null ? "McpResilience" : namespace;
  }

  @Override
  public void incrementCounter(String name, long delta, Map<String, String> labels) {
    publishMetric(name, (double) delta, StandardUnit.COUNT, labels);
  }

  @Override
  public void gauge(String name, double value, Map<String, String> labels) {
    publishMetric(name, value, StandardUnit.NONE, labels);
  }

  @Override
  public void observe(String name, double value, Map<String, String> labels) {
    StandardUnit unit = name.endsWith("_seconds") ? StandardUnit.SECONDS : StandardUnit.NONE;
    publishMetric(name, value, unit, labels);
  }

  private void publishMetric(String name, double value, StandardUnit unit, Map<String, String> labels) {
    try {
      List<Dimension> dimensions = new ArrayList<>();
      if (labels != null) {
        // sorted for stable dimension order
        for (Map.Entry<String, String> label : new TreeMap<>(labels).entrySet()) {
          dimensions.add(Dimension.builder().name(label.getKey()).value(label.getValue()).build());
        }
      }
      MetricDatum datum = MetricDatum.builder()
          .metricName(name)
          .value(value)
          .unit(unit)
          .dimensions(dimensions)
          .build();
      PutMetricDataRequest req = PutMetricDataRequest.builder()
          .namespace(this.namespace)
          .metricData(datum)
          .build();
      client.putMetricData(req);
    } catch (Throwable t) {
      // best-effort; do not throw from metrics
      logger.warn("Failed to publish CloudWatch metric {}", name, t);
    }
  }
}
