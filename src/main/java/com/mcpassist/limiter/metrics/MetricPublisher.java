package com.mcpassist.limiter.metrics;

import java.util.Map;

/**
 * Metrics sink injected into the limiter, the circuit breakers and the retry executors.
 *
 * <p>Names come from {@link ResilienceMetric}; labels are matched to the metric's
 * label names by key. Implementations must not throw.</p>
 */
public interface MetricPublisher {

  void incrementCounter(String name, long delta, Map<String, String> labels);

  void gauge(String name, double value, Map<String, String> labels);

  /**
   * Records one observation of a distribution (histogram) metric.
   */
  default void observe(String name, double value, Map<String, String> labels) {}

  default void incrementCounter(String name, long delta) {
    incrementCounter(name, delta, Map.of());
  }

  default void gauge(String name, double value) {
    gauge(name, value, Map.of());
  }

  default void flush() {}
}
