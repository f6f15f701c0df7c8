package com.mcpassist.limiter.metrics;

import java.util.List;
import java.util.Optional;

/**
 * Catalogue of the metrics emitted by the resilience components.
 */
public enum ResilienceMetric {
  CIRCUIT_BREAKER_STATE(Type.GAUGE, "circuit_breaker_state",
      "Current state of the circuit breaker (0=closed, 1=half-open, 2=open)", "name"),
  CIRCUIT_BREAKER_TRANSITIONS(Type.COUNTER, "circuit_breaker_transitions_total",
      "Total number of circuit breaker state transitions", "name", "from_state", "to_state"),
  CIRCUIT_BREAKER_REQUESTS_REJECTED(Type.COUNTER, "circuit_breaker_requests_rejected_total",
      "Total number of requests rejected by a circuit breaker", "name"),
  CIRCUIT_BREAKER_REQUESTS_ALLOWED(Type.COUNTER, "circuit_breaker_requests_allowed_total",
      "Total number of requests allowed by a circuit breaker", "name"),

  RATELIMIT_ALLOWED(Type.COUNTER, "ratelimit_allowed_total",
      "Total number of requests allowed by rate limiter", "tool", "mode"),
  RATELIMIT_REJECTED(Type.COUNTER, "ratelimit_rejected_total",
      "Total number of requests rejected by rate limiter", "tool", "mode"),
  RATELIMIT_LIMIT_EXCEEDED(Type.COUNTER, "ratelimit_limit_exceeded_total",
      "Total number of times rate limit was exceeded", "tool", "mode"),
  RATELIMIT_CURRENT(Type.GAUGE, "ratelimit_current",
      "Current number of requests in the rate limit window", "tool", "mode"),
  RATELIMIT_STORE_FAILURES(Type.COUNTER, "ratelimit_store_failures_total",
      "Number of counter store failures observed by the rate limiter", "tool", "mode"),

  RETRIES(Type.COUNTER, "retries_total",
      "Total number of retried operations per tool and result", "tool", "result"),
  RETRY_ATTEMPTS(Type.HISTOGRAM, "retry_attempts",
      "Distribution of retry attempts", "tool"),
  RETRY_DELAY_SECONDS(Type.HISTOGRAM, "retry_delay_seconds",
      "Distribution of retry delays in seconds", "tool");

  public enum Type { COUNTER, GAUGE, HISTOGRAM }

  private final Type type;
  private final String metricName;
  private final String help;
  private final List<String> labelNames;

  ResilienceMetric(Type type, String metricName, String help, String... labelNames) {
    this.type = type;
    this.metricName = metricName;
    this.help = help;
    this.labelNames = List.of(labelNames);
  }

  public Type type() { return type; }

  public String metricName() { return metricName; }

  public String help() { return help; }

  public List<String> labelNames() { return labelNames; }

  public static Optional<ResilienceMetric> byName(String name) {
    for (ResilienceMetric metric : values()) {
      if (metric.metricName.equals(name)) {
        return Optional.of(metric);
      }
    }
    return Optional.empty();
  }
}
