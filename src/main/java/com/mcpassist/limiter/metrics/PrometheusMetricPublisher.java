package com.mcpassist.limiter.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus-backed MetricPublisher. Registers every {@link ResilienceMetric} up front.
 * Counter increments are buffered and flushed to the collectors once per second;
 * gauges and histograms are written directly.
 */
public class PrometheusMetricPublisher implements MetricPublisher, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(PrometheusMetricPublisher.class);
  private static final String UNKNOWN_LABEL = "unknown";

  private final CollectorRegistry registry;
  private final Map<ResilienceMetric, Counter> counters = new EnumMap<>(ResilienceMetric.class);
  private final Map<ResilienceMetric, Gauge> gauges = new EnumMap<>(ResilienceMetric.class);
  private final Map<ResilienceMetric, Histogram> histograms = new EnumMap<>(ResilienceMetric.class);
  private final ConcurrentHashMap<BufferKey, AtomicLong> bufferedCounters = new ConcurrentHashMap<>();
  private final ScheduledExecutorService scheduler;

  public PrometheusMetricPublisher(CollectorRegistry registry, String namespace) {
    this.registry = registry == null ? CollectorRegistry.defaultRegistry : registry;
    String ns = namespace == null ? "mcp" : namespace;

    for (ResilienceMetric metric : ResilienceMetric.values()) {
      String[] labelNames = metric.labelNames().toArray(new String[0]);
      switch (metric.type()) {
        case COUNTER:
          counters.put(metric, Counter.build()
              .namespace(ns)
              .name(metric.metricName())
              .help(metric.help())
              .labelNames(labelNames)
              .register(this.registry));
          break;
        case GAUGE:
          gauges.put(metric, Gauge.build()
              .namespace(ns)
              .name(metric.metricName())
              .help(metric.help())
              .labelNames(labelNames)
              .register(this.registry));
          break;
        case HISTOGRAM:
          histograms.put(metric, histogramFor(metric, ns, labelNames));
          break;
        default:
          throw new IllegalStateException("Unknown metric type: " + metric.type());
      }
    }

    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread t = new Thread(r, "prometheus-metric-flusher");
      t.setDaemon(true);
      return t;
    });
    // periodic flush from buffers to actual Prometheus counters (1s)
    this.scheduler.scheduleAtFixedRate(this::flushBuffers, 1, 1, TimeUnit.SECONDS);
  }

  private Histogram histogramFor(ResilienceMetric metric, String ns, String[] labelNames) {
    Histogram.Builder builder = Histogram.build()
        .namespace(ns)
        .name(metric.metricName())
        .help(metric.help())
        .labelNames(labelNames);
    if (metric == ResilienceMetric.RETRY_DELAY_SECONDS) {
      builder.exponentialBuckets(0.1, 2, 10);
    } else {
      builder.buckets(1, 2, 3, 4, 5, 10, 20);
    }
    return builder.register(registry);
  }

  @Override
  public void incrementCounter(String name, long delta, Map<String, String> labels) {
    ResilienceMetric.byName(name)
        .filter(counters::containsKey)
        .ifPresent(metric -> bufferedCounters
            .computeIfAbsent(new BufferKey(metric, labelValues(metric, labels)), k -> new AtomicLong())
            .addAndGet(delta));
  }

  @Override
  public void gauge(String name, double value, Map<String, String> labels) {
    ResilienceMetric.byName(name)
        .filter(gauges::containsKey)
        .ifPresent(metric -> gauges.get(metric)
            .labels(labelValues(metric, labels).toArray(new String[0]))
            .set(value));
  }

  @Override
  public void observe(String name, double value, Map<String, String> labels) {
    ResilienceMetric.byName(name)
        .filter(histograms::containsKey)
        .ifPresent(metric -> histograms.get(metric)
            .labels(labelValues(metric, labels).toArray(new String[0]))
            .observe(value));
  }

  @Override
  public void flush() {
    flushBuffers();
  }

  private static List<String> labelValues(ResilienceMetric metric, Map<String, String> labels) {
    Map<String, String> source = labels == null ? Map.of() : labels;
    return metric.labelNames().stream()
        .map(label -> {
          String value = source.get(label);
          return value == null || value.isEmpty() ? UNKNOWN_LABEL : value;
        })
        .collect(Collectors.toUnmodifiableList());
  }

  private void flushBuffers() {
    try {
      for (Map.Entry<BufferKey, AtomicLong> entry : bufferedCounters.entrySet()) {
        long delta = entry.getValue().getAndSet(0);
        if (delta > 0) {
          BufferKey key = entry.getKey();
          counters.get(key.metric).labels(key.labelValues.toArray(new String[0])).inc(delta);
        }
      }
    } catch (Throwable t) {
      logger.warn("Error flushing Prometheus buffers", t);
    }
  }

  @Override
  public void close() {
    try {
      scheduler.shutdown();
      scheduler.awaitTermination(1, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    // flush remaining
    flushBuffers();
  }

  private static final class BufferKey {
    private final ResilienceMetric metric;
    private final List<String> labelValues;

    BufferKey(ResilienceMetric metric, List<String> labelValues) {
      this.metric = metric;
      this.labelValues = labelValues;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof BufferKey)) return false;
      BufferKey other = (BufferKey) o;
      return metric == other.metric && labelValues.equals(other.labelValues);
    }

    @Override
    public int hashCode() {
      return Objects.hash(metric, labelValues);
    }
  }
}
