package com.mcpassist.limiter.metrics;

import java.util.Map;

/**
 * Default publisher so that components run without any metrics backend.
 */
public class NoOpMetricPublisher implements MetricPublisher {
    public static final NoOpMetricPublisher INSTANCE = new NoOpMetricPublisher();

    @Override public void incrementCounter(String name, long delta, Map<String, String> labels) {}
    @Override public void gauge(String name, double value, Map<String, String> labels) {}
}
