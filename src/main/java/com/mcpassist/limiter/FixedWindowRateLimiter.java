package com.mcpassist.limiter;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.mcpassist.limiter.metrics.MetricPublisher;
import com.mcpassist.limiter.metrics.NoOpMetricPublisher;
import com.mcpassist.limiter.metrics.ResilienceMetric;
import com.mcpassist.store.CounterStore;
import com.mcpassist.store.CounterStoreException;
import com.mcpassist.store.CounterStores;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-window rate limiter over a {@link CounterStore}.
 *
 * Each key owns one counter; the first increment of a window starts it and the counter
 * restarts once the window has elapsed. Per-tool overrides apply to keys in the per-tool
 * shape ({@code prefix:tool:<tool>:<client>}). The configured {@link Algorithm} is only
 * reported, counting is always fixed-window.
 */
public class FixedWindowRateLimiter implements RateLimiter {
  private static final Logger logger = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

  private static final String TOOL_SEGMENT = "tool";
  private static final String UNKNOWN_TOOL = "unknown";

  private final RateLimitConfig config;
  private final CounterStore store;
  private final Clock clock;
  private final MetricPublisher metricPublisher;
  private final Map<String, ToolRateLimit> toolConfigs = new ConcurrentHashMap<>();

  private FixedWindowRateLimiter(Builder builder) {
    this.config = builder.config;
    this.clock = builder.clock;
    this.store = builder.store != null ? builder.store : CounterStores.create(config.getStoreType(), clock);
    this.metricPublisher = builder.metricPublisher == null ? NoOpMetricPublisher.INSTANCE : builder.metricPublisher;
    logger.info("Rate limiter started: {}", config);
  }

  public static Builder newBuilder(RateLimitConfig config) {
    return new Builder(config);
  }

  @Override
  public boolean allow(String key) throws CounterStoreException {
    Objects.requireNonNull(key, "key");
    if (!config.isEnabled()) {
      return true;
    }

    Optional<String> tool = extractToolName(key);
    ToolRateLimit effective = effectiveLimit(tool);
    String toolLabel = tool.orElse(UNKNOWN_TOOL);
    Map<String, String> labels = labels(toolLabel);

    int count;
    try {
      count = store.increment(key, effective.getWindow());
    } catch (CounterStoreException e) {
      logger.error("Failed to increment rate limit counter for key {}", key, e);
      metricPublisher.incrementCounter(ResilienceMetric.RATELIMIT_STORE_FAILURES.metricName(), 1, labels);
      throw e;
    }

    boolean allowed = count <= effective.getLimit();
    if (allowed) {
      metricPublisher.incrementCounter(ResilienceMetric.RATELIMIT_ALLOWED.metricName(), 1, labels);
      logger.debug("Rate limit check passed: key={} count={} limit={}", key, count, effective.getLimit());
    } else {
      metricPublisher.incrementCounter(ResilienceMetric.RATELIMIT_REJECTED.metricName(), 1, labels);
      metricPublisher.incrementCounter(ResilienceMetric.RATELIMIT_LIMIT_EXCEEDED.metricName(), 1, labels);
      logger.warn("Rate limit exceeded: key={} tool={} count={} limit={} window={}",
          key, toolLabel, count, effective.getLimit(), effective.getWindow());
    }
    metricPublisher.gauge(ResilienceMetric.RATELIMIT_CURRENT.metricName(), count, labels);
    return allowed;
  }

  @Override
  public void reset(String key) throws CounterStoreException {
    store.reset(key);
    logger.debug("Rate limit counter reset: key={}", key);
  }

  @Override
  public RateLimitStats stats(String key) throws CounterStoreException {
    ToolRateLimit effective = effectiveLimit(extractToolName(key));
    int current = store.get(key);
    return new RateLimitStats(effective.getLimit(), effective.getWindow(), current,
        clock.instant().plus(effective.getWindow()));
  }

  /**
   * Registers an override for one tool.
   *
   * @throws IllegalArgumentException if the override is enabled with invalid values
   */
  public void setToolConfig(String toolName, ToolRateLimit toolConfig) {
    Objects.requireNonNull(toolName, "toolName");
    Objects.requireNonNull(toolConfig, "toolConfig");
    toolConfig.validate();
    toolConfigs.put(toolName, toolConfig);
    logger.debug("Tool rate limit updated: tool={} limit={} window={}",
        toolName, toolConfig.getLimit(), toolConfig.getWindow());
  }

  /**
   * The override registered for the tool, or the default override (50 per minute).
   */
  public ToolRateLimit getToolConfig(String toolName) {
    ToolRateLimit toolConfig = toolConfigs.get(toolName);
    return toolConfig != null ? toolConfig : ToolRateLimit.defaults(config.isEnabled());
  }

  @Override
  public String generateKey(String toolName, String clientId) {
    return generateKey(config.getMode(), config.getKeyPrefix(), toolName, clientId);
  }

  /**
   * Builds the key for a mode. Empty prefixes and client ids drop their segment.
   */
  public static String generateKey(KeyMode mode, String prefix, String toolName, String clientId) {
    StringBuilder key = new StringBuilder();
    if (!isEmpty(prefix)) {
      key.append(prefix).append(':');
    }
    switch (mode) {
      case PER_TOOL:
        key.append(TOOL_SEGMENT).append(':');
        if (!isEmpty(toolName)) {
          key.append(toolName);
        }
        if (!isEmpty(clientId)) {
          key.append(':').append(clientId);
        }
        break;
      case GLOBAL:
        key.append("global:");
        if (!isEmpty(clientId)) {
          key.append(clientId);
        }
        break;
      case IP_BASED:
        key.append("ip:");
        if (!isEmpty(clientId)) {
          key.append(clientId);
        }
        break;
      case CUSTOM:
        if (!isEmpty(clientId)) {
          key.append(clientId);
        }
        break;
      default:
        throw new IllegalArgumentException("unsupported key mode: " + mode);
    }
    return key.toString();
  }

  /**
   * Tool name encoded in a per-tool key, empty for any other shape.
   */
  public Optional<String> extractToolName(String key) {
    if (key == null) {
      return Optional.empty();
    }
    String rest = key;
    String prefix = config.getKeyPrefix();
    if (!isEmpty(prefix)) {
      if (!rest.startsWith(prefix + ":")) {
        return Optional.empty();
      }
      rest = rest.substring(prefix.length() + 1);
    }
    if (!rest.startsWith(TOOL_SEGMENT + ":")) {
      return Optional.empty();
    }
    rest = rest.substring(TOOL_SEGMENT.length() + 1);
    int end = rest.indexOf(':');
    String tool = end < 0 ? rest : rest.substring(0, end);
    return tool.isEmpty() ? Optional.empty() : Optional.of(tool);
  }

  @Override
  public RateLimitConfig getConfig() {
    return config;
  }

  @Override
  public void close() {
    try {
      store.close();
    } catch (RuntimeException e) {
      logger.warn("Failed to close counter store", e);
    }
  }

  private ToolRateLimit effectiveLimit(Optional<String> tool) {
    return tool.map(toolConfigs::get)
        .filter(ToolRateLimit::isEnabled)
        .orElseGet(() -> ToolRateLimit.of(config.getLimit(), config.getWindow()));
  }

  private Map<String, String> labels(String tool) {
    return Map.of("tool", tool, "mode", config.getMode().id());
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }

  public static class Builder {
    private final RateLimitConfig config;
    private CounterStore store;
    private Clock clock = Clock.systemUTC();
    private MetricPublisher metricPublisher;

    private Builder(RateLimitConfig config) {
      this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Backing store; when unset one is created from the configured store type.
     */
    public Builder store(CounterStore store) {
      this.store = store;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder metricPublisher(MetricPublisher metricPublisher) {
      this.metricPublisher = metricPublisher;
      return this;
    }

    public FixedWindowRateLimiter build() {
      return new FixedWindowRateLimiter(this);
    }
  }
}
