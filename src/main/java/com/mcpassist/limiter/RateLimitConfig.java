package com.mcpassist.limiter;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import com.mcpassist.config.EnvSettings;
import com.mcpassist.store.StoreType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global rate limiting configuration. Instances are validated on {@link Builder#build()}.
 */
public final class RateLimitConfig {
  private static final Logger logger = LoggerFactory.getLogger(RateLimitConfig.class);

  private final boolean enabled;
  private final int limit;
  private final Duration window;
  private final KeyMode mode;
  private final Algorithm algorithm;
  private final StoreType storeType;
  private final String keyPrefix;

  private RateLimitConfig(Builder builder) {
    this.enabled = builder.enabled;
    this.limit = builder.limit;
    this.window = builder.window;
    this.mode = builder.mode;
    this.algorithm = builder.algorithm;
    this.storeType = builder.storeType;
    this.keyPrefix = builder.keyPrefix == null ? "" : builder.keyPrefix;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public static RateLimitConfig defaults() {
    return newBuilder().build();
  }

  /**
   * Defaults overridden by {@code MCP_RATELIMIT_*} variables. Unparseable or unknown
   * values are ignored.
   */
  public static RateLimitConfig fromEnvironment(Map<String, String> env) {
    EnvSettings settings = EnvSettings.of(env);
    Builder builder = newBuilder();
    settings.bool("MCP_RATELIMIT_ENABLED").ifPresent(builder::enabled);
    settings.positiveInt("MCP_RATELIMIT_LIMIT").ifPresent(builder::limit);
    settings.duration("MCP_RATELIMIT_WINDOW")
        .filter(w -> !w.isZero() && !w.isNegative())
        .ifPresent(builder::window);
    settings.string("MCP_RATELIMIT_MODE").ifPresent(v -> {
      try {
        builder.mode(KeyMode.fromId(v));
      } catch (IllegalArgumentException e) {
        logger.warn("Ignoring MCP_RATELIMIT_MODE: {}", e.getMessage());
      }
    });
    settings.string("MCP_RATELIMIT_ALGORITHM").ifPresent(v -> {
      try {
        builder.algorithm(Algorithm.fromId(v));
      } catch (IllegalArgumentException e) {
        logger.warn("Ignoring MCP_RATELIMIT_ALGORITHM: {}", e.getMessage());
      }
    });
    settings.string("MCP_RATELIMIT_STORE_TYPE").ifPresent(v -> {
      try {
        builder.storeType(StoreType.fromId(v));
      } catch (IllegalArgumentException e) {
        logger.warn("Ignoring MCP_RATELIMIT_STORE_TYPE: {}", e.getMessage());
      }
    });
    settings.string("MCP_RATELIMIT_KEY_PREFIX").ifPresent(builder::keyPrefix);
    return builder.build();
  }

  public Builder toBuilder() {
    return new Builder()
        .enabled(enabled)
        .limit(limit)
        .window(window)
        .mode(mode)
        .algorithm(algorithm)
        .storeType(storeType)
        .keyPrefix(keyPrefix);
  }

  public boolean isEnabled() { return enabled; }

  public int getLimit() { return limit; }

  public Duration getWindow() { return window; }

  public KeyMode getMode() { return mode; }

  public Algorithm getAlgorithm() { return algorithm; }

  public StoreType getStoreType() { return storeType; }

  public String getKeyPrefix() { return keyPrefix; }

  @Override
  public String toString() {
    return "RateLimitConfig{enabled=" + enabled + ", limit=" + limit + ", window=" + window
        + ", mode=" + mode.id() + ", algorithm=" + algorithm.id() + ", storeType=" + storeType.id()
        + ", keyPrefix='" + keyPrefix + "'}";
  }

  public static class Builder {
    private boolean enabled = true;
    private int limit = 100;
    private Duration window = Duration.ofMinutes(1);
    private KeyMode mode = KeyMode.PER_TOOL;
    private Algorithm algorithm = Algorithm.TOKEN_BUCKET;
    private StoreType storeType = StoreType.MEMORY;
    private String keyPrefix = "mcp";

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder window(Duration window) {
      this.window = window;
      return this;
    }

    public Builder mode(KeyMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder algorithm(Algorithm algorithm) {
      this.algorithm = algorithm;
      return this;
    }

    public Builder storeType(StoreType storeType) {
      this.storeType = storeType;
      return this;
    }

    public Builder keyPrefix(String keyPrefix) {
      this.keyPrefix = keyPrefix;
      return this;
    }

    /**
     * @throws IllegalArgumentException if the limit or window is not positive
     * @throws NullPointerException if mode, algorithm or store type is missing
     */
    public RateLimitConfig build() {
      if (limit <= 0) {
        throw new IllegalArgumentException("rate limit must be positive: " + limit);
      }
      if (window == null || window.isZero() || window.isNegative()) {
        throw new IllegalArgumentException("rate limit window must be positive: " + window);
      }
      Objects.requireNonNull(mode, "mode");
      Objects.requireNonNull(algorithm, "algorithm");
      Objects.requireNonNull(storeType, "storeType");
      return new RateLimitConfig(this);
    }
  }
}
