package com.mcpassist.limiter;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-tool override of the global limit. A disabled override is ignored and is not validated.
 */
public final class ToolRateLimit {
  public static final int DEFAULT_LIMIT = 50;
  public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);

  private final boolean enabled;
  private final int limit;
  private final Duration window;

  public ToolRateLimit(boolean enabled, int limit, Duration window) {
    this.enabled = enabled;
    this.limit = limit;
    this.window = window;
  }

  public static ToolRateLimit of(int limit, Duration window) {
    return new ToolRateLimit(true, limit, window);
  }

  public static ToolRateLimit defaults(boolean enabled) {
    return new ToolRateLimit(enabled, DEFAULT_LIMIT, DEFAULT_WINDOW);
  }

  /**
   * @throws IllegalArgumentException if enabled with a non-positive limit or window
   */
  public void validate() {
    if (!enabled) {
      return;
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("tool rate limit must be positive: " + limit);
    }
    if (window == null || window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("tool rate limit window must be positive: " + window);
    }
  }

  public boolean isEnabled() { return enabled; }

  public int getLimit() { return limit; }

  public Duration getWindow() { return window; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ToolRateLimit)) return false;
    ToolRateLimit that = (ToolRateLimit) o;
    return enabled == that.enabled && limit == that.limit && Objects.equals(window, that.window);
  }

  @Override
  public int hashCode() {
    return Objects.hash(enabled, limit, window);
  }

  @Override
  public String toString() {
    return "ToolRateLimit{enabled=" + enabled + ", limit=" + limit + ", window=" + window + "}";
  }
}
