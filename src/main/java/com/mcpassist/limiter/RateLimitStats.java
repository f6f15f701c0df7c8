package com.mcpassist.limiter;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only snapshot of a key's usage in its current window.
 */
public final class RateLimitStats {
  private final int limit;
  private final Duration window;
  private final int current;
  private final int remaining;
  private final boolean allowed;
  private final Instant resetTime;

  public RateLimitStats(int limit, Duration window, int current, Instant resetTime) {
    this.limit = limit;
    this.window = window;
    this.current = current;
    this.remaining = Math.max(0, limit - current);
    this.allowed = current <= limit;
    this.resetTime = resetTime;
  }

  public int getLimit() { return limit; }

  public Duration getWindow() { return window; }

  public int getCurrent() { return current; }

  public int getRemaining() { return remaining; }

  public boolean isAllowed() { return allowed; }

  public Instant getResetTime() { return resetTime; }

  /**
   * Headers a transport can attach to a response, reset time in RFC 1123 format.
   */
  public Map<String, String> toHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("X-RateLimit-Limit", Integer.toString(limit));
    headers.put("X-RateLimit-Remaining", Integer.toString(remaining));
    headers.put("X-RateLimit-Reset",
        DateTimeFormatter.RFC_1123_DATE_TIME.format(resetTime.atZone(ZoneOffset.UTC)));
    return headers;
  }

  @Override
  public String toString() {
    return "RateLimitStats{limit=" + limit + ", window=" + window + ", current=" + current
        + ", remaining=" + remaining + ", allowed=" + allowed + ", resetTime=" + resetTime + "}";
  }
}
