package com.mcpassist.limiter;

import java.time.Duration;

/**
 * The caller exceeded its quota; it may try again after {@link #getRetryAfter()}.
 */
public class RateLimitExceededException extends ResilienceException {
  private final String key;
  private final int limit;
  private final Duration window;
  private final Duration retryAfter;

  public RateLimitExceededException(String key, int limit, Duration window, Duration retryAfter) {
    super(String.format("rate limit exceeded for key %s: %d requests per %s exceeded, retry after %s",
        key, limit, window, retryAfter));
    this.key = key;
    this.limit = limit;
    this.window = window;
    this.retryAfter = retryAfter;
  }

  public String getKey() { return key; }

  public int getLimit() { return limit; }

  public Duration getWindow() { return window; }

  public Duration getRetryAfter() { return retryAfter; }
}
