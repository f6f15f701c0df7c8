package com.mcpassist.pipeline;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

import com.mcpassist.limiter.RateLimitExceededException;
import com.mcpassist.limiter.reliability.CancellationReason;
import com.mcpassist.limiter.reliability.CircuitBreakerOpenException;
import com.mcpassist.limiter.reliability.RetryCancelledException;
import com.mcpassist.limiter.reliability.RetryExhaustedException;

/**
 * Client-visible classification of a pipeline failure, for transports that need a code
 * and an HTTP-like status.
 */
public enum ErrorCategory {
  RATE_LIMIT_EXCEEDED("RATE_LIMIT_EXCEEDED", 429, true),
  CIRCUIT_BREAKER_OPEN("CIRCUIT_BREAKER_OPEN", 503, true),
  RETRY_EXHAUSTED("RETRY_EXHAUSTED", 500, false),
  TIMEOUT("TIMEOUT", 408, false),
  CANCELLED("CANCELLED", 499, false),
  INTERNAL_ERROR("INTERNAL_ERROR", 500, false);

  private final String code;
  private final int statusCode;
  private final boolean tryLater;

  ErrorCategory(String code, int statusCode, boolean tryLater) {
    this.code = code;
    this.statusCode = statusCode;
    this.tryLater = tryLater;
  }

  public String code() { return code; }

  public int statusCode() { return statusCode; }

  /**
   * True when the operation never ran and the caller may repeat it later unchanged.
   */
  public boolean isTryLater() { return tryLater; }

  public static ErrorCategory of(Throwable error) {
    if (error instanceof RateLimitExceededException) {
      return RATE_LIMIT_EXCEEDED;
    }
    if (error instanceof CircuitBreakerOpenException) {
      return CIRCUIT_BREAKER_OPEN;
    }
    if (error instanceof RetryExhaustedException) {
      return RETRY_EXHAUSTED;
    }
    if (error instanceof RetryCancelledException) {
      return ((RetryCancelledException) error).getReason() == CancellationReason.DEADLINE_EXCEEDED
          ? TIMEOUT
          : CANCELLED;
    }
    if (error instanceof TimeoutException) {
      return TIMEOUT;
    }
    if (error instanceof CancellationException || error instanceof InterruptedException) {
      return CANCELLED;
    }
    return INTERNAL_ERROR;
  }
}
