package com.mcpassist.limiter;

/**
 * Base type for the outcomes produced by the resilience components themselves
 * (admission rejection, isolation rejection, retry exhaustion, cancellation), as
 * opposed to exceptions thrown by the protected operation.
 */
public abstract class ResilienceException extends RuntimeException {

  protected ResilienceException(String message) {
    super(message);
  }

  protected ResilienceException(String message, Throwable cause) {
    super(message, cause);
  }
}
