package com.mcpassist.limiter;

import com.mcpassist.store.CounterStoreException;

/**
 * Admission control per key.
 */
public interface RateLimiter extends AutoCloseable {

  /**
   * Counts one request against the key and reports whether it fits the limit.
   *
   * @throws CounterStoreException if the backing store failed; callers decide whether to fail open
   */
  boolean allow(String key) throws CounterStoreException;

  void reset(String key) throws CounterStoreException;

  /**
   * Usage of the key without counting a request.
   */
  RateLimitStats stats(String key) throws CounterStoreException;

  String generateKey(String toolName, String clientId);

  RateLimitConfig getConfig();

  @Override
  default void close() {}
}
