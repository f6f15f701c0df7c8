package com.mcpassist.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.mcpassist.limiter.RateLimitConfig;
import com.mcpassist.limiter.RateLimitExceededException;
import com.mcpassist.limiter.RateLimitStats;
import com.mcpassist.limiter.RateLimiter;
import com.mcpassist.limiter.metrics.MetricPublisher;
import com.mcpassist.limiter.metrics.NoOpMetricPublisher;
import com.mcpassist.limiter.reliability.CallContext;
import com.mcpassist.limiter.reliability.CircuitBreaker;
import com.mcpassist.limiter.reliability.RetryExecutor;
import com.mcpassist.limiter.reliability.RetryOptions;
import com.mcpassist.store.CounterStoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs tool invocations through admission control, failure isolation and retries.
 *
 * <p>Order per invocation: the rate limiter is consulted first and a rejection ends the call
 * before anything runs. A failing counter store does not block calls. The tool's circuit
 * breaker then guards one trial, which applies the tool's timeout once and runs the handler
 * either through the tool's retry executor or directly. The breaker sees only the outcome of
 * the whole trial.</p>
 *
 * <p>Tools without a registered policy get {@link ToolPolicy#defaults(String)} on first use.</p>
 */
public class ResiliencePipeline implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ResiliencePipeline.class);

  static final String DEFAULT_CLIENT_ID = "default";

  private final RateLimiter rateLimiter;
  private final MetricPublisher metricPublisher;
  private final Clock clock;
  private final Map<String, ToolGuard> tools = new ConcurrentHashMap<>();

  private ResiliencePipeline(Builder builder) {
    this.rateLimiter = builder.rateLimiter;
    this.metricPublisher = builder.metricPublisher == null ? NoOpMetricPublisher.INSTANCE : builder.metricPublisher;
    this.clock = builder.clock;
    for (ToolPolicy policy : builder.policies.values()) {
      tools.put(policy.getName(), new ToolGuard(policy));
    }
    logger.info("Resilience pipeline ready: tools={} rateLimiting={}", tools.keySet(), rateLimiter != null);
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Runs one invocation of the tool on behalf of the client.
   *
   * @throws RateLimitExceededException if the client is over its quota; the handler did not run
   * @throws com.mcpassist.limiter.reliability.CircuitBreakerOpenException if the tool's breaker rejected the call
   * @throws com.mcpassist.limiter.reliability.RetryExhaustedException if every retry attempt failed
   * @throws com.mcpassist.limiter.reliability.RetryCancelledException if the context ended during retries
   * @throws Exception the handler's own error otherwise
   */
  public <T> T execute(String tool, String clientId, CallContext ctx, ToolHandler<T> handler) throws Exception {
    Objects.requireNonNull(tool, "tool");
    Objects.requireNonNull(ctx, "ctx");
    Objects.requireNonNull(handler, "handler");

    admit(tool, clientId);
    ToolGuard guard = guard(tool);
    return guard.breaker.call(() -> runTrial(guard, ctx, handler));
  }

  private void admit(String tool, String clientId) {
    if (rateLimiter == null) {
      return;
    }
    String key = rateLimiter.generateKey(tool, clientOrDefault(clientId));
    boolean allowed;
    try {
      allowed = rateLimiter.allow(key);
    } catch (CounterStoreException e) {
      logger.warn("Rate limit check failed for tool {} key {}, allowing request", tool, key, e);
      return;
    }
    if (!allowed) {
      throw rejection(key);
    }
  }

  private RateLimitExceededException rejection(String key) {
    int limit;
    Duration window;
    try {
      RateLimitStats stats = rateLimiter.stats(key);
      limit = stats.getLimit();
      window = stats.getWindow();
    } catch (CounterStoreException e) {
      RateLimitConfig config = rateLimiter.getConfig();
      limit = config.getLimit();
      window = config.getWindow();
    }
    return new RateLimitExceededException(key, limit, window, window);
  }

  private <T> T runTrial(ToolGuard guard, CallContext ctx, ToolHandler<T> handler) throws Exception {
    Optional<Duration> timeout = guard.policy.getTimeout();
    if (timeout.isEmpty()) {
      return invoke(guard, ctx, handler);
    }
    try (CallContext scoped = ctx.withTimeout(timeout.get())) {
      return invoke(guard, scoped, handler);
    }
  }

  private <T> T invoke(ToolGuard guard, CallContext ctx, ToolHandler<T> handler) throws Exception {
    if (guard.retryExecutor == null) {
      return handler.handle(ctx, 0);
    }
    return guard.retryExecutor.call(ctx, attempt -> handler.handle(ctx, attempt), guard.retryOptions);
  }

  public CircuitBreaker circuitBreaker(String tool) {
    return guard(tool).breaker;
  }

  public ToolPolicy policy(String tool) {
    return guard(tool).policy;
  }

  /**
   * Current quota usage of the client for the tool, empty when rate limiting is off.
   */
  public Optional<RateLimitStats> rateLimitStats(String tool, String clientId) throws CounterStoreException {
    if (rateLimiter == null) {
      return Optional.empty();
    }
    return Optional.of(rateLimiter.stats(rateLimiter.generateKey(tool, clientOrDefault(clientId))));
  }

  public void resetRateLimit(String tool, String clientId) throws CounterStoreException {
    if (rateLimiter != null) {
      rateLimiter.reset(rateLimiter.generateKey(tool, clientOrDefault(clientId)));
    }
  }

  @Override
  public void close() {
    if (rateLimiter != null) {
      rateLimiter.close();
    }
    metricPublisher.flush();
  }

  private ToolGuard guard(String tool) {
    return tools.computeIfAbsent(tool, name -> new ToolGuard(ToolPolicy.defaults(name)));
  }

  private static String clientOrDefault(String clientId) {
    return clientId == null || clientId.isBlank() ? DEFAULT_CLIENT_ID : clientId;
  }

  private final class ToolGuard {
    final ToolPolicy policy;
    final CircuitBreaker breaker;
    final RetryExecutor retryExecutor;
    final RetryOptions retryOptions;

    ToolGuard(ToolPolicy policy) {
      this.policy = policy;
      this.breaker = new CircuitBreaker(policy.getCircuitBreaker(), clock, metricPublisher);
      this.retryExecutor = policy.getRetry()
          .map(config -> new RetryExecutor(config, metricPublisher))
          .orElse(null);
      this.retryOptions = RetryOptions.newBuilder()
          .operationName(policy.getName())
          .retryIf(policy.getRetryIf())
          .build();
    }
  }

  public static class Builder {
    private RateLimiter rateLimiter;
    private MetricPublisher metricPublisher;
    private Clock clock = Clock.systemUTC();
    private final Map<String, ToolPolicy> policies = new LinkedHashMap<>();

    /**
     * Enables admission control. Without a limiter every call is admitted.
     */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    public Builder metricPublisher(MetricPublisher metricPublisher) {
      this.metricPublisher = metricPublisher;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder tool(ToolPolicy policy) {
      Objects.requireNonNull(policy, "policy");
      policies.put(policy.getName(), policy);
      return this;
    }

    public ResiliencePipeline build() {
      return new ResiliencePipeline(this);
    }
  }
}
