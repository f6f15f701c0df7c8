package com.mcpassist.pipeline;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

import com.mcpassist.config.EnvSettings;
import com.mcpassist.limiter.reliability.CircuitBreakerConfig;
import com.mcpassist.limiter.reliability.RetryConfig;
import com.mcpassist.limiter.reliability.RetryPredicates;

/**
 * How the pipeline protects one tool: its breaker settings, an optional retry
 * configuration and an optional timeout around the whole trial.
 */
public final class ToolPolicy {
  private final String name;
  private final CircuitBreakerConfig circuitBreaker;
  private final RetryConfig retry;
  private final Duration timeout;
  private final Predicate<Throwable> retryIf;

  private ToolPolicy(Builder builder) {
    this.name = builder.name;
    this.circuitBreaker = builder.circuitBreaker != null
        ? builder.circuitBreaker
        : CircuitBreakerConfig.defaults(builder.name);
    this.retry = builder.retry;
    this.timeout = builder.timeout;
    this.retryIf = builder.retryIf != null ? builder.retryIf : RetryPredicates.defaults();
  }

  public static Builder newBuilder(String name) {
    return new Builder(name);
  }

  /**
   * Default breaker, no retry, no timeout.
   */
  public static ToolPolicy defaults(String name) {
    return newBuilder(name).build();
  }

  /**
   * Builds the policy for {@code tool} from environment overrides.
   *
   * <p>Breaker and timeout variables are scoped by tool, e.g. {@code MCP_GODOC_CB_MAX_FAILURES},
   * {@code MCP_CODE_REVIEW_CB_TIMEOUT}, {@code MCP_TEST_GEN_TIMEOUT}. Retry is on unless
   * {@code MCP_RETRY_ENABLED=false}; it uses {@link RetryConfig#fromEnvironment(Map)} and retries
   * only transient errors.</p>
   */
  public static ToolPolicy fromEnvironment(String tool, Map<String, String> env) {
    Objects.requireNonNull(tool, "tool");
    EnvSettings settings = EnvSettings.of(env);
    String prefix = "MCP_" + envName(tool) + "_";

    CircuitBreakerConfig.Builder breaker = CircuitBreakerConfig.builder(tool);
    settings.positiveInt(prefix + "CB_MAX_FAILURES").ifPresent(breaker::maxFailures);
    settings.duration(prefix + "CB_TIMEOUT").ifPresent(breaker::openTimeout);
    settings.positiveInt(prefix + "CB_MAX_HALF_OPEN").ifPresent(breaker::maxHalfOpenTrials);

    Builder builder = newBuilder(tool).circuitBreaker(breaker.build());
    settings.duration(prefix + "TIMEOUT")
        .filter(timeout -> !timeout.isZero() && !timeout.isNegative())
        .ifPresent(builder::timeout);
    if (settings.bool("MCP_RETRY_ENABLED").orElse(Boolean.TRUE)) {
      builder.retry(RetryConfig.fromEnvironment(env)).retryIf(RetryPredicates.transientOnly(tool));
    }
    return builder.build();
  }

  // "go-doc" keeps its historical GODOC spelling
  static String envName(String tool) {
    if (RetryPredicates.DOC_TOOL.equals(tool)) {
      return "GODOC";
    }
    return tool.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_");
  }

  public String getName() { return name; }

  public CircuitBreakerConfig getCircuitBreaker() { return circuitBreaker; }

  public Optional<RetryConfig> getRetry() { return Optional.ofNullable(retry); }

  public Optional<Duration> getTimeout() { return Optional.ofNullable(timeout); }

  public Predicate<Throwable> getRetryIf() { return retryIf; }

  public static class Builder {
    private final String name;
    private CircuitBreakerConfig circuitBreaker;
    private RetryConfig retry;
    private Duration timeout;
    private Predicate<Throwable> retryIf;

    private Builder(String name) {
      this.name = name;
    }

    public Builder circuitBreaker(CircuitBreakerConfig circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    public Builder retry(RetryConfig retry) {
      this.retry = retry;
      return this;
    }

    public Builder timeout(Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    public Builder retryIf(Predicate<Throwable> retryIf) {
      this.retryIf = retryIf;
      return this;
    }

    public ToolPolicy build() {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("tool name cannot be empty");
      }
      if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
        throw new IllegalArgumentException("tool timeout must be positive: " + timeout);
      }
      if (circuitBreaker != null && !Objects.equals(circuitBreaker.getName(), name)) {
        circuitBreaker = circuitBreaker.toBuilder().name(name).build();
      }
      return new ToolPolicy(this);
    }
  }
}
