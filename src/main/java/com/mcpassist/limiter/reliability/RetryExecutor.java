package com.mcpassist.limiter.reliability;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

import com.mcpassist.limiter.metrics.MetricPublisher;
import com.mcpassist.limiter.metrics.NoOpMetricPublisher;
import com.mcpassist.limiter.metrics.ResilienceMetric;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an operation up to {@code maxAttempts} times, waiting between attempts as the
 * configured {@link BackoffStrategy} dictates.
 *
 * <p>The executor holds only immutable configuration and can be shared. Everything that
 * belongs to one invocation (attempt counter, delays, last error, listener, predicate)
 * lives in that invocation.</p>
 */
public class RetryExecutor {
    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryConfig config;
    private final BackoffStrategy strategy;
    private final MetricPublisher metricPublisher;

    public RetryExecutor(RetryConfig config) {
        this(config, NoOpMetricPublisher.INSTANCE);
    }

    public RetryExecutor(RetryConfig config, MetricPublisher metricPublisher) {
        this(config, BackoffStrategy.of(Objects.requireNonNull(config, "config")), metricPublisher);
    }

    public RetryExecutor(RetryConfig config, BackoffStrategy strategy, MetricPublisher metricPublisher) {
        this.config = Objects.requireNonNull(config, "config");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.metricPublisher = metricPublisher == null ? NoOpMetricPublisher.INSTANCE : metricPublisher;
    }

    public RetryConfig getConfig() {
        return config;
    }

    public void run(CallContext ctx, RetryableTask task) throws Exception {
        run(ctx, task, RetryOptions.defaults());
    }

    public void run(CallContext ctx, RetryableTask task, RetryOptions options) throws Exception {
        Objects.requireNonNull(task, "task");
        call(ctx, attempt -> {
            task.run(attempt);
            return null;
        }, options);
    }

    public <T> T call(CallContext ctx, RetryableOperation<T> operation) throws Exception {
        return call(ctx, operation, RetryOptions.defaults());
    }

    /**
     * @throws RetryCancelledException if the context ended before an attempt or during a wait
     * @throws RetryExhaustedException if all attempts failed
     * @throws Exception the operation's own error when the retry predicate rejects it
     */
    public <T> T call(CallContext ctx, RetryableOperation<T> operation, RetryOptions options) throws Exception {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(options, "options");

        String tool = options.getOperationName();
        int maxAttempts = config.getMaxAttempts();
        long startNanos = System.nanoTime();
        Exception lastError = null;
        Duration lastDelay = Duration.ZERO;
        Duration totalDelay = Duration.ZERO;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (ctx.isDone()) {
                throw cancelled(tool, ctx, attempt, lastError);
            }

            try {
                T result = operation.call(attempt);
                if (attempt > 0) {
                    logger.info("Operation {} succeeded after {} attempts in {} ms", tool, attempt + 1,
                            (System.nanoTime() - startNanos) / 1_000_000);
                    metricPublisher.incrementCounter(ResilienceMetric.RETRIES.metricName(), 1, result(tool, "success"));
                }
                return result;
            } catch (Exception e) {
                lastError = e;
            }

            if (!options.getRetryIf().test(lastError)) {
                logger.debug("Operation {} failed with a non-retryable error on attempt {}: {}",
                        tool, attempt, lastError.toString());
                if (attempt > 0) {
                    metricPublisher.incrementCounter(ResilienceMetric.RETRIES.metricName(), 1, result(tool, "failed"));
                }
                throw lastError;
            }

            if (attempt == maxAttempts - 1) {
                break;
            }

            Duration delay = strategy.nextDelay(attempt);
            lastDelay = delay;
            totalDelay = totalDelay.plus(delay);

            logger.debug("Operation {} attempt {} failed, retrying in {}: {}", tool, attempt, delay, lastError.toString());
            metricPublisher.observe(ResilienceMetric.RETRY_ATTEMPTS.metricName(), attempt + 1, Map.of("tool", tool));
            metricPublisher.observe(ResilienceMetric.RETRY_DELAY_SECONDS.metricName(), delay.toNanos() / 1e9,
                    Map.of("tool", tool));
            options.getListener().onRetry(attempt, lastError, delay);

            if (!delay.isZero() && awaitEnded(ctx, delay)) {
                throw cancelled(tool, ctx, attempt + 1, lastError);
            }
        }

        logger.warn("Operation {} failed after {} attempts (total delay {}): {}",
                tool, maxAttempts, totalDelay, lastError.toString());
        metricPublisher.incrementCounter(ResilienceMetric.RETRIES.metricName(), 1, result(tool, "exhausted"));
        throw new RetryExhaustedException(lastError, maxAttempts, lastDelay, totalDelay);
    }

    private static boolean awaitEnded(CallContext ctx, Duration delay) {
        try {
            return ctx.await(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.end(CancellationReason.INTERRUPTED);
            return true;
        }
    }

    private RetryCancelledException cancelled(String tool, CallContext ctx, int attempts, Throwable lastError) {
        CancellationReason reason = ctx.cancellationReason().orElse(CancellationReason.CANCELLED);
        logger.warn("Operation {} cancelled after {} attempts: {}", tool, attempts, reason);
        return new RetryCancelledException(reason, attempts, lastError);
    }

    private static Map<String, String> result(String tool, String result) {
        return Map.of("tool", tool, "result", result);
    }
}
