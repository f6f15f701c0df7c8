package com.mcpassist.pipeline;

import com.mcpassist.limiter.FixedWindowRateLimiter;
import com.mcpassist.limiter.RateLimitConfig;
import com.mcpassist.limiter.RateLimitExceededException;
import com.mcpassist.limiter.RateLimitStats;
import com.mcpassist.limiter.reliability.BackoffType;
import com.mcpassist.limiter.reliability.CallContext;
import com.mcpassist.limiter.reliability.CancellationReason;
import com.mcpassist.limiter.reliability.CircuitBreakerConfig;
import com.mcpassist.limiter.reliability.CircuitBreakerOpenException;
import com.mcpassist.limiter.reliability.RetryCancelledException;
import com.mcpassist.limiter.reliability.RetryConfig;
import com.mcpassist.limiter.reliability.RetryExhaustedException;
import com.mcpassist.limiter.reliability.RetryPredicates;
import com.mcpassist.store.FailingCounterStore;
import com.mcpassist.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ResiliencePipelineTest {
    private static final RetryConfig FAST_RETRY = RetryConfig.newBuilder()
            .maxAttempts(3)
            .initialDelay(Duration.ofMillis(1))
            .maxDelay(Duration.ofMillis(5))
            .jitter(false)
            .build();

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final FailingCounterStore store = new FailingCounterStore();
    private ResiliencePipeline pipeline;

    @AfterEach
    public void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
    }

    private ResiliencePipeline.Builder limitedTo(int limit) {
        FixedWindowRateLimiter limiter = FixedWindowRateLimiter.newBuilder(RateLimitConfig.newBuilder()
                        .limit(limit)
                        .window(Duration.ofSeconds(1))
                        .build())
                .store(store)
                .clock(clock)
                .build();
        return ResiliencePipeline.newBuilder().rateLimiter(limiter).clock(clock);
    }

    @Test
    public void rejectedCallNeverRunsHandler() throws Exception {
        pipeline = limitedTo(2).build();
        AtomicInteger calls = new AtomicInteger();

        pipeline.execute("go-doc", "client", CallContext.background(), (ctx, attempt) -> calls.incrementAndGet());
        pipeline.execute("go-doc", "client", CallContext.background(), (ctx, attempt) -> calls.incrementAndGet());
        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
                () -> pipeline.execute("go-doc", "client", CallContext.background(), (ctx, attempt) -> calls.incrementAndGet()));

        assertEquals(2, calls.get());
        assertEquals("mcp:tool:go-doc:client", e.getKey());
        assertEquals(2, e.getLimit());
        assertEquals(Duration.ofSeconds(1), e.getRetryAfter());
        assertEquals(ErrorCategory.RATE_LIMIT_EXCEEDED, ErrorCategory.of(e));
    }

    @Test
    public void clientsHaveSeparateQuotas() throws Exception {
        pipeline = limitedTo(1).build();
        assertEquals("a", pipeline.execute("go-doc", "a", CallContext.background(), (ctx, attempt) -> "a"));
        assertEquals("b", pipeline.execute("go-doc", "b", CallContext.background(), (ctx, attempt) -> "b"));
        assertThrows(RateLimitExceededException.class,
                () -> pipeline.execute("go-doc", "a", CallContext.background(), (ctx, attempt) -> "a"));
    }

    @Test
    public void storeFailureFailsOpen() throws Exception {
        pipeline = limitedTo(1).build();
        store.setFailNextN(1);
        assertEquals("ran", pipeline.execute("go-doc", "client", CallContext.background(), (ctx, attempt) -> "ran"));
    }

    @Test
    public void retriedSequenceIsOneBreakerTrial() throws Exception {
        pipeline = ResiliencePipeline.newBuilder()
                .tool(ToolPolicy.newBuilder("go-doc")
                        .circuitBreaker(CircuitBreakerConfig.builder("go-doc").maxFailures(2).build())
                        .retry(FAST_RETRY)
                        .build())
                .build();
        AtomicInteger calls = new AtomicInteger();

        RetryExhaustedException e = assertThrows(RetryExhaustedException.class,
                () -> pipeline.execute("go-doc", "client", CallContext.background(), (ctx, attempt) -> {
                    calls.incrementAndGet();
                    throw new IOException("connection refused");
                }));

        assertEquals(3, calls.get());
        assertEquals(3, e.getAttempts());
        assertEquals(1, pipeline.circuitBreaker("go-doc").getFailureCount());
        assertTrue(pipeline.circuitBreaker("go-doc").isClosed());
        assertEquals(ErrorCategory.RETRY_EXHAUSTED, ErrorCategory.of(e));
        assertFalse(ErrorCategory.of(e).isTryLater());
    }

    @Test
    public void retryRecoversWithinOneCall() throws Exception {
        pipeline = ResiliencePipeline.newBuilder()
                .tool(ToolPolicy.newBuilder("go-doc").retry(FAST_RETRY).build())
                .build();

        String result = pipeline.execute("go-doc", "client", CallContext.background(), (ctx, attempt) -> {
            if (attempt < 2) {
                throw new IOException("temporary failure");
            }
            return "doc";
        });

        assertEquals("doc", result);
        assertEquals(0, pipeline.circuitBreaker("go-doc").getFailureCount());
    }

    @Test
    public void openBreakerRejectsBeforeHandler() throws Exception {
        pipeline = ResiliencePipeline.newBuilder()
                .clock(clock)
                .tool(ToolPolicy.newBuilder("code-review")
                        .circuitBreaker(CircuitBreakerConfig.builder("code-review")
                                .maxFailures(2)
                                .openTimeout(Duration.ofSeconds(30))
                                .maxHalfOpenTrials(1)
                                .build())
                        .build())
                .build();
        AtomicInteger calls = new AtomicInteger();
        ToolHandler<String> failing = (ctx, attempt) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("analyzer crashed");
        };

        assertThrows(IllegalStateException.class, () -> pipeline.execute("code-review", "c", CallContext.background(), failing));
        assertThrows(IllegalStateException.class, () -> pipeline.execute("code-review", "c", CallContext.background(), failing));
        CircuitBreakerOpenException e = assertThrows(CircuitBreakerOpenException.class,
                () -> pipeline.execute("code-review", "c", CallContext.background(), failing));

        assertEquals(2, calls.get());
        assertEquals(ErrorCategory.CIRCUIT_BREAKER_OPEN, ErrorCategory.of(e));
        assertTrue(ErrorCategory.of(e).isTryLater());
        assertEquals(503, ErrorCategory.of(e).statusCode());

        clock.advance(Duration.ofSeconds(30));
        assertEquals("ok", pipeline.execute("code-review", "c", CallContext.background(), (ctx, attempt) -> "ok"));
        assertTrue(pipeline.circuitBreaker("code-review").isClosed());
    }

    @Test
    public void timeoutBoundsTheWholeRetriedTrial() {
        pipeline = ResiliencePipeline.newBuilder()
                .tool(ToolPolicy.newBuilder("go-doc")
                        .timeout(Duration.ofMillis(100))
                        .retry(RetryConfig.newBuilder()
                                .maxAttempts(10)
                                .initialDelay(Duration.ofMillis(40))
                                .maxDelay(Duration.ofMillis(40))
                                .strategy(BackoffType.CONSTANT)
                                .build())
                        .build())
                .build();
        AtomicInteger calls = new AtomicInteger();

        RetryCancelledException e = assertThrows(RetryCancelledException.class,
                () -> pipeline.execute("go-doc", "c", CallContext.background(), (ctx, attempt) -> {
                    calls.incrementAndGet();
                    throw new IOException("timeout talking to toolchain");
                }));

        assertEquals(CancellationReason.DEADLINE_EXCEEDED, e.getReason());
        assertTrue(calls.get() >= 2 && calls.get() < 10, "calls: " + calls.get());
        assertEquals(ErrorCategory.TIMEOUT, ErrorCategory.of(e));
        assertEquals(1, pipeline.circuitBreaker("go-doc").getFailureCount());
    }

    @Test
    public void handlerSeesTimeoutContext() throws Exception {
        pipeline = ResiliencePipeline.newBuilder()
                .tool(ToolPolicy.newBuilder("go-doc").timeout(Duration.ofSeconds(5)).build())
                .build();
        CallContext caller = CallContext.background();

        boolean bounded = pipeline.execute("go-doc", "c", caller, (ctx, attempt) -> ctx.remaining().isPresent());

        assertTrue(bounded);
        // the derived context is released, the caller's context is untouched
        assertFalse(caller.isDone());
    }

    @Test
    public void nonRetryableErrorsSkipRetries() {
        pipeline = ResiliencePipeline.newBuilder()
                .tool(ToolPolicy.newBuilder("code-review")
                        .retry(FAST_RETRY)
                        .retryIf(RetryPredicates.transientOnly("code-review"))
                        .build())
                .build();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(IllegalArgumentException.class,
                () -> pipeline.execute("code-review", "c", CallContext.background(), (ctx, attempt) -> {
                    calls.incrementAndGet();
                    throw new IllegalArgumentException("syntax error in source");
                }));
        assertEquals(1, calls.get());
    }

    @Test
    public void unknownToolsGetDefaultPolicy() throws Exception {
        pipeline = ResiliencePipeline.newBuilder().build();
        int answer = pipeline.execute("test-gen", null, CallContext.background(), (ctx, attempt) -> 42);
        assertEquals(42, answer);
        assertEquals(5, pipeline.policy("test-gen").getCircuitBreaker().getMaxFailures());
        assertFalse(pipeline.policy("test-gen").getRetry().isPresent());
    }

    @Test
    public void rateLimitHelpers() throws Exception {
        pipeline = limitedTo(3).build();
        pipeline.execute("go-doc", null, CallContext.background(), (ctx, attempt) -> "x");

        RateLimitStats stats = pipeline.rateLimitStats("go-doc", "").orElseThrow();
        assertEquals(1, stats.getCurrent());
        assertEquals(2, stats.getRemaining());

        pipeline.resetRateLimit("go-doc", null);
        assertEquals(0, pipeline.rateLimitStats("go-doc", "default").orElseThrow().getCurrent());

        pipeline.close();
        assertTrue(store.isClosed());
        pipeline = null;
    }

    @Test
    public void withoutLimiterThereAreNoStats() throws Exception {
        pipeline = ResiliencePipeline.newBuilder().build();
        assertFalse(pipeline.rateLimitStats("go-doc", "c").isPresent());
    }

    @Test
    public void errorCategories() {
        assertEquals(ErrorCategory.CANCELLED,
                ErrorCategory.of(new RetryCancelledException(CancellationReason.CANCELLED, 1, null)));
        assertEquals(499, ErrorCategory.CANCELLED.statusCode());
        assertEquals(ErrorCategory.TIMEOUT, ErrorCategory.of(new TimeoutException()));
        assertEquals(408, ErrorCategory.TIMEOUT.statusCode());
        assertEquals(ErrorCategory.INTERNAL_ERROR, ErrorCategory.of(new IOException("disk")));
        assertEquals(429, ErrorCategory.RATE_LIMIT_EXCEEDED.statusCode());
        assertEquals("RETRY_EXHAUSTED", ErrorCategory.RETRY_EXHAUSTED.code());
    }
}
