package com.mcpassist.limiter.reliability;

import com.mcpassist.limiter.RateLimitExceededException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPredicatesTest {

    @Test
    public void defaultsRetryDomainErrorsOnly() {
        Predicate<Throwable> retryIf = RetryPredicates.defaults();
        assertTrue(retryIf.test(new IOException("disk")));
        assertTrue(retryIf.test(new IllegalStateException("state")));
        assertFalse(retryIf.test(new RetryCancelledException(CancellationReason.CANCELLED, 1, null)));
        assertFalse(retryIf.test(new CircuitBreakerOpenException("x", CircuitState.OPEN)));
        assertFalse(retryIf.test(new RateLimitExceededException("k", 1, Duration.ofSeconds(1), Duration.ofSeconds(1))));
        assertFalse(retryIf.test(new InterruptedException()));
    }

    @Test
    public void transientOnlyMatchesTransientMessages() {
        Predicate<Throwable> retryIf = RetryPredicates.transientOnly("code-review");
        assertTrue(retryIf.test(new IOException("Connection reset by peer")));
        assertTrue(retryIf.test(new IOException("resource temporarily unavailable")));
        assertTrue(retryIf.test(new IOException("write: broken pipe")));
        assertTrue(retryIf.test(new SocketTimeoutException("read")));
        assertTrue(retryIf.test(new IllegalStateException("wrapped", new IOException("please try again"))));
        assertFalse(retryIf.test(new IllegalArgumentException("invalid package name")));
        assertFalse(retryIf.test(new IOException("exit status 1")));
    }

    @Test
    public void docToolAlsoRetriesCommandFailures() {
        Predicate<Throwable> retryIf = RetryPredicates.transientOnly(RetryPredicates.DOC_TOOL);
        assertTrue(retryIf.test(new IOException("exit status 1")));
        assertTrue(retryIf.test(new IOException("go: command not found")));
        assertTrue(retryIf.test(new IOException("open x: no such file or directory")));
        assertFalse(retryIf.test(new IllegalArgumentException("invalid package name")));
    }
}
