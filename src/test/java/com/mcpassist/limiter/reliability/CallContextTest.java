package com.mcpassist.limiter.reliability;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CallContextTest {

    @Test
    public void backgroundNeverEndsOnItsOwn() throws Exception {
        CallContext ctx = CallContext.background();
        assertFalse(ctx.isDone());
        assertEquals(Optional.empty(), ctx.remaining());
        assertFalse(ctx.await(Duration.ofMillis(10)));
        assertEquals(Optional.empty(), ctx.cancellationReason());
    }

    @Test
    public void cancelEndsContextAndChildren() {
        CallContext parent = CallContext.background();
        CallContext child = parent.withTimeout(Duration.ofMinutes(1));
        parent.cancel();

        assertTrue(parent.isDone());
        assertTrue(child.isDone());
        assertEquals(Optional.of(CancellationReason.CANCELLED), child.cancellationReason());
    }

    @Test
    public void childOfEndedParentStartsEnded() {
        CallContext parent = CallContext.background();
        parent.cancel();
        assertTrue(parent.withTimeout(Duration.ofMinutes(1)).isDone());
    }

    @Test
    public void deadlineEndsContext() throws Exception {
        CallContext ctx = CallContext.background().withTimeout(Duration.ofMillis(30));
        assertTrue(ctx.await(Duration.ofSeconds(5)));
        assertEquals(Optional.of(CancellationReason.DEADLINE_EXCEEDED), ctx.cancellationReason());
    }

    @Test
    public void childCannotOutliveParentDeadline() {
        CallContext parent = CallContext.background().withTimeout(Duration.ofMillis(100));
        CallContext child = parent.withTimeout(Duration.ofHours(1));
        assertTrue(child.remaining().orElseThrow().compareTo(Duration.ofMillis(100)) <= 0);
    }

    @Test
    public void awaitReturnsEarlyOnCancel() throws Exception {
        CallContext ctx = CallContext.background();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ctx.cancel();
        });
        canceller.start();

        long start = System.nanoTime();
        assertTrue(ctx.await(Duration.ofSeconds(10)));
        assertTrue(System.nanoTime() - start < Duration.ofSeconds(5).toNanos());
        canceller.join();
    }

    @Test
    public void closingChildLeavesParentRunning() {
        CallContext parent = CallContext.background();
        CallContext child = parent.withTimeout(Duration.ofMinutes(1));
        child.close();

        assertTrue(child.isDone());
        assertFalse(parent.isDone());
    }
}
