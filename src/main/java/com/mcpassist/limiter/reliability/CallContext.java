package com.mcpassist.limiter.reliability;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation and deadline scope of one invocation.
 *
 * <p>A context ends when it is cancelled, when its deadline passes or when its parent
 * ends. Derived contexts never outlive their parent's deadline. Closing a derived context
 * ends it and detaches it from the parent.</p>
 */
public final class CallContext implements AutoCloseable {
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final CallContext parent;
    private final long deadlineNanos;
    private final CountDownLatch done = new CountDownLatch(1);
    private final Set<CallContext> children = ConcurrentHashMap.newKeySet();
    private volatile CancellationReason reason;

    private CallContext(CallContext parent, long deadlineNanos) {
        this.parent = parent;
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * A new root context without a deadline. It ends only when cancelled.
     */
    public static CallContext background() {
        return new CallContext(null, NO_DEADLINE);
    }

    /**
     * Derives a child that also ends once {@code timeout} has elapsed.
     */
    public CallContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long now = System.nanoTime();
        long requested = now + saturatedNanos(timeout);
        if (requested < now) {
            requested = NO_DEADLINE;
        }
        CallContext child = new CallContext(this, Math.min(deadlineNanos, requested));
        children.add(child);
        if (isDone()) {
            child.end(reason);
        }
        return child;
    }

    public void cancel() {
        end(CancellationReason.CANCELLED);
    }

    /**
     * Ends the context with the given reason. The first reason wins.
     */
    void end(CancellationReason cause) {
        synchronized (this) {
            if (reason != null) {
                return;
            }
            reason = cause;
        }
        done.countDown();
        for (CallContext child : children) {
            child.end(cause);
        }
    }

    public boolean isDone() {
        if (reason != null) {
            return true;
        }
        if (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos >= 0) {
            end(CancellationReason.DEADLINE_EXCEEDED);
            return true;
        }
        return false;
    }

    public Optional<CancellationReason> cancellationReason() {
        isDone();
        return Optional.ofNullable(reason);
    }

    /**
     * Time left before the deadline, empty when the context has none.
     */
    public Optional<Duration> remaining() {
        if (deadlineNanos == NO_DEADLINE) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0, deadlineNanos - System.nanoTime())));
    }

    /**
     * Waits for the delay to pass or the context to end, whichever happens first.
     *
     * @return true if the context ended before the delay passed
     */
    public boolean await(Duration delay) throws InterruptedException {
        if (isDone()) {
            return true;
        }
        long delayNanos = saturatedNanos(delay);
        if (deadlineNanos != NO_DEADLINE) {
            long untilDeadline = deadlineNanos - System.nanoTime();
            if (untilDeadline <= delayNanos) {
                if (!done.await(Math.max(0, untilDeadline), TimeUnit.NANOSECONDS)) {
                    end(CancellationReason.DEADLINE_EXCEEDED);
                }
                return true;
            }
        }
        return done.await(delayNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void close() {
        if (parent == null) {
            return;
        }
        end(CancellationReason.CANCELLED);
        parent.children.remove(this);
    }

    private static long saturatedNanos(Duration duration) {
        try {
            return Math.max(0, duration.toNanos());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
