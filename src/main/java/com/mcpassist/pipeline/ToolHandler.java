package com.mcpassist.pipeline;

import com.mcpassist.limiter.reliability.CallContext;

/**
 * The work behind one tool. {@code attempt} starts at 0 and grows with each retry; the
 * context carries the invocation's cancellation and timeout.
 */
@FunctionalInterface
public interface ToolHandler<T> {
  T handle(CallContext ctx, int attempt) throws Exception;
}
