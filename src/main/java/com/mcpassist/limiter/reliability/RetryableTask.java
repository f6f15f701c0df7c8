package com.mcpassist.limiter.reliability;

@FunctionalInterface
public interface RetryableTask {
    void run(int attempt) throws Exception;
}
