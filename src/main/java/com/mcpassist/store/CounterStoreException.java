package com.mcpassist.store;

/**
 * Raised by a {@link CounterStore} backend that could not complete an operation.
 */
public class CounterStoreException extends Exception {

    public CounterStoreException(String message) {
        super(message);
    }

    public CounterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
