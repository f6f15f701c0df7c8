package com.mcpassist.limiter.reliability;

import java.util.Locale;

public enum BackoffType {
    EXPONENTIAL("exponential"),
    LINEAR("linear"),
    CONSTANT("constant"),
    NONE("none");

    private final String id;

    BackoffType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Resolves a strategy name; an empty name means exponential.
     *
     * @throws IllegalArgumentException for any other unknown name
     */
    public static BackoffType fromName(String name) {
        if (name == null || name.isBlank()) {
            return EXPONENTIAL;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (BackoffType type : values()) {
            if (type.id.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                "invalid strategy: " + name + " (must be exponential, linear, constant, or none)");
    }
}
