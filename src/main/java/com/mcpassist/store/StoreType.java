package com.mcpassist.store;

import java.util.Locale;

/**
 * Counter store backends selectable from configuration.
 */
public enum StoreType {
    MEMORY("memory"),
    NOOP("noop");

    private final String id;

    StoreType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static StoreType fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (StoreType type : values()) {
                if (type.id.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("invalid store type: " + id + " (valid: memory, noop)");
    }
}
