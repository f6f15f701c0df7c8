package com.mcpassist.limiter;

import java.util.Locale;

/**
 * How rate limit keys are composed from a tool name and a client identifier.
 */
public enum KeyMode {
  PER_TOOL("per-tool"),
  GLOBAL("global"),
  IP_BASED("ip-based"),
  CUSTOM("custom");

  private final String id;

  KeyMode(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static KeyMode fromId(String id) {
    if (id != null) {
      String normalized = id.trim().toLowerCase(Locale.ROOT);
      for (KeyMode mode : values()) {
        if (mode.id.equals(normalized)) {
          return mode;
        }
      }
    }
    throw new IllegalArgumentException(
        "invalid rate limit mode: " + id + " (valid: per-tool, global, ip-based, custom)");
  }
}
