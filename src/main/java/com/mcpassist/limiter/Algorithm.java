package com.mcpassist.limiter;

import java.util.Locale;

/**
 * Algorithm name carried by the configuration. Informational: the limiter always
 * counts with a fixed window, whatever this says.
 */
public enum Algorithm {
  TOKEN_BUCKET("token-bucket"),
  SLIDING_WINDOW("sliding-window");

  private final String id;

  Algorithm(String id) {
    this.id = id;
  }

  public String id() {
    return id;
  }

  public static Algorithm fromId(String id) {
    if (id != null) {
      String normalized = id.trim().toLowerCase(Locale.ROOT);
      for (Algorithm algorithm : values()) {
        if (algorithm.id.equals(normalized)) {
          return algorithm;
        }
      }
    }
    throw new IllegalArgumentException(
        "invalid rate limit algorithm: " + id + " (valid: token-bucket, sliding-window)");
  }
}
