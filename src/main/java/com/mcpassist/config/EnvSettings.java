package com.mcpassist.config;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed lookups over an environment map ({@code MCP_*} variables).
 *
 * <p>Malformed values are logged and ignored so that a bad override falls back to
 * the default instead of preventing startup.</p>
 */
public final class EnvSettings {
  private static final Logger logger = LoggerFactory.getLogger(EnvSettings.class);

  // Go-style durations: "1m", "500ms", "1h30m", "2.5s"
  private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");

  private final Map<String, String> env;

  private EnvSettings(Map<String, String> env) {
    this.env = Objects.requireNonNull(env, "env");
  }

  public static EnvSettings of(Map<String, String> env) {
    return new EnvSettings(env);
  }

  public Optional<String> string(String name) {
    String value = env.get(name);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  public Optional<Integer> positiveInt(String name) {
    return string(name).flatMap(v -> {
      try {
        int parsed = Integer.parseInt(v);
        if (parsed > 0) {
          return Optional.of(parsed);
        }
      } catch (NumberFormatException e) {
        // fall through to the warning below
      }
      logger.warn("Ignoring {}={}: expected a positive integer", name, v);
      return Optional.empty();
    });
  }

  public Optional<Double> decimal(String name) {
    return string(name).flatMap(v -> {
      try {
        return Optional.of(Double.parseDouble(v));
      } catch (NumberFormatException e) {
        logger.warn("Ignoring {}={}: expected a number", name, v);
        return Optional.empty();
      }
    });
  }

  /**
   * Accepts {@code true/false/1/0} (case-insensitive).
   */
  public Optional<Boolean> bool(String name) {
    return string(name).flatMap(v -> {
      switch (v.toLowerCase(Locale.ROOT)) {
        case "true":
        case "1":
          return Optional.of(Boolean.TRUE);
        case "false":
        case "0":
          return Optional.of(Boolean.FALSE);
        default:
          logger.warn("Ignoring {}={}: expected a boolean", name, v);
          return Optional.empty();
      }
    });
  }

  public Optional<Duration> duration(String name) {
    return string(name).flatMap(v -> {
      try {
        return Optional.of(parseDuration(v));
      } catch (IllegalArgumentException e) {
        logger.warn("Ignoring {}={}: {}", name, v, e.getMessage());
        return Optional.empty();
      }
    });
  }

  /**
   * Parses a duration such as {@code 250ms}, {@code 30s}, {@code 1m} or {@code 1h30m}.
   *
   * @throws IllegalArgumentException if the text is not a valid duration
   */
  public static Duration parseDuration(String text) {
    Objects.requireNonNull(text, "text");
    String value = text.trim();
    if (value.equals("0")) {
      return Duration.ZERO;
    }
    Matcher matcher = DURATION_PART.matcher(value);
    double nanos = 0;
    int position = 0;
    while (matcher.find()) {
      if (matcher.start() != position) {
        break;
      }
      nanos += Double.parseDouble(matcher.group(1)) * nanosPerUnit(matcher.group(2));
      position = matcher.end();
    }
    if (position == 0 || position != value.length()) {
      throw new IllegalArgumentException("invalid duration: " + text);
    }
    return Duration.ofNanos((long) nanos);
  }

  private static double nanosPerUnit(String unit) {
    switch (unit) {
      case "ns":
        return 1;
      case "us":
      case "µs":
        return 1_000;
      case "ms":
        return 1_000_000;
      case "s":
        return 1_000_000_000d;
      case "m":
        return 60 * 1_000_000_000d;
      case "h":
        return 3_600 * 1_000_000_000d;
      default:
        throw new IllegalArgumentException("unknown duration unit: " + unit);
    }
  }
}
