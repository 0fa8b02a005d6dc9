package com.github.lukaszbudnik.logroll;

import java.time.Duration;
import java.util.Locale;

/** Parsers for the human-readable durations and sizes used in rotation configuration. */
final class Durations {

  private static final long KB = 1024L;
  private static final long MB = 1024L * KB;
  private static final long GB = 1024L * MB;

  private Durations() {}

  /**
   * Parse a duration expressed as a raw second count ({@code "3600"}) or a number followed by one
   * of {@code s}, {@code m}, {@code h}, {@code d} ({@code "10h"}, {@code "7d"}).
   *
   * @param field configuration field name, used in error messages
   * @param value the value to parse
   * @return a positive duration
   * @throws ConfigurationException if the value is malformed or not positive
   */
  static Duration parseDuration(String field, String value) throws ConfigurationException {
    String trimmed = value.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      throw new ConfigurationException("Empty duration for " + field);
    }
    char unit = trimmed.charAt(trimmed.length() - 1);
    Duration duration;
    try {
      if (Character.isDigit(unit)) {
        duration = Duration.ofSeconds(Long.parseLong(trimmed));
      } else {
        long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
        switch (unit) {
          case 's':
            duration = Duration.ofSeconds(amount);
            break;
          case 'm':
            duration = Duration.ofMinutes(amount);
            break;
          case 'h':
            duration = Duration.ofHours(amount);
            break;
          case 'd':
            duration = Duration.ofDays(amount);
            break;
          default:
            throw new ConfigurationException(
                "Invalid duration unit for " + field + ": " + value + ". Valid units are: s, m, h, d");
        }
      }
    } catch (NumberFormatException | ArithmeticException e) {
      throw new ConfigurationException("Invalid duration for " + field + ": " + value, e);
    }
    if (duration.isZero() || duration.isNegative()) {
      throw new ConfigurationException("Duration for " + field + " must be positive: " + value);
    }
    return duration;
  }

  /**
   * Parse a size expressed as a raw byte count ({@code "1048576"}) or a number followed by one of
   * {@code KB}, {@code MB}, {@code GB} (binary multiples).
   *
   * @param field configuration field name, used in error messages
   * @param value the value to parse
   * @return a positive number of bytes
   * @throws ConfigurationException if the value is malformed or not positive
   */
  static long parseSize(String field, String value) throws ConfigurationException {
    String trimmed = value.trim().toUpperCase(Locale.ROOT);
    long multiplier = 1;
    if (trimmed.endsWith("KB")) {
      multiplier = KB;
    } else if (trimmed.endsWith("MB")) {
      multiplier = MB;
    } else if (trimmed.endsWith("GB")) {
      multiplier = GB;
    } else if (trimmed.endsWith("B")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    if (multiplier > 1) {
      trimmed = trimmed.substring(0, trimmed.length() - 2);
    }
    long bytes;
    try {
      bytes = Math.multiplyExact(Long.parseLong(trimmed.trim()), multiplier);
    } catch (NumberFormatException | ArithmeticException e) {
      throw new ConfigurationException("Invalid size for " + field + ": " + value, e);
    }
    if (bytes <= 0) {
      throw new ConfigurationException("Size for " + field + " must be positive: " + value);
    }
    return bytes;
  }
}
