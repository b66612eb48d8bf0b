package ca.gc.cra.pacer.validation;

import java.util.Locale;

/**
 * <strong>What:</strong> Numeric parsing and range validation used by PACER CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects non-positive capacities, budgets, and intervals before the governor allocates
 * anything.
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes, ms)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a decimal value is finite and falls within {@code (minExclusive, max]}.
   *
   * @param name logical parameter name
   * @param value candidate value
   * @param minExclusive lower bound, excluded
   * @param max upper bound, included
   * @return the validated value
   * @throws IllegalArgumentException if the value is NaN, infinite, or out of range
   */
  public static double requireRange(String name, double value, double minExclusive, double max) {
    if (!Double.isFinite(value) || value <= minExclusive || value > max) {
      throw new IllegalArgumentException(String.format(
          Locale.ROOT, "%s must be within (%s, %s] (was %s)", label(name), minExclusive, max, value));
    }
    return value;
  }

  /**
   * Parses a long and validates its range.
   *
   * @param name logical parameter name
   * @param raw textual value; blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is {@code null} or blank
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not an integer or lies out of range
   */
  public static long parseLong(String name, String raw, long defaultValue, long min, long max) {
    if (raw == null || raw.isBlank()) {
      return requireRange(name, defaultValue, min, max);
    }
    try {
      return requireRange(name, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
  }

  /**
   * Parses a double and validates its range.
   *
   * @param name logical parameter name
   * @param raw textual value; blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is {@code null} or blank
   * @param minExclusive lower bound, excluded
   * @param max upper bound, included
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a number or lies out of range
   */
  public static double parseDouble(String name, String raw, double defaultValue, double minExclusive, double max) {
    if (raw == null || raw.isBlank()) {
      return requireRange(name, defaultValue, minExclusive, max);
    }
    try {
      return requireRange(name, Double.parseDouble(raw.trim()), minExclusive, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + raw + ")", ex);
    }
  }

  /**
   * Parses a boolean strictly ({@code true} or {@code false}, case-insensitive).
   *
   * @param name logical parameter name
   * @param raw textual value; blank yields {@code defaultValue}
   * @param defaultValue value used when {@code raw} is {@code null} or blank
   * @return parsed value
   * @throws IllegalArgumentException for any other text
   */
  public static boolean parseBoolean(String name, String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true" -> true;
      case "false" -> false;
      default -> throw new IllegalArgumentException(label(name) + " must be true or false (was " + raw + ")");
    };
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
