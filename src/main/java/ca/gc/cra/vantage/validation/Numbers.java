package ca.gc.cra.vantage.validation;

/**
 * <strong>What:</strong> Numeric parsing and range checks for configuration values.
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {}

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return {@code value}
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
   * Parses a decimal long, falling back to {@code defaultValue} when blank.
   *
   * @param name parameter name used in diagnostics
   * @param raw candidate text; may be {@code null}
   * @param defaultValue value used for {@code null} or blank input
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a decimal integer
   */
  public static long parseLong(String name, String raw, long defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + raw.trim() + "')", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
