package ca.gc.cra.vantage.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String checks for operator-supplied configuration values.
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {}

  /**
   * Ensures a value is non-blank and free of control characters.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate text; must not be {@code null}
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException(label(name) + " must not contain control characters");
      }
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Ensures a value holds printable ASCII only and fits {@code maxLength}.
   *
   * @param name parameter name used in diagnostics
   * @param value candidate text
   * @param maxLength maximum length in characters
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
      }
    }
    return trimmed;
  }

  /**
   * Parses a boolean flag, accepting {@code true}/{@code false} in any case.
   *
   * @param name parameter name used in diagnostics
   * @param raw candidate text; may be {@code null}
   * @param defaultValue value used for {@code null} or blank input
   * @return parsed flag
   * @throws IllegalArgumentException for any other text
   */
  public static boolean parseBoolean(String name, String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String trimmed = raw.trim();
    if (trimmed.equalsIgnoreCase("true")) {
      return true;
    }
    if (trimmed.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(label(name) + " must be true or false (was '" + trimmed + "')");
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
