package ca.gc.cra.prplan.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String validation helpers for configuration values.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern MODULE_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {}

  /**
   * Ensures a value is present, trimmed, and free of control characters.
   *
   * @param name option name used in messages
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a module name; it becomes part of a directory name and a command argument.
   *
   * @param value raw module name
   * @return trimmed module name
   * @throws IllegalArgumentException if the name is blank or has characters other than letters, digits,
   *     dot, underscore, or hyphen
   */
  public static String requireModuleName(String value) {
    if (value == null) {
      throw new IllegalArgumentException("module name is required");
    }
    String sanitized = requireNonBlank("module", value);
    if (!MODULE_PATTERN.matcher(sanitized).matches() || sanitized.contains("..")) {
      throw new IllegalArgumentException(
          "module must only contain letters, digits, dot, underscore, or hyphen");
    }
    return sanitized;
  }

  /**
   * Validates a printable ASCII value of bounded length.
   *
   * @param name option name used in messages
   * @param value raw value
   * @param maxLength maximum length after trimming
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long, or not printable ASCII
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return (name == null || name.isBlank()) ? "value" : name;
  }
}
