package ca.gc.cra.prplan.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep process output in log lines and exception messages bounded.
 * <p><strong>Why:</strong> A failing plan can print megabytes of stderr; only its end usually explains the failure.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {}

  /**
   * Keeps the first {@code maxBytes} UTF-8 bytes of a string.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return the original value when it fits; otherwise the prefix plus a {@code (truncated, X of Y)} suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    requirePositive(maxBytes);
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    int end = maxBytes;
    while (end > 0 && isContinuation(bytes[end])) {
      end--;
    }
    return new String(bytes, 0, end, StandardCharsets.UTF_8)
        + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
  }

  /**
   * Keeps the last {@code maxBytes} UTF-8 bytes of a string, trimmed of surrounding whitespace.
   *
   * @param value string to shorten; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return the trimmed value when it fits; otherwise {@code "..."} followed by the suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String tail(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    requirePositive(maxBytes);
    String trimmed = value.strip();
    byte[] bytes = trimmed.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return trimmed;
    }
    int start = bytes.length - maxBytes;
    while (start < bytes.length && isContinuation(bytes[start])) {
      start++;
    }
    return "..." + new String(bytes, start, bytes.length - start, StandardCharsets.UTF_8);
  }

  private static boolean isContinuation(byte b) {
    return (b & 0xC0) == 0x80;
  }

  private static void requirePositive(int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
  }
}
