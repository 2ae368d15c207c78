package ca.gc.cra.tide.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by TIDE configuration and CLI layers.
 * <p><strong>Why:</strong> Ensures account, pipe, and channel identifiers are sanitized before they are
 * spliced into REST paths, so the ingest service never sees ambiguous or malformed URLs.
 * <p>Called by the config loader and CLI parser before any HTTP call is attempted. Blank values and values
 * carrying control characters are refused; warehouse object names (database, schema, pipe, channel) are
 * further held to a path-safe alphabet.
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @see Numbers
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9_$.-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Trims a required setting and rejects it when empty or when it embeds control characters.
   *
   * @param name setting name used in error messages ({@code "value"} when absent)
   * @param value raw setting
   * @return the trimmed setting
   * @throws NullPointerException when {@code value} is {@code null}
   * @throws IllegalArgumentException when the setting is blank or holds an ISO control character
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a warehouse object identifier that is embedded verbatim in REST paths.
   *
   * @param name logical parameter name included in exception messages
   * @param value candidate identifier; must be non-null
   * @return trimmed identifier composed of {@code [A-Za-z0-9_$.-]}
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the identifier is blank or contains unsupported characters
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, underscore, dollar, dot, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Returns {@code null} for {@code null} or blank inputs, otherwise the trimmed value.
   *
   * @param value candidate text
   * @return trimmed text or {@code null}
   */
  public static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /**
   * Restricts a value to bounded printable ASCII, for settings forwarded to exporters as headers.
   *
   * @param name logical parameter name included in exception messages
   * @param value candidate text
   * @param maxLength inclusive upper bound on the trimmed length
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long or outside {@code 0x20..0x7E}
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "must be at most " + maxLength + " characters"));
    }
    boolean printable = trimmed.chars().allMatch(c -> c >= 0x20 && c <= 0x7E);
    if (!printable) {
      throw new IllegalArgumentException(message(name, "must contain printable ASCII characters only"));
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
