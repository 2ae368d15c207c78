package ca.gc.cra.tide.api;

import ca.gc.cra.tide.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} tokens into an ordered, mutable settings map. Later duplicates win.
 */
final class CliArgsParser {
  private static final Pattern KEY = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Splits each token on its first {@code '='}.
   *
   * @param args tokens; {@code null} yields an empty map
   * @return mutable map so callers can consume recognised keys
   * @throws IllegalArgumentException if a token is not {@code key=value}, the key is malformed, or the value
   *     contains control characters
   */
  static Map<String, String> toMap(String[] args) {
    Map<String, String> values = new LinkedHashMap<>();
    if (args == null) {
      return values;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int eq = arg.indexOf('=');
      if (eq <= 0 || eq == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, eq).trim();
      if (!KEY.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      values.put(key, Strings.requireNonBlank(key, arg.substring(eq + 1)));
    }
    return values;
  }
}
