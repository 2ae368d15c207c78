package ca.gc.cra.tide.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for remote response bodies and credentials.
 * <p><strong>Why:</strong> Ingest service error bodies can be large, and bearer tokens must never reach the
 * operational log file.
 * Bodies are cut to a UTF-8 byte budget; tokens are masked down to a short suffix so refreshes can still be
 * told apart in the log.
 *
 * @implNote A cut that lands inside a multi-byte sequence drops the partial character.
 */
public final class Logs {
  /** Default byte budget for response bodies embedded in log lines and exception messages. */
  public static final int DEFAULT_BODY_BYTES = 512;

  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int VISIBLE_SUFFIX = 4;
  private static final int MIN_LENGTH_FOR_SUFFIX = 16;

  private Logs() {
  }

  /**
   * Cuts {@code value} to at most {@code maxBytes} UTF-8 bytes and notes how much was kept.
   *
   * @param value text to shorten; {@code null} becomes {@code "<null>"}
   * @param maxBytes byte budget, positive
   * @return {@code value} unchanged when it fits, otherwise the kept prefix plus a size note
   * @throws IllegalArgumentException when {@code maxBytes} is zero or negative
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Truncates a response body using {@link #DEFAULT_BODY_BYTES}.
   *
   * @param body response body; may be {@code null}
   * @return body safe for log lines
   */
  public static String body(String body) {
    return truncate(body, DEFAULT_BODY_BYTES);
  }

  /**
   * Masks a credential, keeping only the last few characters of long values.
   *
   * @param token credential to mask; may be {@code null}
   * @return masked form such as {@code [REDACTED]...a1b2}
   */
  public static String redact(String token) {
    if (token == null || token.length() < MIN_LENGTH_FOR_SUFFIX) {
      return REDACTED_PLACEHOLDER;
    }
    return REDACTED_PLACEHOLDER + "..." + token.substring(token.length() - VISIBLE_SUFFIX);
  }
}
