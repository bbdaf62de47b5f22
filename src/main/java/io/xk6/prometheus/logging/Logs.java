package io.xk6.prometheus.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Helpers for putting script-controlled text (metric names, tag values, raw NDJSON lines) into log lines.
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Cuts {@code value} to at most {@code maxBytes} UTF-8 bytes, never splitting a code point, and notes the
   * original size.
   *
   * @param value text to bound; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum size in bytes; must be positive
   * @return {@code value} itself when it fits
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
    if (utf8.length <= maxBytes) {
      return value;
    }
    return prefix(utf8, maxBytes) + "... (truncated, " + maxBytes + " of " + utf8.length + " bytes)";
  }

  /**
   * Escapes control characters and then truncates, so one untrusted value cannot forge extra log lines.
   *
   * @param value text to render; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum size in bytes, applied after escaping
   * @return printable, bounded text
   */
  public static String safe(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    StringBuilder escaped = null;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (!Character.isISOControl(c)) {
        if (escaped != null) {
          escaped.append(c);
        }
        continue;
      }
      if (escaped == null) {
        escaped = new StringBuilder(value.length() + 8).append(value, 0, i);
      }
      switch (c) {
        case '\n' -> escaped.append("\\n");
        case '\r' -> escaped.append("\\r");
        case '\t' -> escaped.append("\\t");
        default -> escaped.append(String.format("\\u%04x", (int) c));
      }
    }
    return truncate(escaped == null ? value : escaped.toString(), maxBytes);
  }

  private static String prefix(byte[] utf8, int maxBytes) {
    // IGNORE drops the partial code point at the cut
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer chars = decoder.decode(ByteBuffer.wrap(utf8, 0, maxBytes));
      return chars.toString();
    } catch (CharacterCodingException ex) {
      return new String(utf8, 0, maxBytes, StandardCharsets.UTF_8);
    }
  }
}
