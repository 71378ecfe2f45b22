package com.ckdatabase.script;

import com.ckdatabase.script.ScriptValue.Scalar;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Literal parsing and rendering of scalar values.
 *
 * <p>Parse attempts run in a fixed priority order (boolean, integer, float, quoted string) and
 * fall back to the raw text as a string.
 */
final class Scalars {

  private static final Pattern INTEGER_PATTERN = Pattern.compile("[-+]?(0|[1-9][0-9]*)");
  private static final Pattern FLOAT_PATTERN =
      Pattern.compile(
          "[-+]?([0-9]+\\.[0-9]*|\\.[0-9]+)([eE][-+]?[0-9]+)?|[-+]?[0-9]+[eE][-+]?[0-9]+");

  // Longest digit run that always fits a long
  private static final int MAX_LONG_DIGITS = 18;

  private static final String DELIMITERS = "{}=#\"<>!|";

  private Scalars() {}

  static Optional<Scalar> parseBoolean(String text) {
    if (text.equalsIgnoreCase("yes")) {
      return Optional.of(ScriptValue.of(true));
    }
    if (text.equalsIgnoreCase("no")) {
      return Optional.of(ScriptValue.of(false));
    }
    return Optional.empty();
  }

  static Optional<Scalar> parseNumber(String text) {
    if (INTEGER_PATTERN.matcher(text).matches()) {
      String digits = text.startsWith("-") || text.startsWith("+") ? text.substring(1) : text;
      if (digits.length() <= MAX_LONG_DIGITS) {
        return Optional.of(ScriptValue.of(Long.parseLong(text)));
      }
      return Optional.of(ScriptValue.of(Double.parseDouble(text)));
    }
    if (FLOAT_PATTERN.matcher(text).matches()) {
      return Optional.of(ScriptValue.of(Double.parseDouble(text)));
    }
    return Optional.empty();
  }

  static Optional<Scalar> parseQuoted(String text) {
    if (isQuoted(text)) {
      return Optional.of(ScriptValue.of(unquote(text)));
    }
    return Optional.empty();
  }

  /** Value on the right of {@code key = ...}: booleans, numbers, quoted strings, then raw text. */
  static Scalar parseValue(String text) {
    return parseBoolean(text)
        .or(() -> parseNumber(text))
        .or(() -> parseQuoted(text))
        .orElseGet(() -> ScriptValue.of(text));
  }

  /** A single token of a bare list line; read the same way as a value. */
  static Scalar parseItem(String text) {
    return parseValue(text);
  }

  static boolean isQuoted(String text) {
    return text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"");
  }

  static String unquote(String text) {
    if (!isQuoted(text)) {
      return text;
    }
    String inner = text.substring(1, text.length() - 1);
    StringBuilder out = new StringBuilder(inner.length());
    for (int i = 0; i < inner.length(); i++) {
      char c = inner.charAt(i);
      if (c == '\\' && i + 1 < inner.length()) {
        char next = inner.charAt(i + 1);
        if (next == '"' || next == '\\') {
          out.append(next);
          i++;
          continue;
        }
      }
      out.append(c);
    }
    return out.toString();
  }

  // ========================================================================
  // Rendering
  // ========================================================================

  static String render(Scalar scalar) {
    if (scalar.isBoolean()) {
      return scalar.asBoolean() ? "yes" : "no";
    }
    if (scalar.isNumber()) {
      return renderNumber(scalar.asNumber());
    }
    String s = scalar.asString();
    if (needsQuotes(s)) {
      return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
    return s;
  }

  static String renderNumber(Number number) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return Double.toString(d);
      }
      return BigDecimal.valueOf(d).toPlainString();
    }
    return number.toString();
  }

  static boolean needsQuotes(String s) {
    if (s.isEmpty() || s.startsWith("@")) {
      return true;
    }
    if (s.length() > 1 && s.startsWith("$") && s.endsWith("$")) {
      return true;
    }
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (Character.isWhitespace(c) || DELIMITERS.indexOf(c) >= 0) {
        return true;
      }
    }
    // Anything that would read back as a boolean or a number
    Scalar reread = parseValue(s);
    return !reread.isString();
  }
}
