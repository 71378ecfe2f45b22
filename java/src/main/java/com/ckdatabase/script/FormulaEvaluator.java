package com.ckdatabase.script;

import com.ckdatabase.script.ScriptValue.Scalar;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves {@code @name} references and evaluates {@code @[expression]} formulas against a {@link
 * VariableTable}.
 *
 * <p>Expressions are limited to numeric literals, {@code + - * /}, unary signs and parentheses.
 * Nothing else is evaluated: a name left over after variable substitution is an error. Integer
 * arithmetic stays integral; division or a float operand gives a double rounded to {@value
 * #SCALE} decimal places.
 */
public final class FormulaEvaluator {

  private static final Logger LOG = LoggerFactory.getLogger(FormulaEvaluator.class);

  /** Decimal places kept in floating-point results. */
  public static final int SCALE = 5;

  private FormulaEvaluator() {}

  /** Pure lookup; {@code null} when the variable is unknown. */
  public static Scalar resolveVariable(String name, VariableTable table) {
    return table.get(name);
  }

  /**
   * Evaluates {@code expression} (the text between {@code @[} and {@code ]}).
   *
   * @return the result, or empty if the expression cannot be evaluated (a warning is logged)
   */
  public static Optional<Number> resolveFormula(String expression, VariableTable table) {
    String substituted = substitute(expression, table);
    try {
      Number result = new ExpressionParser(substituted).parse();
      return Optional.of(round(result));
    } catch (ScriptException | ArithmeticException e) {
      LOG.warn("Formula [{}] can't be evaluated: {}", substituted, e.getMessage());
      return Optional.empty();
    }
  }

  /** Rounds doubles to {@value #SCALE} decimal places; integers pass through. */
  public static Number round(Number value) {
    if (value instanceof Double) {
      double d = value.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return d;
      }
      return BigDecimal.valueOf(d).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
    return value;
  }

  /** Replaces every numeric variable occurring as a whole word with its value. */
  static String substitute(String expression, VariableTable table) {
    String result = expression;
    for (Map.Entry<String, Scalar> entry : table.snapshot().entrySet()) {
      Scalar value = entry.getValue();
      if (!value.isNumber() || !result.contains(entry.getKey())) {
        continue;
      }
      Pattern word = Pattern.compile("(?<![\\w@])@?" + Pattern.quote(entry.getKey()) + "(?!\\w)");
      String number = Scalars.renderNumber(value.asNumber());
      // Parenthesized so that 2-x with x = -3 stays well formed
      String replacement = number.startsWith("-") ? "(" + number + ")" : number;
      result = word.matcher(result).replaceAll(Matcher.quoteReplacement(replacement));
    }
    return result;
  }

  // ========================================================================
  // Expression Parser
  // ========================================================================

  /** Recursive-descent evaluator over {@code expr := term (('+'|'-') term)*}. */
  private static class ExpressionParser {
    private final String source;
    private int pos;

    ExpressionParser(String source) {
      this.source = source;
    }

    Number parse() {
      Number value = parseSum();
      skipSpaces();
      if (pos < source.length()) {
        throw new ScriptException(
            "Unexpected \"" + source.charAt(pos) + "\" at offset " + pos + " in " + source);
      }
      return value;
    }

    private Number parseSum() {
      Number value = parseProduct();
      while (true) {
        skipSpaces();
        if (accept('+')) {
          value = add(value, parseProduct());
        } else if (accept('-')) {
          value = subtract(value, parseProduct());
        } else {
          return value;
        }
      }
    }

    private Number parseProduct() {
      Number value = parseUnary();
      while (true) {
        skipSpaces();
        if (accept('*')) {
          value = multiply(value, parseUnary());
        } else if (accept('/')) {
          value = divide(value, parseUnary());
        } else {
          return value;
        }
      }
    }

    private Number parseUnary() {
      skipSpaces();
      if (accept('-')) {
        Number operand = parseUnary();
        if (operand instanceof Long) {
          return Math.negateExact(operand.longValue());
        }
        return -operand.doubleValue();
      }
      if (accept('+')) {
        return parseUnary();
      }
      return parsePrimary();
    }

    private Number parsePrimary() {
      skipSpaces();
      if (accept('(')) {
        Number value = parseSum();
        skipSpaces();
        if (!accept(')')) {
          throw new ScriptException("Unclosed parenthesis in " + source);
        }
        return value;
      }
      int start = pos;
      while (pos < source.length()
          && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '.')) {
        pos++;
      }
      if (pos < source.length() && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
        int mark = pos++;
        if (pos < source.length() && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
          pos++;
        }
        if (pos < source.length() && Character.isDigit(source.charAt(pos))) {
          while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
          }
        } else {
          pos = mark;
        }
      }
      String literal = source.substring(start, pos);
      if (literal.isEmpty()) {
        if (pos < source.length() && Character.isLetter(source.charAt(pos))) {
          throw new ScriptException("Unknown name at offset " + pos + " in " + source);
        }
        throw new ScriptException("Expected a number at offset " + pos + " in " + source);
      }
      Optional<Scalar> number = Scalars.parseNumber(literal);
      if (number.isEmpty()) {
        throw new ScriptException("Bad number \"" + literal + "\" in " + source);
      }
      return number.get().asNumber();
    }

    private boolean accept(char c) {
      if (pos < source.length() && source.charAt(pos) == c) {
        pos++;
        return true;
      }
      return false;
    }

    private void skipSpaces() {
      while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
        pos++;
      }
    }
  }

  // ========================================================================
  // Arithmetic
  // ========================================================================

  private static Number add(Number a, Number b) {
    if (a instanceof Long && b instanceof Long) {
      return Math.addExact(a.longValue(), b.longValue());
    }
    return a.doubleValue() + b.doubleValue();
  }

  private static Number subtract(Number a, Number b) {
    if (a instanceof Long && b instanceof Long) {
      return Math.subtractExact(a.longValue(), b.longValue());
    }
    return a.doubleValue() - b.doubleValue();
  }

  private static Number multiply(Number a, Number b) {
    if (a instanceof Long && b instanceof Long) {
      return Math.multiplyExact(a.longValue(), b.longValue());
    }
    return a.doubleValue() * b.doubleValue();
  }

  private static Number divide(Number a, Number b) {
    if (b.doubleValue() == 0.0) {
      throw new ArithmeticException("division by zero");
    }
    return a.doubleValue() / b.doubleValue();
  }
}
