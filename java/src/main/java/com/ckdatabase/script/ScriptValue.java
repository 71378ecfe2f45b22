package com.ckdatabase.script;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * A value of a parsed script document.
 *
 * <p>The set of variants is closed: {@link Scalar}, {@link Block}, {@link ListValue}, {@link
 * OperatorValue}, {@link VariableRef}, {@link FormulaRef} and {@link CommentMarker}. Consumers
 * switch over {@link #kind()} rather than probing types.
 */
public abstract class ScriptValue {

  /** Variant tag. */
  public enum Kind {
    SCALAR,
    BLOCK,
    LIST,
    OPERATOR,
    VARIABLE,
    FORMULA,
    COMMENT
  }

  ScriptValue() {}

  public abstract Kind kind();

  /**
   * Visits every leaf value with the key it sits under. List elements report the key of the
   * list, operators are looked through to their operand and comments are skipped. A leaf at the
   * top of the walk reports a {@code null} key.
   */
  public void walk(BiConsumer<String, ScriptValue> visitor) {
    walk(this, null, visitor);
  }

  private static void walk(ScriptValue value, String key, BiConsumer<String, ScriptValue> visitor) {
    switch (value.kind()) {
      case BLOCK:
        for (Map.Entry<String, ScriptValue> entry : ((Block) value).entries()) {
          walk(entry.getValue(), entry.getKey(), visitor);
        }
        break;
      case LIST:
        for (ScriptValue item : ((ListValue) value).items()) {
          walk(item, key, visitor);
        }
        break;
      case OPERATOR:
        walk(((OperatorValue) value).value(), key, visitor);
        break;
      case COMMENT:
        break;
      default:
        visitor.accept(key, value);
        break;
    }
  }

  public static Scalar of(boolean value) {
    return new Scalar(value);
  }

  public static Scalar of(long value) {
    return new Scalar(value);
  }

  public static Scalar of(double value) {
    return new Scalar(value);
  }

  public static Scalar of(String value) {
    return new Scalar(Objects.requireNonNull(value, "value"));
  }

  /** Wraps a {@code Boolean}, {@code Long}, {@code Integer}, {@code Double} or {@code String}. */
  public static Scalar scalar(Object value) {
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return new Scalar(((Number) value).longValue());
    }
    if (value instanceof Float) {
      return new Scalar(((Float) value).doubleValue());
    }
    if (value instanceof Boolean
        || value instanceof Long
        || value instanceof Double
        || value instanceof String) {
      return new Scalar(value);
    }
    throw new IllegalArgumentException("not a scalar: " + value);
  }

  public static Block block() {
    return new Block();
  }

  public static ListValue list(ScriptValue... items) {
    ListValue list = new ListValue(false);
    for (ScriptValue item : items) {
      list.add(item);
    }
    return list;
  }

  // ========================================================================
  // Numeric equality
  // ========================================================================

  /**
   * Compares integers exactly and mixed integer/float values by their decimal value, so that
   * {@code 1} equals {@code 1.0} but distinct longs beyond 2^53 stay distinct.
   */
  static boolean numbersEqual(Number a, Number b) {
    if (isIntegral(a) && isIntegral(b)) {
      return a.longValue() == b.longValue();
    }
    if (!isFinite(a) || !isFinite(b)) {
      return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
    }
    return decimal(a).compareTo(decimal(b)) == 0;
  }

  static int numberHash(Number n) {
    if (!isFinite(n)) {
      return Double.hashCode(n.doubleValue());
    }
    return decimal(n).stripTrailingZeros().hashCode();
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }

  private static boolean isFinite(Number n) {
    return isIntegral(n) || Double.isFinite(n.doubleValue());
  }

  private static BigDecimal decimal(Number n) {
    return isIntegral(n) ? BigDecimal.valueOf(n.longValue()) : BigDecimal.valueOf(n.doubleValue());
  }

  // ========================================================================
  // Scalar
  // ========================================================================

  /** A boolean, integer ({@code Long}), float ({@code Double}) or string. */
  public static final class Scalar extends ScriptValue {
    private final Object value;

    private Scalar(Object value) {
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.SCALAR;
    }

    public Object value() {
      return value;
    }

    public boolean isBoolean() {
      return value instanceof Boolean;
    }

    public boolean isNumber() {
      return value instanceof Number;
    }

    public boolean isString() {
      return value instanceof String;
    }

    public boolean asBoolean() {
      return (Boolean) value;
    }

    public Number asNumber() {
      return (Number) value;
    }

    public String asString() {
      return (String) value;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Scalar)) return false;
      Object other = ((Scalar) o).value;
      if (value instanceof Number && other instanceof Number) {
        return numbersEqual((Number) value, (Number) other);
      }
      return value.equals(other);
    }

    @Override
    public int hashCode() {
      if (value instanceof Number) {
        return numberHash((Number) value);
      }
      return value.hashCode();
    }

    @Override
    public String toString() {
      return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }
  }

  // ========================================================================
  // Containers
  // ========================================================================

  /** Insertion-ordered mapping of keys to values. */
  public static final class Block extends ScriptValue {
    private final Map<String, ScriptValue> entries = new LinkedHashMap<>();

    private Block() {}

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    public ScriptValue get(String key) {
      return entries.get(key);
    }

    public Block put(String key, ScriptValue value) {
      entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public boolean containsKey(String key) {
      return entries.containsKey(key);
    }

    public Set<String> keys() {
      return Collections.unmodifiableSet(entries.keySet());
    }

    public Set<Map.Entry<String, ScriptValue>> entries() {
      return Collections.unmodifiableMap(entries).entrySet();
    }

    public int size() {
      return entries.size();
    }

    public boolean isEmpty() {
      return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Block && entries.equals(((Block) o).entries);
    }

    @Override
    public int hashCode() {
      return entries.hashCode();
    }

    @Override
    public String toString() {
      return entries.toString();
    }
  }

  /**
   * Ordered sequence of values.
   *
   * <p>A list built from a repeated key (or a forced-list key) is a <em>repeated-key
   * collector</em>: further occurrences of the key are appended to it. A list parsed from a
   * bracketed {@code { a b c }} is not. The flag does not take part in equality.
   */
  public static final class ListValue extends ScriptValue {
    private final List<ScriptValue> items = new ArrayList<>();
    private final boolean repeated;

    ListValue(boolean repeated) {
      this.repeated = repeated;
    }

    static ListValue repeatedKey() {
      return new ListValue(true);
    }

    @Override
    public Kind kind() {
      return Kind.LIST;
    }

    public boolean isRepeatedKey() {
      return repeated;
    }

    public ListValue add(ScriptValue item) {
      items.add(Objects.requireNonNull(item, "item"));
      return this;
    }

    public ScriptValue get(int index) {
      return items.get(index);
    }

    void set(int index, ScriptValue item) {
      items.set(index, item);
    }

    public List<ScriptValue> items() {
      return Collections.unmodifiableList(items);
    }

    public int size() {
      return items.size();
    }

    public boolean isEmpty() {
      return items.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof ListValue && items.equals(((ListValue) o).items);
    }

    @Override
    public int hashCode() {
      return items.hashCode();
    }

    @Override
    public String toString() {
      return items.toString();
    }
  }

  // ========================================================================
  // References
  // ========================================================================

  /** A key bound with an operator other than {@code =}, e.g. {@code age >= 16}. */
  public static final class OperatorValue extends ScriptValue {
    private final String operator;
    private final ScriptValue value;

    public OperatorValue(String operator, ScriptValue value) {
      this.operator = Objects.requireNonNull(operator, "operator");
      this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
      return Kind.OPERATOR;
    }

    public String operator() {
      return operator;
    }

    public ScriptValue value() {
      return value;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof OperatorValue)) return false;
      OperatorValue other = (OperatorValue) o;
      return operator.equals(other.operator) && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(operator, value);
    }

    @Override
    public String toString() {
      return operator + " " + value;
    }
  }

  /** Reference to a named variable, e.g. {@code @base_cost}. */
  public static final class VariableRef extends ScriptValue {
    private final String raw;
    private final Scalar resolved;

    public VariableRef(String raw, Scalar resolved) {
      this.raw = Objects.requireNonNull(raw, "raw");
      this.resolved = resolved;
    }

    @Override
    public Kind kind() {
      return Kind.VARIABLE;
    }

    public String raw() {
      return raw;
    }

    /** The value found in the variable table, or {@code null} if the name was unknown. */
    public Scalar resolved() {
      return resolved;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof VariableRef)) return false;
      VariableRef other = (VariableRef) o;
      return raw.equals(other.raw) && Objects.equals(resolved, other.resolved);
    }

    @Override
    public int hashCode() {
      return Objects.hash(raw, resolved);
    }

    @Override
    public String toString() {
      return raw + "(" + resolved + ")";
    }
  }

  /** Arithmetic formula in {@code @[...]} form with its evaluated result. */
  public static final class FormulaRef extends ScriptValue {
    private final String raw;
    private final Number resolved;

    public FormulaRef(String raw, Number resolved) {
      this.raw = Objects.requireNonNull(raw, "raw");
      this.resolved = resolved;
    }

    @Override
    public Kind kind() {
      return Kind.FORMULA;
    }

    public String raw() {
      return raw;
    }

    /** The result rounded to 5 decimals, or {@code null} if evaluation failed. */
    public Number resolved() {
      return resolved;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof FormulaRef)) return false;
      FormulaRef other = (FormulaRef) o;
      return raw.equals(other.raw)
          && (resolved == null
              ? other.resolved == null
              : other.resolved != null && numbersEqual(resolved, other.resolved));
    }

    @Override
    public int hashCode() {
      return 31 * raw.hashCode() + (resolved == null ? 0 : numberHash(resolved));
    }

    @Override
    public String toString() {
      return raw + "(" + resolved + ")";
    }
  }

  /** A captured {@code #} comment. */
  public static final class CommentMarker extends ScriptValue {
    private final String text;

    public CommentMarker(String text) {
      this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public Kind kind() {
      return Kind.COMMENT;
    }

    public String text() {
      return text;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof CommentMarker && text.equals(((CommentMarker) o).text);
    }

    @Override
    public int hashCode() {
      return text.hashCode();
    }

    @Override
    public String toString() {
      return "#" + text;
    }
  }
}
