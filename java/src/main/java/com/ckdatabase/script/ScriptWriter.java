package com.ckdatabase.script;

import com.ckdatabase.script.ScriptValue.Block;
import com.ckdatabase.script.ScriptValue.CommentMarker;
import com.ckdatabase.script.ScriptValue.FormulaRef;
import com.ckdatabase.script.ScriptValue.Kind;
import com.ckdatabase.script.ScriptValue.ListValue;
import com.ckdatabase.script.ScriptValue.OperatorValue;
import com.ckdatabase.script.ScriptValue.Scalar;
import com.ckdatabase.script.ScriptValue.VariableRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a {@link ScriptValue} back as script text ("revert").
 *
 * <p>The output re-parses to an equivalent document but is not a perfect inverse of {@link
 * ScriptParser}: comments come back as plain {@code #} lines, and whether a list is written as
 * repeated {@code key = value} lines or as one bracketed block depends on {@link ListKeyRules}, not
 * on how it was originally written.
 */
public class ScriptWriter {

  private static final Logger LOG = LoggerFactory.getLogger(ScriptWriter.class);

  private static final String INDENT = "    ";

  /** Default number of elements a color tuple must exceed, type tag included. */
  public static final int DEFAULT_COLOR_THRESHOLD = 3;

  private final ListKeyRules rules;
  private final int colorThreshold;

  public ScriptWriter() {
    this(ListKeyRules.defaults(), DEFAULT_COLOR_THRESHOLD);
  }

  public ScriptWriter(ListKeyRules rules) {
    this(rules, DEFAULT_COLOR_THRESHOLD);
  }

  public ScriptWriter(ListKeyRules rules, int colorThreshold) {
    this.rules = rules;
    this.colorThreshold = colorThreshold;
  }

  /** Writes a whole document; the root block is not wrapped in brackets. */
  public String revert(ScriptValue value) {
    return revert(value, null, null, -1);
  }

  /**
   * Writes {@code value} as if stored under {@code contextKey} inside a container keyed {@code
   * parentKey}, indented for {@code depth} (-1 for document level).
   */
  public String revert(ScriptValue value, String contextKey, String parentKey, int depth) {
    List<String> lines = new ArrayList<>();
    write(value, contextKey, parentKey, depth, lines);
    return String.join("\n", lines);
  }

  private void write(
      ScriptValue value, String key, String parentKey, int depth, List<String> lines) {
    String tabs = indent(depth);
    switch (value.kind()) {
      case OPERATOR:
        writeOperator((OperatorValue) value, key, parentKey, depth, lines);
        break;
      case VARIABLE:
        writeRaw(((VariableRef) value).raw(), key, tabs, lines);
        break;
      case FORMULA:
        writeRaw(((FormulaRef) value).raw(), key, tabs, lines);
        break;
      case COMMENT:
        lines.add(tabs + "# " + ((CommentMarker) value).text());
        break;
      case BLOCK:
        writeBlock((Block) value, key, depth, lines);
        break;
      case LIST:
        writeList((ListValue) value, key, parentKey, depth, lines);
        break;
      case SCALAR:
      default:
        String text = renderValue(value, key, parentKey);
        lines.add(key != null ? tabs + key(key) + " = " + text : tabs + text);
        break;
    }
  }

  private void writeOperator(
      OperatorValue value, String key, String parentKey, int depth, List<String> lines) {
    ScriptValue operand = value.value();
    if (key == null) {
      write(operand, null, parentKey, depth, lines);
      return;
    }
    if (operand.kind() == Kind.BLOCK || operand.kind() == Kind.LIST) {
      int first = lines.size();
      write(operand, key, parentKey, depth, lines);
      if (lines.size() > first) {
        lines.set(first, lines.get(first).replaceFirst(" = ", " " + value.operator() + " "));
      }
      return;
    }
    lines.add(
        indent(depth)
            + key(key)
            + " "
            + value.operator()
            + " "
            + renderValue(operand, key, parentKey));
  }

  private static void writeRaw(String raw, String key, String tabs, List<String> lines) {
    lines.add(key != null ? tabs + key(key) + " = " + raw : tabs + raw);
  }

  private void writeBlock(Block block, String key, int depth, List<String> lines) {
    String tabs = indent(depth);
    boolean wrapped = key != null || depth >= 0;
    if (key != null) {
      lines.add(tabs + key(key) + " = {");
    } else if (wrapped) {
      lines.add(tabs + "{");
    }
    for (Map.Entry<String, ScriptValue> entry : block.entries()) {
      ScriptValue child = entry.getValue();
      if (child.kind() == Kind.COMMENT) {
        write(child, null, key, depth + 1, lines);
      } else {
        write(child, entry.getKey(), key, depth + 1, lines);
      }
    }
    if (wrapped) {
      lines.add(tabs + "}");
    }
  }

  private void writeList(
      ListValue list, String key, String parentKey, int depth, List<String> lines) {
    String tabs = indent(depth);
    if (key != null && isColor(list)) {
      StringBuilder line = new StringBuilder(tabs);
      line.append(key(key)).append(' ').append(((Scalar) list.get(0)).asString()).append(" = {");
      for (ScriptValue item : list.items().subList(1, list.size())) {
        line.append(' ').append(Scalars.render((Scalar) item));
      }
      lines.add(line.append(" }").toString());
      return;
    }
    // Operators only survive on keyed lines, whatever the rules say
    if (key != null && (!rules.matches(key) || hasOperator(list))) {
      for (ScriptValue item : list.items()) {
        if (item.kind() == Kind.LIST) {
          writeBracketed((ListValue) item, key, depth, lines);
        } else {
          write(item, key, parentKey, depth, lines);
        }
      }
      return;
    }
    writeBracketed(list, key, depth, lines);
  }

  private void writeBracketed(ListValue list, String key, int depth, List<String> lines) {
    String tabs = indent(depth);
    lines.add(key != null ? tabs + key(key) + " = {" : tabs + "{");
    for (ScriptValue item : list.items()) {
      write(item, null, key, depth + 1, lines);
    }
    lines.add(tabs + "}");
  }

  private static boolean hasOperator(ListValue list) {
    for (ScriptValue item : list.items()) {
      if (item.kind() == Kind.OPERATOR) {
        return true;
      }
    }
    return false;
  }

  /** {@code [type, a, b, c]} with a color type tag and only scalars after it. */
  private boolean isColor(ListValue list) {
    if (list.size() <= colorThreshold) {
      return false;
    }
    ScriptValue first = list.get(0);
    if (first.kind() != Kind.SCALAR
        || !((Scalar) first).isString()
        || !ScriptNormalizer.COLOR_TYPES.contains(((Scalar) first).asString())) {
      return false;
    }
    for (ScriptValue item : list.items()) {
      if (item.kind() != Kind.SCALAR) {
        return false;
      }
    }
    return true;
  }

  private String renderValue(ScriptValue value, String key, String parentKey) {
    switch (value.kind()) {
      case SCALAR:
        return Scalars.render((Scalar) value);
      case VARIABLE:
        return ((VariableRef) value).raw();
      case FORMULA:
        return ((FormulaRef) value).raw();
      default:
        LOG.debug("Writing {} under {}.{} as plain text", value.kind(), parentKey, key);
        return String.valueOf(value);
    }
  }

  private static String key(String key) {
    return key.replace('|', ' ');
  }

  private static String indent(int depth) {
    return depth > 0 ? INDENT.repeat(depth) : "";
  }
}
