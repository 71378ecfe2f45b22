package com.ckdatabase.script;

import com.ckdatabase.script.ScriptValue.Block;
import com.ckdatabase.script.ScriptValue.CommentMarker;
import com.ckdatabase.script.ScriptValue.FormulaRef;
import com.ckdatabase.script.ScriptValue.Kind;
import com.ckdatabase.script.ScriptValue.ListValue;
import com.ckdatabase.script.ScriptValue.OperatorValue;
import com.ckdatabase.script.ScriptValue.Scalar;
import com.ckdatabase.script.ScriptValue.VariableRef;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses script documents into {@link Block}s.
 *
 * <p>Raw text goes through the {@link ScriptNormalizer} and the canonical text is then read line
 * by line with an explicit stack of open containers. A repeated key turns into a list of its
 * values, keys written with {@code list} (or configured as forced-list keys) are always lists, and
 * a block that receives bare values becomes a list.
 *
 * <p>{@code @name = value} lines register variables in the parser's {@link VariableTable}. The
 * registrations of a file are kept apart while it is parsed and reach the table only if the whole
 * file parses.
 *
 * <p>Any failure on a line aborts the file: the result then carries a {@link ParseError} and never
 * a partial document.
 */
public class ScriptParser {

  private static final Logger LOG = LoggerFactory.getLogger(ScriptParser.class);

  private static final Pattern LINE_PATTERN =
      Pattern.compile("(?:\"([^\\s\"!<=>]+)\"|([^\\s\"!<=>]+))\\s*([!<=>]+)\\s*(.*)");
  private static final Pattern ITEM_PATTERN =
      Pattern.compile("(\"(?:[^\"\\\\]|\\\\.)*\"|[\\d.]+|\\S+)");

  private final VariableTable variables;
  private final ParserOptions options;
  private final ScriptNormalizer normalizer;

  public ScriptParser(VariableTable variables) {
    this(variables, ParserOptions.defaults());
  }

  public ScriptParser(VariableTable variables, ParserOptions options) {
    this.variables = variables;
    this.options = options;
    this.normalizer = new ScriptNormalizer(options);
  }

  public VariableTable variables() {
    return variables;
  }

  public ParserOptions options() {
    return options;
  }

  /** Parses raw script text. */
  public ParseResult parse(String text) {
    return parse(text, null);
  }

  /** Parses raw script text; {@code filename} only appears in errors and logs. */
  public ParseResult parse(String text, String filename) {
    return parseCanonical(normalizer.normalize(text), filename);
  }

  /** Parses text already put in canonical form by {@link ScriptNormalizer#normalize(String)}. */
  public ParseResult parseCanonical(String canonical, String filename) {
    VariableTable staged = variables.stage();
    LineParser parser = new LineParser(staged, filename);
    String[] lines = canonical.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].trim();
      try {
        parser.accept(line, i + 1);
      } catch (RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        ParseError error = new ParseError(filename, i + 1, line, message);
        LOG.warn("Line {}: {}{}", i + 1, line, filename != null ? " (" + filename + ")" : "");
        LOG.error("Parse error: {}", message);
        LOG.debug("Exception:", e);
        return ParseResult.failure(error, options.returnTextOnError() ? canonical : null);
      }
    }
    parser.finish();
    staged.commit();
    return ParseResult.success(parser.root);
  }

  // ========================================================================
  // Line Parser
  // ========================================================================

  /** An open container and the way to swap it inside its parent. */
  private static final class Frame {
    final String key;
    ScriptValue container;
    final Consumer<ScriptValue> replacer;
    boolean awaitingBrace;

    Frame(String key, ScriptValue container, Consumer<ScriptValue> replacer) {
      this.key = key;
      this.container = container;
      this.replacer = replacer;
    }
  }

  private class LineParser {
    private final VariableTable table;
    private final String filename;
    private final Block root = ScriptValue.block();
    private final Deque<Frame> stack = new ArrayDeque<>();

    LineParser(VariableTable table, String filename) {
      this.table = table;
      this.filename = filename;
      stack.push(new Frame("", root, null));
    }

    void accept(String line, int lineNumber) {
      if (line.isEmpty()) {
        return;
      }
      Frame frame = stack.peek();
      if (frame.awaitingBrace) {
        if (!line.equals("{")) {
          throw new ScriptException("Expected \"{\" after operator on \"" + frame.key + "\"");
        }
        frame.awaitingBrace = false;
        return;
      }
      Matcher m = LINE_PATTERN.matcher(line);
      if (m.matches()) {
        String key = m.group(1) != null ? m.group(1) : m.group(2);
        keyValue(frame, key, m.group(3), m.group(4).trim());
      } else if (line.equals("}")) {
        if (stack.size() == 1) {
          throw new ScriptException("Unbalanced \"}\" with no open block");
        }
        stack.pop();
      } else {
        listLine(frame, line, lineNumber);
      }
    }

    void finish() {
      if (stack.size() > 1) {
        LOG.warn(
            "{} block(s) left open at end of {}",
            stack.size() - 1,
            filename != null ? filename : "document");
      }
    }

    // ====================================================================
    // key OPERATOR value
    // ====================================================================

    private void keyValue(Frame frame, String key, String operator, String value) {
      boolean forced = false;
      if (key.endsWith(ScriptNormalizer.LIST_TAG)) {
        key = key.substring(0, key.length() - ScriptNormalizer.LIST_TAG.length());
        forced = true;
      }
      forced = forced || options.isForcedList(key);

      if (key.startsWith(ScriptNormalizer.COMMENT_SIGIL)) {
        CommentMarker marker = new CommentMarker(Scalars.unquote(value));
        if (frame.container.kind() == Kind.LIST) {
          ((ListValue) frame.container).add(marker);
        } else {
          ((Block) frame.container).put(key, marker);
        }
        return;
      }

      Block block = targetBlock(frame);
      boolean assign = operator.equals("=");

      if (value.endsWith("{") || (value.isEmpty() && !assign)) {
        Block item = ScriptValue.block();
        Consumer<ScriptValue> slot =
            insert(block, key, assign ? item : new OperatorValue(operator, item), forced, false);
        Frame child =
            new Frame(
                key, item, assign ? slot : v -> slot.accept(new OperatorValue(operator, v)));
        child.awaitingBrace = value.isEmpty();
        stack.push(child);
        return;
      }

      ScriptValue resolved = resolve(value);
      insert(block, key, assign ? resolved : new OperatorValue(operator, resolved), forced, true);
      if (assign && key.startsWith("@")) {
        register(key, resolved);
      }
    }

    /** A key/value pair met inside a list is kept as a single-entry block element. */
    private Block targetBlock(Frame frame) {
      if (frame.container.kind() == Kind.BLOCK) {
        return (Block) frame.container;
      }
      Block holder = ScriptValue.block();
      ((ListValue) frame.container).add(holder);
      return holder;
    }

    /**
     * Stores {@code value} under {@code key}, turning a repeated key into a list. Returns how to
     * replace the stored value later, or {@code null} if an identical value was dropped.
     */
    private Consumer<ScriptValue> insert(
        Block block, String key, ScriptValue value, boolean forced, boolean collapse) {
      ScriptValue existing = block.get(key);
      if (existing == null) {
        block.put(key, forced ? ListValue.repeatedKey().add(value) : value);
        // A forced list's only element being replaced takes over the whole entry
        return v -> block.put(key, v);
      }
      if (collapse && existing.equals(value)) {
        return null;
      }
      ListValue list;
      if (existing.kind() == Kind.LIST && ((ListValue) existing).isRepeatedKey()) {
        list = (ListValue) existing;
      } else {
        list = ListValue.repeatedKey().add(existing);
        block.put(key, list);
        LOG.debug("Duplicate key \"{}\" turned into a list", key);
      }
      int index = list.size();
      list.add(value);
      return v -> list.set(index, v);
    }

    private ScriptValue resolve(String value) {
      if (value.startsWith("@[") && value.endsWith("]")) {
        return formula(value);
      }
      if (value.startsWith("@")) {
        return new VariableRef(value, FormulaEvaluator.resolveVariable(value, table));
      }
      Scalar scalar = Scalars.parseValue(value);
      if (scalar.isString() && !value.isEmpty() && !Scalars.isQuoted(value)) {
        Scalar known = FormulaEvaluator.resolveVariable(value, table);
        if (known != null && !known.isString()) {
          return new VariableRef(value, known);
        }
      }
      return scalar;
    }

    private FormulaRef formula(String raw) {
      String expression = raw.substring(2, raw.length() - 1);
      return new FormulaRef(raw, FormulaEvaluator.resolveFormula(expression, table).orElse(null));
    }

    private void register(String key, ScriptValue resolved) {
      Scalar value = null;
      switch (resolved.kind()) {
        case FORMULA:
          Number result = ((FormulaRef) resolved).resolved();
          if (result != null) {
            value = ScriptValue.scalar(result);
          }
          break;
        case VARIABLE:
          value = ((VariableRef) resolved).resolved();
          break;
        case SCALAR:
          Scalar scalar = (Scalar) resolved;
          if (!(scalar.isString() && scalar.asString().isEmpty())) {
            value = scalar;
          }
          break;
        default:
          break;
      }
      if (value != null) {
        table.put(key, value);
      }
    }

    // ====================================================================
    // Bare list lines
    // ====================================================================

    private void listLine(Frame frame, String line, int lineNumber) {
      ListValue list =
          frame.container.kind() == Kind.LIST
              ? (ListValue) frame.container
              : coerceToList(frame, line, lineNumber);
      if (line.equals("{")) {
        if (list == null) {
          // Keep brackets balanced; the block's content has nowhere to go
          stack.push(new Frame("", ScriptValue.block(), v -> {}));
          return;
        }
        Block item = ScriptValue.block();
        int index = list.size();
        list.add(item);
        stack.push(new Frame("", item, v -> list.set(index, v)));
        return;
      }
      if (list == null) {
        return;
      }
      Matcher m = ITEM_PATTERN.matcher(line);
      while (m.find()) {
        list.add(resolveItem(m.group()));
      }
    }

    /**
     * Turns the frame's block into a list. Returns {@code null} when the block already holds
     * entries other than comments, after logging a warning.
     */
    private ListValue coerceToList(Frame frame, String line, int lineNumber) {
      if (frame.replacer == null) {
        throw new ScriptException("Value \"" + line + "\" outside of any block");
      }
      Block block = (Block) frame.container;
      ListValue list = new ListValue(false);
      for (String key : block.keys()) {
        ScriptValue entry = block.get(key);
        if (entry.kind() != Kind.COMMENT) {
          LOG.warn(
              "Single value cannot be added to a block (line {}: {}){}",
              lineNumber,
              line,
              filename != null ? " in " + filename : "");
          return null;
        }
        list.add(entry);
      }
      frame.container = list;
      frame.replacer.accept(list);
      return list;
    }

    private ScriptValue resolveItem(String token) {
      if (token.startsWith("@[") && token.endsWith("]")) {
        return formula(token);
      }
      if (token.startsWith("@")) {
        return new VariableRef(token, FormulaEvaluator.resolveVariable(token, table));
      }
      return Scalars.parseItem(token);
    }
  }
}
