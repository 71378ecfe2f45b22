package com.ckdatabase.script;

import com.ckdatabase.script.ScriptValue.Block;
import com.ckdatabase.script.ScriptValue.CommentMarker;
import com.ckdatabase.script.ScriptValue.FormulaRef;
import com.ckdatabase.script.ScriptValue.ListValue;
import com.ckdatabase.script.ScriptValue.OperatorValue;
import com.ckdatabase.script.ScriptValue.Scalar;
import com.ckdatabase.script.ScriptValue.VariableRef;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.json.simple.JSONValue;
import org.json.simple.parser.ContainerFactory;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * JSON form of script documents, as saved next to parsed files and read back for reverting.
 *
 * <p>Blocks and lists map onto JSON objects and arrays. The other variants use reserved keys:
 *
 * <ul>
 *   <li>operators: {@code {"@operator": ">=", "@value": 16}}
 *   <li>references: {@code {"@type": "variable" | "formula", "@value": raw, "@result": value}}
 *   <li>comments: an {@code "&n": "text"} entry in a block, an {@code "&text&"} string in a list
 * </ul>
 */
public final class ScriptJson {

  static final String OPERATOR = "@operator";
  static final String VALUE = "@value";
  static final String TYPE = "@type";
  static final String RESULT = "@result";
  static final String VARIABLE = "variable";
  static final String FORMULA = "formula";

  private static final String COMMENT = ScriptNormalizer.COMMENT_SIGIL;

  /** Keeps object keys in document order. */
  @SuppressWarnings("rawtypes")
  private static final ContainerFactory ORDERED =
      new ContainerFactory() {
        @Override
        public Map createObjectContainer() {
          return new LinkedHashMap();
        }

        @Override
        public List creatArrayContainer() {
          return new ArrayList();
        }
      };

  private ScriptJson() {}

  /** Converts {@code value} to plain maps, lists and JSON primitives. */
  public static Object toJson(ScriptValue value) {
    switch (value.kind()) {
      case BLOCK:
        Map<String, Object> object = new LinkedHashMap<>();
        int comments = 0;
        for (Map.Entry<String, ScriptValue> entry : ((Block) value).entries()) {
          ScriptValue child = entry.getValue();
          if (child.kind() == ScriptValue.Kind.COMMENT) {
            String key = entry.getKey().startsWith(COMMENT) ? entry.getKey() : COMMENT + comments;
            object.put(key, ((CommentMarker) child).text());
            comments++;
          } else {
            object.put(entry.getKey(), toJson(child));
          }
        }
        return object;
      case LIST:
        List<Object> array = new ArrayList<>();
        for (ScriptValue item : ((ListValue) value).items()) {
          array.add(
              item.kind() == ScriptValue.Kind.COMMENT
                  ? COMMENT + ((CommentMarker) item).text() + COMMENT
                  : toJson(item));
        }
        return array;
      case OPERATOR:
        Map<String, Object> operator = new LinkedHashMap<>();
        operator.put(OPERATOR, ((OperatorValue) value).operator());
        operator.put(VALUE, toJson(((OperatorValue) value).value()));
        return operator;
      case VARIABLE:
        VariableRef variable = (VariableRef) value;
        Object result = variable.resolved() == null ? null : variable.resolved().value();
        return reference(VARIABLE, variable.raw(), result);
      case FORMULA:
        FormulaRef formula = (FormulaRef) value;
        return reference(FORMULA, formula.raw(), formula.resolved());
      case COMMENT:
        return COMMENT + ((CommentMarker) value).text() + COMMENT;
      case SCALAR:
      default:
        return ((Scalar) value).value();
    }
  }

  private static Map<String, Object> reference(String type, String raw, Object result) {
    Map<String, Object> object = new LinkedHashMap<>();
    object.put(TYPE, type);
    object.put(VALUE, raw);
    object.put(RESULT, result);
    return object;
  }

  /** Converts parsed JSON back into a value. {@code null} becomes an empty string. */
  public static ScriptValue fromJson(Object json) {
    if (json instanceof Map) {
      Map<?, ?> object = (Map<?, ?>) json;
      if (object.containsKey(OPERATOR)) {
        return new OperatorValue(
            String.valueOf(object.get(OPERATOR)), fromJson(object.get(VALUE)));
      }
      if (object.containsKey(TYPE)) {
        String raw = String.valueOf(object.get(VALUE));
        Object result = object.get(RESULT);
        if (result instanceof Map || result instanceof List) {
          throw new ScriptException("\"" + RESULT + "\" of " + raw + " is not a scalar: " + result);
        }
        if (FORMULA.equals(object.get(TYPE))) {
          return new FormulaRef(raw, result instanceof Number ? (Number) result : null);
        }
        return new VariableRef(raw, result == null ? null : ScriptValue.scalar(result));
      }
      Block block = ScriptValue.block();
      for (Map.Entry<?, ?> entry : object.entrySet()) {
        String key = String.valueOf(entry.getKey());
        if (key.startsWith(COMMENT) && entry.getValue() instanceof String) {
          block.put(key, new CommentMarker((String) entry.getValue()));
        } else {
          block.put(key, fromJson(entry.getValue()));
        }
      }
      return block;
    }
    if (json instanceof List) {
      ListValue list = ScriptValue.list();
      for (Object item : (List<?>) json) {
        list.add(fromJson(item));
      }
      return list;
    }
    if (json instanceof String) {
      String s = (String) json;
      if (s.length() >= 2 && s.startsWith(COMMENT) && s.endsWith(COMMENT)) {
        return new CommentMarker(s.substring(1, s.length() - 1));
      }
      return ScriptValue.of(s);
    }
    if (json == null) {
      return ScriptValue.of("");
    }
    return ScriptValue.scalar(json);
  }

  public static void write(ScriptValue value, Writer writer) throws IOException {
    JSONValue.writeJSONString(toJson(value), writer);
  }

  public static String toJsonString(ScriptValue value) {
    return JSONValue.toJSONString(toJson(value));
  }

  public static ScriptValue read(Reader reader) throws IOException {
    try {
      return fromJson(new JSONParser().parse(reader, ORDERED));
    } catch (ParseException e) {
      throw new ScriptException("malformed JSON document: " + e, e);
    }
  }

  public static ScriptValue parse(String json) {
    try {
      return fromJson(new JSONParser().parse(json, ORDERED));
    } catch (ParseException e) {
      throw new ScriptException("malformed JSON document: " + e, e);
    }
  }
}
