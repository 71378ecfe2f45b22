package com.ckdatabase.script;

import com.ckdatabase.script.ScriptValue.Scalar;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.json.simple.JSONValue;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Named values collected while parsing a batch of script documents ({@code @name = value} lines
 * and formula results).
 *
 * <p>A table is owned by whoever drives the batch and lives as long as the batch: variables
 * registered by one file are visible to every file parsed after it, which is why files holding
 * constants must be parsed first. A table is not thread-safe; one batch has one writer.
 *
 * <p>Each parse works on a {@linkplain #stage() staged} child table whose registrations reach the
 * parent only through {@link #commit()}.
 */
public class VariableTable {

  private final VariableTable parent;
  private final Map<String, Scalar> values = new LinkedHashMap<>();

  public VariableTable() {
    this(null);
  }

  private VariableTable(VariableTable parent) {
    this.parent = parent;
  }

  /** Looks up {@code name}, with or without its {@code @} sigil. */
  public Scalar get(String name) {
    String key = strip(name);
    Scalar value = values.get(key);
    if (value == null && parent != null) {
      return parent.get(key);
    }
    return value;
  }

  public boolean contains(String name) {
    return get(name) != null;
  }

  public void put(String name, Scalar value) {
    values.put(strip(name), value);
  }

  /** All variable names visible from this table. */
  public Set<String> names() {
    return snapshot().keySet();
  }

  /** Visible variables, parent entries first, shadowed by this table's own. */
  public Map<String, Scalar> snapshot() {
    Map<String, Scalar> all = new LinkedHashMap<>();
    if (parent != null) {
      all.putAll(parent.snapshot());
    }
    all.putAll(values);
    return Collections.unmodifiableMap(all);
  }

  public int size() {
    return snapshot().size();
  }

  /** Forgets this table's own variables. A staged table leaves its parent untouched. */
  public void clear() {
    values.clear();
  }

  /** Returns a child table that reads through to this one and keeps its own writes apart. */
  public VariableTable stage() {
    return new VariableTable(this);
  }

  /** Copies this staged table's writes into its parent. */
  public void commit() {
    if (parent == null) {
      throw new IllegalStateException("not a staged table");
    }
    parent.values.putAll(values);
    values.clear();
  }

  private static String strip(String name) {
    return name.startsWith("@") ? name.substring(1) : name;
  }

  // ========================================================================
  // Persistence
  // ========================================================================

  /** Reads variables saved by {@link #save(Path)} into this table. Missing files are ignored. */
  public void load(Path file) throws IOException {
    if (!Files.isRegularFile(file)) {
      return;
    }
    Object parsed;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      parsed = new JSONParser().parse(reader);
    } catch (ParseException e) {
      throw new ScriptException("malformed variables file " + file + ": " + e, e);
    }
    if (!(parsed instanceof Map)) {
      throw new ScriptException("variables file " + file + " does not hold a JSON object");
    }
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) parsed).entrySet()) {
      Object value = entry.getValue();
      if (value instanceof Map || value instanceof List) {
        throw new ScriptException(
            "variable \"" + entry.getKey() + "\" in " + file + " is not a scalar: " + value);
      }
      if (value != null) {
        put(entry.getKey().toString(), ScriptValue.scalar(value));
      }
    }
  }

  /** Writes every visible variable to {@code file} as a JSON object. Empty tables write nothing. */
  public void save(Path file) throws IOException {
    Map<String, Scalar> all = snapshot();
    if (all.isEmpty()) {
      return;
    }
    Map<String, Object> json = new LinkedHashMap<>();
    for (Map.Entry<String, Scalar> entry : all.entrySet()) {
      json.put(entry.getKey(), entry.getValue().value());
    }
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      JSONValue.writeJSONString(json, writer);
    }
  }

  @Override
  public String toString() {
    return "VariableTable" + snapshot();
  }
}
