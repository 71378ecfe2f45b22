package com.ckdatabase.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Ordered, case-insensitive key patterns deciding how {@link ScriptWriter} emits a list value: a
 * key matching any rule is written as one bracketed block, any other key as repeated {@code key =
 * value} lines.
 *
 * <p>The default table is the classpath resource {@value #RESOURCE}.
 */
public final class ListKeyRules {

  static final String RESOURCE = "list-key-rules.txt";

  private static ListKeyRules defaults;

  private final List<Pattern> rules;

  private ListKeyRules(List<Pattern> rules) {
    this.rules = Collections.unmodifiableList(rules);
  }

  /** The rules shipped with this library. */
  public static synchronized ListKeyRules defaults() {
    if (defaults == null) {
      try (InputStream in = ListKeyRules.class.getResourceAsStream(RESOURCE)) {
        if (in == null) {
          throw new IllegalStateException("missing resource " + RESOURCE);
        }
        defaults = read(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
      } catch (IOException e) {
        throw new UncheckedIOException("cannot read " + RESOURCE, e);
      }
    }
    return defaults;
  }

  /** Reads one regular expression per line, skipping blanks and {@code #} comment lines. */
  public static ListKeyRules read(BufferedReader reader) throws IOException {
    List<String> regexes = new ArrayList<>();
    String line;
    while ((line = reader.readLine()) != null) {
      line = line.trim();
      if (!line.isEmpty() && !line.startsWith("#")) {
        regexes.add(line);
      }
    }
    return of(regexes);
  }

  public static ListKeyRules of(String... regexes) {
    return of(List.of(regexes));
  }

  public static ListKeyRules of(List<String> regexes) {
    List<Pattern> patterns = new ArrayList<>(regexes.size());
    for (String regex : regexes) {
      patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }
    return new ListKeyRules(patterns);
  }

  /** Whether a list stored under {@code key} is written as a bracketed block. */
  public boolean matches(String key) {
    for (Pattern rule : rules) {
      if (rule.matcher(key).find()) {
        return true;
      }
    }
    return false;
  }

  public List<Pattern> rules() {
    return rules;
  }

  @Override
  public String toString() {
    return "ListKeyRules" + rules;
  }
}
