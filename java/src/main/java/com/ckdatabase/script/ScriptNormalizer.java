package com.ckdatabase.script;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rewrites raw script text into canonical text: one key/value pair, one bracket or one run of
 * bare list items per line.
 *
 * <p>The passes run in a fixed order and each one assumes the previous ones already ran. Quoted
 * literals are swapped for {@code |n|} placeholders first so that no structural pass ever looks
 * inside them, and are put back last. Normalization is total: text that cannot be understood is
 * left for the line parser to reject.
 */
public final class ScriptNormalizer {

  /** Type tags that open a color tuple, e.g. {@code color = rgb { 10 20 30 }}. */
  public static final List<String> COLOR_TYPES = List.of("rgb", "hsv", "hls", "hsv360");

  // Longest alternative first so that hsv360 is not read as hsv
  private static final String COLOR_ALTERNATION =
      COLOR_TYPES.stream()
          .sorted(Comparator.comparingInt(String::length).reversed())
          .collect(Collectors.joining("|", "(", ")"));

  // A backslash escapes the next character, so \" does not close a literal
  private static final Pattern STRING_PATTERN = Pattern.compile("\"(?:[^\"\\\\\\n]|\\\\.)*\"");
  private static final Pattern MULTILINE_STRING_PATTERN =
      Pattern.compile("\"(?:[^\"\\\\]|\\\\[\\s\\S])*\"");
  private static final Pattern COMMENT_PATTERN =
      Pattern.compile("(\\s*)#+(.*)$", Pattern.MULTILINE);
  private static final Pattern LIST_PATTERN = Pattern.compile("\\s*=\\s*list\\s*([{\"|])");
  private static final Pattern BARE_BLOCK_PATTERN =
      Pattern.compile("^([ \\t]*[^\\s{}=<>!\"]+)[ \\t]*\\{", Pattern.MULTILINE);
  private static final Pattern COLOR_VALUE_PATTERN =
      Pattern.compile("=\\s*" + COLOR_ALTERNATION + "\\s*\\{");
  private static final Pattern COLOR_KEY_PATTERN =
      Pattern.compile(
          "^([ \\t]*[^\\s\"=]+)[ \\t]+" + COLOR_ALTERNATION + "\\s*=\\s*\\{", Pattern.MULTILINE);
  private static final Pattern INLINE_PATTERN =
      Pattern.compile(
          "([^\\s\"]+\\s*[!<=>]+\\s*(([^@\"]\\[?[^\\s]*\\]?)|(\"[^\"]+\")|(@\\[[^\\]]+\\]))|(@\\w+))");
  private static final Pattern DANGLING_EQUALS_PATTERN = Pattern.compile("(=\\s*\\n+)|(\\n+\\s*=)");
  private static final Pattern EMPTY_LINES_PATTERN = Pattern.compile("(\\n\\s*\\n)+");
  private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\|(\\d+)\\|");

  /** Key suffix marking an entry written with the {@code list} keyword. */
  static final String LIST_TAG = "|list";

  /** Key prefix of the synthetic lines that carry captured comments. */
  static final String COMMENT_SIGIL = "&";

  private final ParserOptions options;

  public ScriptNormalizer() {
    this(ParserOptions.defaults());
  }

  public ScriptNormalizer(ParserOptions options) {
    this.options = options;
  }

  /** Returns the canonical form of {@code raw}. */
  public String normalize(String raw) {
    String text = raw.replace("\r\n", "\n").replace('\r', '\n');
    if (text.startsWith("\uFEFF")) {
      text = text.substring(1);
    }
    List<String> strings = new ArrayList<>();

    // 1. Quoted literals on a single line
    text = replaceAll(STRING_PATTERN, text, m -> placeholder(strings, m.group()));

    // 2. Comments
    if (options.comments()) {
      text =
          replaceAll(
              COMMENT_PATTERN,
              text,
              m -> {
                String comment = restore(m.group(2), strings).replace('"', '\'').trim();
                if (comment.isEmpty()) {
                  return "";
                }
                int index = strings.size();
                strings.add("\"" + comment + "\"");
                return "\n" + m.group(1) + COMMENT_SIGIL + index + "=|" + index + "|\n";
              });
    } else {
      text = COMMENT_PATTERN.matcher(text).replaceAll("");
    }

    // 3. Quoted literals spanning lines
    text =
        replaceAll(
            MULTILINE_STRING_PATTERN,
            text,
            m -> placeholder(strings, m.group().replace('\n', ' ').trim()));

    // 4. key = list { ... } and key = list "..."
    text = LIST_PATTERN.matcher(text).replaceAll(Matcher.quoteReplacement(LIST_TAG) + "=$1");

    // 5. key { ... } without an operator, on the key's own line
    text = BARE_BLOCK_PATTERN.matcher(text).replaceAll("$1={");

    // 6. Brackets on their own lines
    text = text.replace("{", "\n{\n").replace("}", "\n}\n");

    // 7. Color blocks: the type becomes the first element of the block
    text = COLOR_VALUE_PATTERN.matcher(text).replaceAll("={\n$1");
    text = COLOR_KEY_PATTERN.matcher(text).replaceAll("$1={\n$2");

    // 8. One key/value pair per line
    text = INLINE_PATTERN.matcher(text).replaceAll("$1\n");

    // 9. key = on one line and its value on the next
    text = DANGLING_EQUALS_PATTERN.matcher(text).replaceAll("=");

    // 10. Blank lines
    text = EMPTY_LINES_PATTERN.matcher(text).replaceAll("\n");

    // 11. Keywords glued to their argument, then the literals put back
    for (String keyword : options.keywords()) {
      text = text.replace(keyword + " ", keyword + "|");
    }
    return restore(text, strings);
  }

  private static String placeholder(List<String> strings, String literal) {
    strings.add(literal);
    return "|" + (strings.size() - 1) + "|";
  }

  private static String restore(String text, List<String> strings) {
    return replaceAll(
        PLACEHOLDER_PATTERN,
        text,
        m -> {
          String digits = m.group(1);
          if (digits.length() > 9) {
            return m.group();
          }
          int index = Integer.parseInt(digits);
          return index < strings.size() ? strings.get(index) : m.group();
        });
  }

  private static String replaceAll(
      Pattern pattern, String text, Function<Matcher, String> replacement) {
    Matcher m = pattern.matcher(text);
    StringBuilder out = new StringBuilder(text.length());
    while (m.find()) {
      m.appendReplacement(out, Matcher.quoteReplacement(replacement.apply(m)));
    }
    m.appendTail(out);
    return out.toString();
  }
}
