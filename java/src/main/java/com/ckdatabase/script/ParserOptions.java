package com.ckdatabase.script;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Options for {@link ScriptNormalizer} and {@link ScriptParser}. Instances are immutable; the
 * {@code with} methods return modified copies.
 */
public final class ParserOptions {

  private static final List<String> DEFAULT_KEYWORDS =
      List.of("scripted_trigger", "scripted_effect");

  private static final ParserOptions DEFAULTS =
      new ParserOptions(false, false, Set.of(), DEFAULT_KEYWORDS);

  private final boolean comments;
  private final boolean returnTextOnError;
  private final Set<String> forcedListKeys;
  private final List<String> keywords;

  private ParserOptions(
      boolean comments,
      boolean returnTextOnError,
      Set<String> forcedListKeys,
      List<String> keywords) {
    this.comments = comments;
    this.returnTextOnError = returnTextOnError;
    this.forcedListKeys = forcedListKeys;
    this.keywords = keywords;
  }

  /** No comment capture, no canonical text on error, no forced-list keys. */
  public static ParserOptions defaults() {
    return DEFAULTS;
  }

  /** Whether {@code #} comments are kept as {@link ScriptValue.CommentMarker}s. */
  public boolean comments() {
    return comments;
  }

  /** Whether a failed parse carries the canonical text produced so far. */
  public boolean returnTextOnError() {
    return returnTextOnError;
  }

  /** Lower-cased keys that are always stored as lists. */
  public Set<String> forcedListKeys() {
    return forcedListKeys;
  }

  /** Two-word keywords glued to their argument before parsing. */
  public List<String> keywords() {
    return keywords;
  }

  public boolean isForcedList(String key) {
    return forcedListKeys.contains(key.toLowerCase(Locale.ROOT));
  }

  public ParserOptions withComments(boolean comments) {
    return new ParserOptions(comments, returnTextOnError, forcedListKeys, keywords);
  }

  public ParserOptions withReturnTextOnError(boolean returnTextOnError) {
    return new ParserOptions(comments, returnTextOnError, forcedListKeys, keywords);
  }

  public ParserOptions withForcedListKeys(String... keys) {
    return withForcedListKeys(Arrays.asList(keys));
  }

  public ParserOptions withForcedListKeys(Collection<String> keys) {
    Set<String> lowered =
        keys.stream()
            .map(k -> k.toLowerCase(Locale.ROOT))
            .collect(Collectors.toCollection(LinkedHashSet::new));
    return new ParserOptions(comments, returnTextOnError, Set.copyOf(lowered), keywords);
  }

  public ParserOptions withKeywords(String... keywords) {
    return new ParserOptions(comments, returnTextOnError, forcedListKeys, List.of(keywords));
  }

  @Override
  public String toString() {
    return "ParserOptions[comments="
        + comments
        + ", returnTextOnError="
        + returnTextOnError
        + ", forcedListKeys="
        + forcedListKeys
        + ", keywords="
        + keywords
        + "]";
  }
}
