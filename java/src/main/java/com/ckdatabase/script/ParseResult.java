package com.ckdatabase.script;

import com.ckdatabase.script.ScriptValue.Block;
import java.util.Objects;

/**
 * Outcome of parsing one script document: either the document or the error that stopped the
 * parse. A failed result never carries a partial document.
 */
public final class ParseResult {

  private final Block document;
  private final ParseError error;
  private final String canonicalText;

  private ParseResult(Block document, ParseError error, String canonicalText) {
    this.document = document;
    this.error = error;
    this.canonicalText = canonicalText;
  }

  public static ParseResult success(Block document) {
    return new ParseResult(Objects.requireNonNull(document, "document"), null, null);
  }

  public static ParseResult failure(ParseError error, String canonicalText) {
    return new ParseResult(null, Objects.requireNonNull(error, "error"), canonicalText);
  }

  public boolean isSuccess() {
    return document != null;
  }

  /**
   * Returns the parsed document.
   *
   * @throws IllegalStateException if parsing failed
   */
  public Block document() {
    if (document == null) {
      throw new IllegalStateException("parse failed: " + error);
    }
    return document;
  }

  /** The failure, or {@code null} on success. */
  public ParseError error() {
    return error;
  }

  /**
   * The canonical text of a failed parse, for diagnostics. {@code null} on success or when {@link
   * ParserOptions#returnTextOnError()} was off.
   */
  public String canonicalText() {
    return canonicalText;
  }

  /** Returns the document or throws a {@link ScriptException} describing the failure. */
  public Block orElseThrow() {
    if (document == null) {
      throw new ScriptException(error);
    }
    return document;
  }

  @Override
  public String toString() {
    return isSuccess() ? "ParseResult[" + document + "]" : "ParseResult[error=" + error + "]";
  }
}
