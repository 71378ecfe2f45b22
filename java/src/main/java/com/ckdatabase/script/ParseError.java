package com.ckdatabase.script;

import java.util.Objects;

/** Where and why parsing of one file stopped. */
public final class ParseError {

  private final String filename;
  private final int lineNumber;
  private final String line;
  private final String message;

  public ParseError(String filename, int lineNumber, String line, String message) {
    this.filename = filename;
    this.lineNumber = lineNumber;
    this.line = Objects.requireNonNull(line, "line");
    this.message = Objects.requireNonNull(message, "message");
  }

  /** The file being parsed, or {@code null} when parsing plain text. */
  public String filename() {
    return filename;
  }

  /** One-based line number within the canonical text. */
  public int lineNumber() {
    return lineNumber;
  }

  public String line() {
    return line;
  }

  public String message() {
    return message;
  }

  @Override
  public String toString() {
    return message
        + " at line "
        + lineNumber
        + " ("
        + line
        + ")"
        + (filename != null ? " of <" + filename + ">" : "");
  }
}
