package com.ckdatabase.script;

/** Raised when a script document cannot be parsed or read. */
public class ScriptException extends RuntimeException {

  private final ParseError error;

  public ScriptException(String message) {
    super(message);
    this.error = null;
  }

  public ScriptException(String message, Throwable cause) {
    super(message, cause);
    this.error = null;
  }

  public ScriptException(ParseError error) {
    super(error.toString());
    this.error = error;
  }

  /** The line-level failure behind this exception, or {@code null} if there is none. */
  public ParseError error() {
    return error;
  }
}
