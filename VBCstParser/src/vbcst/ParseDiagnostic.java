package vbcst;

import com.google.auto.value.AutoValue;

/**
 * An advisory message about input the parser could not fully recognize. Diagnostics never stop a
 * parse.
 */
@AutoValue
public abstract class ParseDiagnostic {
  public abstract Tokenizer.Pos pos();

  /** Index of the offending token in its stream. */
  public abstract int tokenIndex();

  public abstract String message();

  public static ParseDiagnostic create(Tokenizer.Pos pos, int tokenIndex, String message) {
    return new AutoValue_ParseDiagnostic(pos, tokenIndex, message);
  }

  public String format() {
    return format(pos(), message());
  }

  /** Renders {@code message} as {@code ERROR: file@line:col message}, one-based. */
  static String format(Tokenizer.Pos pos, String message) {
    return String.format(
        "ERROR: %s@%d:%d %s", pos.file(), pos.lineNumber() + 1, pos.column() + 1, message);
  }

  public void print() {
    System.out.println(format());
  }

  public ParseException toException() {
    return new ParseException(pos(), message());
  }
}
