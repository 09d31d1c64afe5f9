package vbcst;

/** Raised by callers that treat parse diagnostics as fatal. */
public class ParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Tokenizer.Pos pos;

  public ParseException(Tokenizer.Pos pos, String message) {
    super(message);
    this.pos = pos;
  }

  public Tokenizer.Pos pos() {
    return pos;
  }

  public String format() {
    return ParseDiagnostic.format(pos, getMessage());
  }

  public void print() {
    System.out.println(format());
  }
}
