package vbcst;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** A verbatim slice of source text and the kind the tokenizer gave it. */
@AutoValue
public abstract class Token {
  public abstract String text();

  public abstract SyntaxKind kind();

  public abstract Tokenizer.Pos pos();

  public static Token create(String text, SyntaxKind kind, Tokenizer.Pos pos) {
    Preconditions.checkArgument(kind.isToken(), "%s is not a token kind", kind);
    return new AutoValue_Token(text, kind, pos);
  }

  public static Token create(String text, SyntaxKind kind) {
    return create(text, kind, Tokenizer.Pos.internal());
  }

  @Override
  public final String toString() {
    return String.format("(%s, %s)", kind().displayName(), text());
  }
}
