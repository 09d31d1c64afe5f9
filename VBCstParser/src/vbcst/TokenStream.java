package vbcst;

import java.util.List;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;

/** The ordered tokens of one source file, covering every character of it. */
@AutoValue
public abstract class TokenStream {
  public abstract String fileName();

  public abstract ImmutableList<Token> tokens();

  /** Advisory messages raised while tokenizing. */
  public abstract ImmutableList<ParseDiagnostic> diagnostics();

  public static TokenStream create(
      String fileName, List<Token> tokens, List<ParseDiagnostic> diagnostics) {
    return new AutoValue_TokenStream(
        fileName, ImmutableList.copyOf(tokens), ImmutableList.copyOf(diagnostics));
  }

  public static TokenStream create(String fileName, List<Token> tokens) {
    return create(fileName, tokens, ImmutableList.of());
  }

  public int size() {
    return tokens().size();
  }

  public Token get(int index) {
    return tokens().get(index);
  }

  @Memoized
  public String text() {
    return tokens().stream().map(Token::text).collect(Collectors.joining());
  }
}
