package vbcst;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

public class SyntaxKindTest {

  @Test
  public void keywordsAreCaseInsensitive() {
    assertThat(SyntaxKind.keyword("dim")).hasValue(SyntaxKind.DIM_KEYWORD);
    assertThat(SyntaxKind.keyword("DIM")).hasValue(SyntaxKind.DIM_KEYWORD);
    assertThat(SyntaxKind.keyword("WithEvents")).hasValue(SyntaxKind.WITH_EVENTS_KEYWORD);
    assertThat(SyntaxKind.keyword("goto")).hasValue(SyntaxKind.GOTO_KEYWORD);
    assertThat(SyntaxKind.keyword("Form1")).isEmpty();
  }

  @Test
  public void symbols() {
    assertThat(SyntaxKind.symbol("<>")).hasValue(SyntaxKind.INEQUALITY_OPERATOR);
    assertThat(SyntaxKind.symbol("=")).hasValue(SyntaxKind.EQUALITY_OPERATOR);
    assertThat(SyntaxKind.symbol("!")).hasValue(SyntaxKind.EXCLAMATION_MARK);
    assertThat(SyntaxKind.symbol(":=")).isEmpty();
  }

  @Test
  public void categories() {
    assertThat(SyntaxKind.IF_STATEMENT.isNode()).isTrue();
    assertThat(SyntaxKind.IF_STATEMENT.isToken()).isFalse();
    assertThat(SyntaxKind.IF_KEYWORD.isKeyword()).isTrue();
    assertThat(SyntaxKind.WHITESPACE.isTrivia()).isTrue();
    assertThat(SyntaxKind.REM_COMMENT.isComment()).isTrue();
    assertThat(SyntaxKind.NEWLINE.isComment()).isFalse();
    assertThat(SyntaxKind.DATE_LITERAL.isLiteral()).isTrue();
    assertThat(SyntaxKind.UNKNOWN.isToken()).isTrue();
  }

  @Test
  public void keywordsCanStandInForNames() {
    assertThat(SyntaxKind.IDENTIFIER.isName()).isTrue();
    assertThat(SyntaxKind.NAME_KEYWORD.isName()).isTrue();
    assertThat(SyntaxKind.COMMA.isName()).isFalse();
    assertThat(SyntaxKind.STRING_LITERAL.isName()).isFalse();
  }

  @Test
  public void rawValuesRoundTrip() {
    for (SyntaxKind kind : SyntaxKind.values()) {
      assertThat(SyntaxKind.fromRaw(kind.raw())).isEqualTo(kind);
    }
  }

  @Test
  public void displayNames() {
    assertThat(SyntaxKind.IF_STATEMENT.displayName()).isEqualTo("IfStatement");
    assertThat(SyntaxKind.END_OF_LINE_COMMENT.displayName()).isEqualTo("EndOfLineComment");
    assertThat(SyntaxKind.UNKNOWN.displayName()).isEqualTo("Unknown");
  }

  @Test
  public void canonicalText() {
    assertThat(SyntaxKind.RE_DIM_KEYWORD.text()).hasValue("ReDim");
    assertThat(SyntaxKind.BACKWARD_SLASH_OPERATOR.text()).hasValue("\\");
    assertThat(SyntaxKind.IDENTIFIER.text()).isEmpty();
  }
}
