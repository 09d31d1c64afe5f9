package vbcst;

import static com.google.common.truth.Truth.assertThat;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class TokenizerTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private TokenStream tokenize() {
    return new Tokenizer("/test/file.bas", file.toString()).tokenize();
  }

  private static ImmutableList<SyntaxKind> kinds(TokenStream stream) {
    return stream.tokens().stream().map(Token::kind).collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<SyntaxKind> significantKinds(TokenStream stream) {
    return stream
        .tokens()
        .stream()
        .map(Token::kind)
        .filter(k -> !k.isTrivia())
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void emptyFile() {
    assertThat(tokenize().tokens()).isEmpty();
  }

  @Test
  public void declaration() {
    println("Dim x As Integer");

    TokenStream tokens = tokenize();

    assertThat(kinds(tokens))
        .containsExactly(
            SyntaxKind.DIM_KEYWORD,
            SyntaxKind.WHITESPACE,
            SyntaxKind.IDENTIFIER,
            SyntaxKind.WHITESPACE,
            SyntaxKind.AS_KEYWORD,
            SyntaxKind.WHITESPACE,
            SyntaxKind.INTEGER_KEYWORD,
            SyntaxKind.NEWLINE)
        .inOrder();
    assertThat(tokens.diagnostics()).isEmpty();
  }

  @Test
  public void keywordsKeepTheirSpelling() {
    println("dIM x");

    Token dim = tokenize().get(0);

    assertThat(dim.kind()).isEqualTo(SyntaxKind.DIM_KEYWORD);
    assertThat(dim.text()).isEqualTo("dIM");
  }

  @Test
  public void longestWordWins() {
    println("SetAttr WithEvents Form_Load");

    assertThat(significantKinds(tokenize()))
        .containsExactly(
            SyntaxKind.SET_ATTR_KEYWORD, SyntaxKind.WITH_EVENTS_KEYWORD, SyntaxKind.IDENTIFIER)
        .inOrder();
  }

  @Test
  public void comments() {
    println("x = 1 ' trailing");
    println("Rem whole line");
    println("Remove = 2");

    TokenStream tokens = tokenize();

    assertThat(tokens.get(6).kind()).isEqualTo(SyntaxKind.END_OF_LINE_COMMENT);
    assertThat(tokens.get(6).text()).isEqualTo("' trailing");
    assertThat(tokens.get(8).kind()).isEqualTo(SyntaxKind.REM_COMMENT);
    assertThat(tokens.get(8).text()).isEqualTo("Rem whole line");
    assertThat(tokens.get(10).kind()).isEqualTo(SyntaxKind.IDENTIFIER);
    assertThat(tokens.get(10).text()).isEqualTo("Remove");
  }

  @Test
  public void stringLiterals() {
    println("s = \"say \"\"hi\"\"\"");

    Token literal = tokenize().get(4);

    assertThat(literal.kind()).isEqualTo(SyntaxKind.STRING_LITERAL);
    assertThat(literal.text()).isEqualTo("\"say \"\"hi\"\"\"");
  }

  @Test
  public void unterminatedString() {
    println("s = \"open");
    println("x = 1");

    TokenStream tokens = tokenize();

    assertThat(tokens.get(4).text()).isEqualTo("\"open");
    assertThat(tokens.get(5).kind()).isEqualTo(SyntaxKind.NEWLINE);
    assertThat(tokens.diagnostics()).hasSize(1);
    assertThat(tokens.diagnostics().get(0).message()).isEqualTo("unterminated string literal");
  }

  @Test
  public void numericLiterals() {
    println("1 2& 3.5 4# 5@ 6% 7! &HFF &O17& 1E5");

    assertThat(significantKinds(tokenize()))
        .containsExactly(
            SyntaxKind.INTEGER_LITERAL,
            SyntaxKind.LONG_LITERAL,
            SyntaxKind.SINGLE_LITERAL,
            SyntaxKind.DOUBLE_LITERAL,
            SyntaxKind.CURRENCY_LITERAL,
            SyntaxKind.INTEGER_LITERAL,
            SyntaxKind.SINGLE_LITERAL,
            SyntaxKind.INTEGER_LITERAL,
            SyntaxKind.LONG_LITERAL,
            SyntaxKind.SINGLE_LITERAL)
        .inOrder();
  }

  @Test
  public void dateLiteralsAndFileNumbers() {
    println("d = #1/2/2000#");
    println("t = #10:30 PM#");
    println("Print #1, d");

    TokenStream tokens = tokenize();

    assertThat(tokens.get(4).kind()).isEqualTo(SyntaxKind.DATE_LITERAL);
    assertThat(tokens.get(4).text()).isEqualTo("#1/2/2000#");
    assertThat(tokens.get(10).kind()).isEqualTo(SyntaxKind.DATE_LITERAL);
    assertThat(tokens.get(14).kind()).isEqualTo(SyntaxKind.OCTOTHORPE);
    assertThat(tokens.get(15).kind()).isEqualTo(SyntaxKind.INTEGER_LITERAL);
  }

  @Test
  public void symbols() {
    println("a <> b <= c >= d := e");

    assertThat(significantKinds(tokenize()))
        .containsExactly(
            SyntaxKind.IDENTIFIER,
            SyntaxKind.INEQUALITY_OPERATOR,
            SyntaxKind.IDENTIFIER,
            SyntaxKind.LESS_THAN_OR_EQUAL_OPERATOR,
            SyntaxKind.IDENTIFIER,
            SyntaxKind.GREATER_THAN_OR_EQUAL_OPERATOR,
            SyntaxKind.IDENTIFIER,
            SyntaxKind.COLON_OPERATOR,
            SyntaxKind.EQUALITY_OPERATOR,
            SyntaxKind.IDENTIFIER)
        .inOrder();
  }

  @Test
  public void lineContinuation() {
    file.append("x = 1 + _\r\n    2");

    assertThat(kinds(tokenize()))
        .containsExactly(
            SyntaxKind.IDENTIFIER,
            SyntaxKind.WHITESPACE,
            SyntaxKind.EQUALITY_OPERATOR,
            SyntaxKind.WHITESPACE,
            SyntaxKind.INTEGER_LITERAL,
            SyntaxKind.WHITESPACE,
            SyntaxKind.ADDITION_OPERATOR,
            SyntaxKind.WHITESPACE,
            SyntaxKind.UNDERSCORE,
            SyntaxKind.NEWLINE,
            SyntaxKind.WHITESPACE,
            SyntaxKind.INTEGER_LITERAL)
        .inOrder();
  }

  @Test
  public void unknownCharacter() {
    println("x = `");

    TokenStream tokens = tokenize();

    assertThat(tokens.get(4).kind()).isEqualTo(SyntaxKind.UNKNOWN);
    assertThat(tokens.diagnostics()).hasSize(1);
    assertThat(tokens.diagnostics().get(0).format())
        .isEqualTo("ERROR: /test/file.bas@1:5 unrecognized character '`'");
  }

  @Test
  public void positions() {
    println("Sub A()");
    println("  Beep");

    TokenStream tokens = tokenize();
    Token beep = tokens.get(7);

    assertThat(beep.kind()).isEqualTo(SyntaxKind.BEEP_KEYWORD);
    assertThat(beep.pos().lineNumber()).isEqualTo(1);
    assertThat(beep.pos().column()).isEqualTo(2);
  }

  @Test
  public void coversEveryCharacter() {
    println("VERSION 5.00");
    println("Attribute VB_Name = \"Module1\"");
    file.append("Private Sub X() : y = a&b ^ 2 ' done\r\n");
    file.append("\t$%@!{}[];?\r");

    TokenStream tokens = tokenize();

    assertThat(tokens.text()).isEqualTo(file.toString());
  }
}
