package vbcst;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class ConcreteSyntaxTreeTest {

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private ConcreteSyntaxTree parse() {
    return ConcreteSyntaxTree.fromSource("/test/tree.bas", file.toString());
  }

  @Test
  public void emptyInput() {
    ConcreteSyntaxTree tree = parse();

    assertThat(tree.rootKind()).isEqualTo(SyntaxKind.ROOT);
    assertThat(tree.childCount()).isEqualTo(0);
    assertThat(tree.text()).isEmpty();
    assertThat(tree.firstChild()).isEmpty();
    assertThat(tree.hasDiagnostics()).isFalse();
    assertThat(tree.debugTree()).isEqualTo("Root\n");
  }

  @Test
  public void debugTree() {
    println("x = 1");

    assertThat(parse().debugTree())
        .isEqualTo(
            "Root\n"
                + "  AssignmentStatement\n"
                + "    IdentifierExpression\n"
                + "      Identifier \"x\"\n"
                + "    Whitespace \" \"\n"
                + "    EqualityOperator \"=\"\n"
                + "    Whitespace \" \"\n"
                + "    NumericLiteralExpression\n"
                + "      IntegerLiteral \"1\"\n"
                + "    Newline \"\\n\"\n");
  }

  @Test
  public void rootQueries() {
    println("Option Explicit");
    println("Dim x As Long");
    println("Sub Main()");
    println("End Sub");

    ConcreteSyntaxTree tree = parse();

    assertThat(tree.childCount()).isEqualTo(3);
    assertThat(tree.children().stream().map(CstNode::kind).collect(ImmutableList.toImmutableList()))
        .containsExactly(
            SyntaxKind.OPTION_STATEMENT, SyntaxKind.DIM_STATEMENT, SyntaxKind.SUB_STATEMENT)
        .inOrder();
    assertThat(tree.findChildrenByKind(SyntaxKind.DIM_STATEMENT)).hasSize(1);
    assertThat(tree.findChildrenByKind(SyntaxKind.IDENTIFIER)).isEmpty();
    assertThat(tree.containsKind(SyntaxKind.IDENTIFIER)).isTrue();
    assertThat(tree.containsKind(SyntaxKind.ROOT)).isFalse();
    assertThat(tree.firstChild().get().kind()).isEqualTo(SyntaxKind.OPTION_STATEMENT);
    assertThat(tree.lastChild().get().kind()).isEqualTo(SyntaxKind.SUB_STATEMENT);
    assertThat(tree.childAt(1).get().text()).isEqualTo("Dim x As Long\n");
    assertThat(tree.childAt(3)).isEmpty();
    assertThat(tree.childAt(-1)).isEmpty();
  }

  @Test
  public void nodeNavigation() {
    println("x = 1");

    CstNode assignment = parse().firstChild().get();

    assertThat(assignment.toString()).isEqualTo("AssignmentStatement[6]");
    assertThat(assignment.tokenChildren()).hasSize(4);
    assertThat(assignment.nonTokenChildren()).hasSize(2);
    assertThat(assignment.firstNonWhitespaceChild().get().kind())
        .isEqualTo(SyntaxKind.IDENTIFIER_EXPRESSION);
    assertThat(assignment.descendants().get(0).kind()).isEqualTo(SyntaxKind.IDENTIFIER_EXPRESSION);
    assertThat(assignment.descendants().get(1).toString()).isEqualTo("Identifier(x)");
    assertThat(assignment.find(SyntaxKind.INTEGER_LITERAL).get().text()).isEqualTo("1");
    assertThat(assignment.findAllIf(CstNode::isWhitespace)).hasSize(2);
    assertThat(assignment.findIf(CstNode::isNewline)).isPresent();
    assertThat(assignment.findAll(SyntaxKind.COMMA)).isEmpty();
  }

  @Test
  public void leavesAndCompositesAreDistinct() {
    CstNode leaf = CstNode.token(SyntaxKind.IDENTIFIER, "x");

    assertThat(leaf.isToken()).isTrue();
    assertThat(leaf.children()).isEmpty();
    assertThat(CstNode.node(SyntaxKind.IDENTIFIER_EXPRESSION, ImmutableList.of(leaf)).text())
        .isEqualTo("x");
    assertThrows(
        IllegalArgumentException.class, () -> CstNode.token(SyntaxKind.IF_STATEMENT, "If"));
    assertThrows(
        IllegalArgumentException.class,
        () -> CstNode.node(SyntaxKind.IDENTIFIER, ImmutableList.of()));
  }

  @Test
  public void treesAreValues() {
    println("If a Then b = 1 Else b = 2");

    ConcreteSyntaxTree first = parse();
    ConcreteSyntaxTree second = parse();

    assertThat(first).isEqualTo(second);
    assertThrows(
        UnsupportedOperationException.class,
        () -> first.children().add(CstNode.token(SyntaxKind.NEWLINE, "\n")));
  }

  @Test
  public void parsesCallerSuppliedTokens() {
    TokenStream tokens =
        TokenStream.create(
            "/test/manual.bas",
            ImmutableList.of(
                Token.create("Beep", SyntaxKind.BEEP_KEYWORD),
                Token.create("\n", SyntaxKind.NEWLINE),
                Token.create(")", SyntaxKind.RIGHT_PARENTHESIS)));

    ConcreteSyntaxTree tree = Parser.parse(tokens);

    assertThat(tree.text()).isEqualTo("Beep\n)");
    assertThat(tree.findChildrenByKind(SyntaxKind.BEEP_STATEMENT)).hasSize(1);
    assertThat(tree.diagnostics()).hasSize(1);
    assertThat(tree.diagnostics().get(0).format())
        .isEqualTo("ERROR: <internal>@0:0 unexpected ')' in statement position");
  }
}
