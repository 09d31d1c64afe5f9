package vbcst;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.base.VerifyException;

public class TreeBuilderTest {

  private final TreeBuilder builder = new TreeBuilder();

  @Test
  public void buildsNestedNodes() {
    builder.startNode(SyntaxKind.ROOT);
    builder.startNode(SyntaxKind.DIM_STATEMENT);
    builder.token(SyntaxKind.DIM_KEYWORD, "Dim");
    builder.token(SyntaxKind.WHITESPACE, " ");
    builder.token(SyntaxKind.IDENTIFIER, "x");
    builder.finishNode();
    builder.token(SyntaxKind.NEWLINE, "\n");
    builder.finishNode();

    CstNode root = builder.finish();

    assertThat(root.kind()).isEqualTo(SyntaxKind.ROOT);
    assertThat(root.childCount()).isEqualTo(2);
    assertThat(root.children().get(0).kind()).isEqualTo(SyntaxKind.DIM_STATEMENT);
    assertThat(root.children().get(0).childCount()).isEqualTo(3);
    assertThat(root.text()).isEqualTo("Dim x\n");
  }

  @Test
  public void checkpointWrapsNothing() {
    builder.startNode(SyntaxKind.ROOT);
    builder.token(SyntaxKind.IDENTIFIER, "a");
    TreeBuilder.Checkpoint checkpoint = builder.checkpoint();
    builder.startNodeAt(checkpoint, SyntaxKind.IDENTIFIER_EXPRESSION);
    builder.finishNode();
    builder.finishNode();

    CstNode root = builder.finish();

    assertThat(root.childCount()).isEqualTo(2);
    assertThat(root.children().get(1).kind()).isEqualTo(SyntaxKind.IDENTIFIER_EXPRESSION);
    assertThat(root.children().get(1).children()).isEmpty();
  }

  @Test
  public void checkpointWrapsOneSibling() {
    builder.startNode(SyntaxKind.ROOT);
    TreeBuilder.Checkpoint checkpoint = builder.checkpoint();
    builder.token(SyntaxKind.IDENTIFIER, "a");
    builder.startNodeAt(checkpoint, SyntaxKind.IDENTIFIER_EXPRESSION);
    builder.finishNode();
    builder.finishNode();

    CstNode root = builder.finish();

    assertThat(root.childCount()).isEqualTo(1);
    CstNode wrapper = root.children().get(0);
    assertThat(wrapper.kind()).isEqualTo(SyntaxKind.IDENTIFIER_EXPRESSION);
    assertThat(wrapper.children().get(0).kind()).isEqualTo(SyntaxKind.IDENTIFIER);
  }

  @Test
  public void checkpointWrapsClosedNodesAndKeepsAccepting() {
    builder.startNode(SyntaxKind.ROOT);
    builder.token(SyntaxKind.WHITESPACE, " ");
    TreeBuilder.Checkpoint checkpoint = builder.checkpoint();
    builder.startNode(SyntaxKind.NUMERIC_LITERAL_EXPRESSION);
    builder.token(SyntaxKind.INTEGER_LITERAL, "1");
    builder.finishNode();
    builder.token(SyntaxKind.ADDITION_OPERATOR, "+");
    builder.startNodeAt(checkpoint, SyntaxKind.BINARY_EXPRESSION);
    builder.startNode(SyntaxKind.NUMERIC_LITERAL_EXPRESSION);
    builder.token(SyntaxKind.INTEGER_LITERAL, "2");
    builder.finishNode();
    builder.finishNode();
    builder.finishNode();

    CstNode root = builder.finish();

    assertThat(root.childCount()).isEqualTo(2);
    CstNode binary = root.children().get(1);
    assertThat(binary.kind()).isEqualTo(SyntaxKind.BINARY_EXPRESSION);
    assertThat(binary.childCount()).isEqualTo(3);
    assertThat(binary.text()).isEqualTo("1+2");
    assertThat(root.text()).isEqualTo(" 1+2");
  }

  @Test
  public void repeatedWrappingAtOneCheckpointNestsToTheLeft() {
    builder.startNode(SyntaxKind.ROOT);
    TreeBuilder.Checkpoint checkpoint = builder.checkpoint();
    builder.token(SyntaxKind.IDENTIFIER, "a");
    for (String name : new String[] {"b", "c"}) {
      builder.startNodeAt(checkpoint, SyntaxKind.MEMBER_ACCESS_EXPRESSION);
      builder.token(SyntaxKind.PERIOD_OPERATOR, ".");
      builder.token(SyntaxKind.IDENTIFIER, name);
      builder.finishNode();
    }
    builder.finishNode();

    CstNode outer = builder.finish().children().get(0);

    assertThat(outer.text()).isEqualTo("a.b.c");
    assertThat(outer.children().get(0).kind()).isEqualTo(SyntaxKind.MEMBER_ACCESS_EXPRESSION);
    assertThat(outer.children().get(0).text()).isEqualTo("a.b");
  }

  @Test
  public void staleCheckpointIsRejected() {
    builder.startNode(SyntaxKind.ROOT);
    TreeBuilder.Checkpoint checkpoint = builder.checkpoint();
    builder.startNode(SyntaxKind.STATEMENT_LIST);

    assertThrows(
        IllegalArgumentException.class,
        () -> builder.startNodeAt(checkpoint, SyntaxKind.BINARY_EXPRESSION));
  }

  @Test
  public void unbalancedFramesAreProgrammingErrors() {
    assertThrows(IllegalStateException.class, builder::finishNode);
    assertThrows(
        IllegalStateException.class, () -> builder.token(SyntaxKind.IDENTIFIER, "orphan"));

    builder.startNode(SyntaxKind.ROOT);
    builder.startNode(SyntaxKind.STATEMENT_LIST);
    builder.finishNode();
    assertThrows(VerifyException.class, builder::finish);
  }

  @Test
  public void tokenKindsAndNodeKindsAreNotInterchangeable() {
    builder.startNode(SyntaxKind.ROOT);

    assertThrows(
        IllegalArgumentException.class, () -> builder.token(SyntaxKind.IF_STATEMENT, "If"));
  }

  @Test
  public void nothingBuilt() {
    assertThrows(IllegalStateException.class, builder::finish);
  }

  @Test
  public void depthAndChildCount() {
    builder.startNode(SyntaxKind.ROOT);
    builder.token(SyntaxKind.IDENTIFIER, "a");
    builder.startNode(SyntaxKind.STATEMENT_LIST);

    assertThat(builder.depth()).isEqualTo(2);
    assertThat(builder.childCount()).isEqualTo(0);

    builder.finishNode();
    assertThat(builder.childCount()).isEqualTo(2);
  }
}
