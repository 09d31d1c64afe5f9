package vbcst;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;

public class RoundTripTest {

  private static final ImmutableList<String> FRAGMENTS =
      ImmutableList.of(
          "If ", "Then ", "Else ", "End ", "Sub ", "Function ", "Select ", "Case ", "Do ", "Loop ",
          "For ", "Each ", "Next ", "While ", "Wend ", "With ", "Dim ", "As ", "Type ", "Enum ",
          "Begin ", "Property ", "Get ", "x", "y.z", "a!b", "(", ")", ",", ":", "=", "+", "-", "&",
          "&H1F", "1", "2.5#", "\"s\"", "\"open", "#1/2/2000#", "#", " _\n", "\n", "\r\n", "' c\n",
          " ", "`", "[", "]", "Rem r\n", "Version ", "Private ", "Static ", "Not ", "New ", "Is ");

  private static String load(String name) throws IOException {
    return Resources.toString(Resources.getResource("corpus/" + name), StandardCharsets.UTF_8);
  }

  private static ConcreteSyntaxTree parse(String name, String source) {
    ConcreteSyntaxTree tree = ConcreteSyntaxTree.fromSource(name, source);
    assertThat(tree.text()).isEqualTo(source);
    return tree;
  }

  @Test
  public void standardModule() throws IOException {
    ConcreteSyntaxTree tree = parse("Inventory.bas", load("Inventory.bas"));

    assertThat(tree.diagnostics()).isEmpty();
    assertThat(tree.findChildrenByKind(SyntaxKind.SUB_STATEMENT)).hasSize(2);
    assertThat(tree.findChildrenByKind(SyntaxKind.FUNCTION_STATEMENT)).hasSize(3);
    assertThat(tree.findChildrenByKind(SyntaxKind.TYPE_STATEMENT)).hasSize(1);
    assertThat(tree.findChildrenByKind(SyntaxKind.ENUM_STATEMENT)).hasSize(1);
    assertThat(tree.findChildrenByKind(SyntaxKind.DECLARE_STATEMENT)).hasSize(1);
    assertThat(tree.root().findAll(SyntaxKind.SELECT_CASE_STATEMENT)).hasSize(1);
    assertThat(tree.root().findAll(SyntaxKind.LABEL_STATEMENT)).hasSize(1);
  }

  @Test
  public void classModule() throws IOException {
    ConcreteSyntaxTree tree = parse("Account.cls", load("Account.cls"));

    assertThat(tree.diagnostics()).isEmpty();
    assertThat(tree.findChildrenByKind(SyntaxKind.PROPERTIES_BLOCK)).hasSize(1);
    assertThat(tree.findChildrenByKind(SyntaxKind.ATTRIBUTE_STATEMENT)).hasSize(5);
    assertThat(tree.findChildrenByKind(SyntaxKind.EVENT_STATEMENT)).hasSize(1);
    assertThat(tree.findChildrenByKind(SyntaxKind.PROPERTY_STATEMENT)).hasSize(3);
    assertThat(tree.findChildrenByKind(SyntaxKind.SUB_STATEMENT)).hasSize(2);
    assertThat(tree.findChildrenByKind(SyntaxKind.FUNCTION_STATEMENT)).hasSize(1);
  }

  @Test
  public void formModule() throws IOException {
    ConcreteSyntaxTree tree = parse("MainForm.frm", load("MainForm.frm"));

    assertThat(tree.diagnostics()).isEmpty();
    assertThat(tree.findChildrenByKind(SyntaxKind.OBJECT_STATEMENT)).hasSize(1);
    CstNode form = tree.findChildrenByKind(SyntaxKind.PROPERTIES_BLOCK).get(0);
    assertThat(form.childrenByKind(SyntaxKind.PROPERTY)).hasSize(6);
    assertThat(form.childrenByKind(SyntaxKind.PROPERTIES_BLOCK)).hasSize(2);
    assertThat(form.findAll(SyntaxKind.PROPERTY_GROUP)).hasSize(1);
    assertThat(tree.findChildrenByKind(SyntaxKind.SUB_STATEMENT)).hasSize(2);
  }

  @Test
  public void windowsLineEndings() throws IOException {
    for (String name : ImmutableList.of("Inventory.bas", "Account.cls", "MainForm.frm")) {
      String source = load(name).replace("\n", "\r\n");

      ConcreteSyntaxTree tree = parse(name, source);

      assertThat(tree.diagnostics()).isEmpty();
    }
  }

  @Test
  public void malformedModule() throws IOException {
    ConcreteSyntaxTree tree = parse("Broken.bas", load("Broken.bas"));

    assertThat(tree.hasDiagnostics()).isTrue();
    assertThat(tree.containsKind(SyntaxKind.UNKNOWN)).isTrue();
    assertThat(tree.findChildrenByKind(SyntaxKind.SUB_STATEMENT)).hasSize(1);
  }

  @Test
  public void longOperatorChain() {
    StringBuilder source = new StringBuilder("x = a");
    for (int i = 1; i < 10000; i++) source.append(" & a");
    source.append('\n');

    ConcreteSyntaxTree tree = parse("/test/chain.bas", source.toString());

    assertThat(tree.diagnostics()).isEmpty();
    assertThat(tree.root().findAll(SyntaxKind.BINARY_EXPRESSION)).hasSize(9999);
    String debugTree = tree.debugTree();
    assertThat(debugTree).startsWith("Root\n  AssignmentStatement\n");
    assertThat(debugTree).endsWith("    Newline \"\\n\"\n");
  }

  @Test
  public void randomFragments() {
    Random random = new Random(20240601L);
    for (int i = 0; i < 500; i++) {
      StringBuilder source = new StringBuilder();
      int length = random.nextInt(40);
      for (int j = 0; j < length; j++) {
        source.append(FRAGMENTS.get(random.nextInt(FRAGMENTS.size())));
      }

      String text = source.toString();
      assertTimeoutPreemptively(
          Duration.ofSeconds(5),
          () -> {
            parse("/test/random.bas", text);
          });
    }
  }
}
