package vbcst;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A finished parse: the root {@link CstNode} plus the diagnostics recorded while building it.
 *
 * <p>{@link #text()} always reproduces the parsed source exactly, whether or not there were
 * diagnostics.
 */
@AutoValue
public abstract class ConcreteSyntaxTree {
  public abstract CstNode root();

  public abstract ImmutableList<ParseDiagnostic> diagnostics();

  static ConcreteSyntaxTree create(CstNode root, ImmutableList<ParseDiagnostic> diagnostics) {
    return new AutoValue_ConcreteSyntaxTree(root, diagnostics);
  }

  public static ConcreteSyntaxTree fromSource(String fileName, String source) {
    return fromSource(fileName, source, ParserOptions.defaults());
  }

  public static ConcreteSyntaxTree fromSource(
      String fileName, String source, ParserOptions options) {
    return Parser.parse(new Tokenizer(fileName, source).tokenize(), options);
  }

  public SyntaxKind rootKind() {
    return root().kind();
  }

  public String text() {
    return root().text();
  }

  public int childCount() {
    return root().childCount();
  }

  public ImmutableList<CstNode> children() {
    return root().children();
  }

  /** Children of the root with the given kind; does not descend. */
  public ImmutableList<CstNode> findChildrenByKind(SyntaxKind kind) {
    return root().childrenByKind(kind);
  }

  public boolean containsKind(SyntaxKind kind) {
    return root().containsKind(kind);
  }

  public Optional<CstNode> firstChild() {
    return root().firstChild();
  }

  public Optional<CstNode> lastChild() {
    return root().lastChild();
  }

  public Optional<CstNode> childAt(int index) {
    return root().childAt(index);
  }

  public String debugTree() {
    return root().debugTree();
  }

  public boolean hasDiagnostics() {
    return !diagnostics().isEmpty();
  }

  /** Throws for the first recorded diagnostic, if any. */
  public void verifyNoDiagnostics() throws ParseException {
    if (hasDiagnostics()) throw diagnostics().get(0).toException();
  }
}
