package vbcst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An immutable node of the concrete syntax tree.
 *
 * <p>A node is either a token leaf, carrying verbatim source text and no children, or a composite
 * carrying an ordered list of children. Every query here returns a fresh read-only view.
 */
@AutoValue
public abstract class CstNode {
  public abstract SyntaxKind kind();

  abstract Optional<String> tokenText();

  public abstract ImmutableList<CstNode> children();

  public static CstNode token(SyntaxKind kind, String text) {
    Preconditions.checkArgument(kind.isToken(), "%s is not a token kind", kind);
    return new AutoValue_CstNode(kind, Optional.of(text), ImmutableList.of());
  }

  public static CstNode node(SyntaxKind kind, List<CstNode> children) {
    Preconditions.checkArgument(kind.isNode(), "%s is not a node kind", kind);
    return new AutoValue_CstNode(kind, Optional.empty(), ImmutableList.copyOf(children));
  }

  public boolean isToken() {
    return tokenText().isPresent();
  }

  /** The verbatim source text this node spans. */
  @Memoized
  public String text() {
    if (isToken()) return tokenText().get();
    // Left-nested operator chains can be far deeper than the call stack allows.
    StringBuilder sb = new StringBuilder();
    Deque<CstNode> stack = new ArrayDeque<>(children());
    while (!stack.isEmpty()) {
      CstNode next = stack.pop();
      if (next.isToken()) {
        sb.append(next.tokenText().get());
      } else {
        next.children().reverse().forEach(stack::push);
      }
    }
    return sb.toString();
  }

  public int childCount() {
    return children().size();
  }

  public Optional<CstNode> firstChild() {
    return children().isEmpty() ? Optional.empty() : Optional.of(children().get(0));
  }

  public Optional<CstNode> lastChild() {
    return children().isEmpty()
        ? Optional.empty()
        : Optional.of(children().get(children().size() - 1));
  }

  public Optional<CstNode> childAt(int index) {
    if (index < 0 || index >= children().size()) return Optional.empty();
    return Optional.of(children().get(index));
  }

  public ImmutableList<CstNode> childrenByKind(SyntaxKind kind) {
    return children()
        .stream()
        .filter(c -> c.kind() == kind)
        .collect(ImmutableList.toImmutableList());
  }

  public Optional<CstNode> firstChildByKind(SyntaxKind kind) {
    return children().stream().filter(c -> c.kind() == kind).findFirst();
  }

  /** True if any descendant (not this node) has the given kind. */
  public boolean containsKind(SyntaxKind kind) {
    return find(kind).isPresent();
  }

  public Optional<CstNode> find(SyntaxKind kind) {
    return findIf(n -> n.kind() == kind);
  }

  public ImmutableList<CstNode> findAll(SyntaxKind kind) {
    return findAllIf(n -> n.kind() == kind);
  }

  public Optional<CstNode> findIf(Predicate<CstNode> predicate) {
    return descendants().stream().filter(predicate).findFirst();
  }

  public ImmutableList<CstNode> findAllIf(Predicate<CstNode> predicate) {
    return descendants().stream().filter(predicate).collect(ImmutableList.toImmutableList());
  }

  /** All descendants in depth-first pre-order, excluding this node. */
  public ImmutableList<CstNode> descendants() {
    List<CstNode> out = new ArrayList<>();
    Deque<CstNode> stack = new ArrayDeque<>(children().reverse());
    while (!stack.isEmpty()) {
      CstNode next = stack.pop();
      out.add(next);
      next.children().reverse().forEach(stack::push);
    }
    return ImmutableList.copyOf(out);
  }

  public ImmutableList<CstNode> nonTokenChildren() {
    return children().stream().filter(c -> !c.isToken()).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<CstNode> tokenChildren() {
    return children().stream().filter(CstNode::isToken).collect(ImmutableList.toImmutableList());
  }

  /** Children that are not whitespace, newlines or comments. */
  public ImmutableList<CstNode> significantChildren() {
    return children()
        .stream()
        .filter(CstNode::isSignificant)
        .collect(ImmutableList.toImmutableList());
  }

  public Optional<CstNode> firstNonWhitespaceChild() {
    return children().stream().filter(c -> !c.isWhitespace()).findFirst();
  }

  public boolean isWhitespace() {
    return kind() == SyntaxKind.WHITESPACE;
  }

  public boolean isNewline() {
    return kind() == SyntaxKind.NEWLINE;
  }

  public boolean isComment() {
    return kind().isComment();
  }

  public boolean isTrivia() {
    return kind().isTrivia();
  }

  public boolean isSignificant() {
    return !isTrivia();
  }

  /** Renders the subtree one node per line, leaves with their quoted text. */
  public String debugTree() {
    StringBuilder sb = new StringBuilder();
    Deque<CstNode> stack = new ArrayDeque<>();
    Deque<Integer> indents = new ArrayDeque<>();
    stack.push(this);
    indents.push(0);
    while (!stack.isEmpty()) {
      CstNode node = stack.pop();
      int indent = indents.pop();
      for (int i = 0; i < indent; i++) sb.append("  ");
      sb.append(node.kind().displayName());
      if (node.isToken()) {
        sb.append(" \"").append(escape(node.tokenText().get())).append('"');
      }
      sb.append('\n');
      for (CstNode child : node.children().reverse()) {
        stack.push(child);
        indents.push(indent + 1);
      }
    }
    return sb.toString();
  }

  private static String escape(String text) {
    return text.replace("\\", "\\\\")
        .replace("\"", "\\\"")
        .replace("\r", "\\r")
        .replace("\n", "\\n")
        .replace("\t", "\\t");
  }

  @Override
  public final String toString() {
    return isToken()
        ? String.format("%s(%s)", kind().displayName(), tokenText().get())
        : String.format("%s[%d]", kind().displayName(), children().size());
  }
}
