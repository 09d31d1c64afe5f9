package vbcst;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;

/**
 * Assembles a {@link CstNode} tree from a stream of open/token/close events.
 *
 * <p>A {@link Checkpoint} remembers a position among the children of the currently open node.
 * {@link #startNodeAt} later wraps every child emitted since that position, closed composites
 * included, into a new node. This lets left-associative chains be built in one forward pass.
 */
public class TreeBuilder {

  /** A position among the children of an open node. */
  @AutoValue
  public abstract static class Checkpoint {
    abstract int depth();

    abstract int childIndex();

    static Checkpoint create(int depth, int childIndex) {
      return new AutoValue_TreeBuilder_Checkpoint(depth, childIndex);
    }
  }

  private static class Frame {
    private final SyntaxKind kind;
    private final List<CstNode> children = new ArrayList<>();

    private Frame(SyntaxKind kind) {
      this.kind = kind;
    }
  }

  private final List<Frame> frames = new ArrayList<>();
  private Optional<CstNode> root = Optional.empty();

  public void startNode(SyntaxKind kind) {
    Preconditions.checkState(!root.isPresent(), "tree is already finished");
    frames.add(new Frame(kind));
  }

  public void token(SyntaxKind kind, String text) {
    current().children.add(CstNode.token(kind, text));
  }

  public void finishNode() {
    Preconditions.checkState(!frames.isEmpty(), "finishNode() without an open node");
    Frame frame = frames.remove(frames.size() - 1);
    CstNode node = CstNode.node(frame.kind, frame.children);
    if (frames.isEmpty()) {
      root = Optional.of(node);
    } else {
      current().children.add(node);
    }
  }

  public Checkpoint checkpoint() {
    return Checkpoint.create(frames.size(), current().children.size());
  }

  /**
   * Opens a node that adopts every child emitted since {@code checkpoint}. The node stays open
   * until the matching {@link #finishNode}.
   */
  public void startNodeAt(Checkpoint checkpoint, SyntaxKind kind) {
    Preconditions.checkArgument(
        checkpoint.depth() == frames.size(),
        "checkpoint taken at depth %s, builder is at depth %s",
        checkpoint.depth(),
        frames.size());
    List<CstNode> siblings = current().children;
    Preconditions.checkArgument(
        checkpoint.childIndex() <= siblings.size(), "checkpoint is past the last child");

    Frame frame = new Frame(kind);
    List<CstNode> adopted = siblings.subList(checkpoint.childIndex(), siblings.size());
    frame.children.addAll(adopted);
    adopted.clear();
    frames.add(frame);
  }

  /** Number of currently open nodes. */
  public int depth() {
    return frames.size();
  }

  /** Number of children of the innermost open node. */
  public int childCount() {
    return current().children.size();
  }

  public CstNode finish() {
    Verify.verify(frames.isEmpty(), "%s node(s) left open", frames.size());
    Preconditions.checkState(root.isPresent(), "no root node was built");
    return root.get();
  }

  private Frame current() {
    Preconditions.checkState(!frames.isEmpty(), "no open node");
    return frames.get(frames.size() - 1);
  }
}
