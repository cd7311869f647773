package com.verlumen.symreg.expression;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * Addresses the nodes of a tree by their position in a depth-first, pre-order walk. Position 0 is
 * the root; an application is visited before its children, which are visited left to right.
 *
 * <p>Every index is first normalized to {@code |index| mod size(tree)}, so any integer resolves
 * to a node.
 */
public final class TreeIndex {

  /** Maps an arbitrary integer onto {@code [0, tree.size())}. */
  public static int normalize(Node tree, int pointIndex) {
    return (int) (Math.abs((long) pointIndex) % tree.size());
  }

  /**
   * Returns the subtree rooted at the node visited at {@code pointIndex}.
   *
   * @param tree the tree to walk
   * @param pointIndex any integer; normalized before use
   * @return the whole subtree at that position, which is {@code tree} itself for position 0
   */
  public static Node at(Node tree, int pointIndex) {
    checkNotNull(tree, "tree");
    Node current = tree;
    int remaining = normalize(tree, pointIndex);
    while (remaining > 0) {
      checkState(!current.isTerminal(), "Position outside of %s", tree);
      remaining--;
      Node next = null;
      for (Node child : current.children()) {
        if (remaining < child.size()) {
          next = child;
          break;
        }
        remaining -= child.size();
      }
      current = checkNotNull(next, "Position outside of %s", tree);
    }
    return current;
  }

  /**
   * Returns a copy of {@code tree} in which the subtree at {@code pointIndex} is replaced by
   * {@code replacement}. Only the ancestors of the replaced position are rebuilt; every other
   * subtree is shared with {@code tree}, which is left untouched.
   */
  public static Node replaceAt(Node tree, int pointIndex, Node replacement) {
    checkNotNull(tree, "tree");
    checkNotNull(replacement, "replacement");
    return replace(tree, normalize(tree, pointIndex), replacement);
  }

  private static Node replace(Node node, int position, Node replacement) {
    if (position == 0) {
      return replacement;
    }
    checkState(!node.isTerminal(), "Position %s outside of %s", position, node);
    Application application = (Application) node;
    ImmutableList<Node> children = application.children();
    int remaining = position - 1;
    for (int i = 0; i < children.size(); i++) {
      Node child = children.get(i);
      if (remaining < child.size()) {
        List<Node> rebuilt = new ArrayList<>(children);
        rebuilt.set(i, replace(child, remaining, replacement));
        return Application.of(application.operator(), rebuilt);
      }
      remaining -= child.size();
    }
    throw new IllegalStateException("Position " + position + " outside of " + node);
  }

  private TreeIndex() {}
}
