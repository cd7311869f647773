package com.verlumen.symreg.expression;

import com.google.common.collect.ImmutableList;

/**
 * An immutable expression tree. A node is either a terminal ({@link Variable} or {@link Constant})
 * or an {@link Application} of an {@link Operator} to exactly {@code arity} children.
 *
 * <p>The hierarchy is closed: the constructor is package-private, so every node is one of the
 * three kinds reported by {@link #kind()}.
 */
public abstract class Node {
  /** Tag used to dispatch on the shape of a node. */
  public enum Kind {
    VARIABLE,
    CONSTANT,
    APPLICATION
  }

  Node() {}

  public abstract Kind kind();

  /** Total number of nodes, counting this node and every descendant exactly once. */
  public abstract int size();

  /** Length of the longest path to a terminal; terminals have depth 0. */
  public abstract int depth();

  /** Ordered children; empty for terminals. */
  public abstract ImmutableList<Node> children();

  public final boolean isTerminal() {
    return kind() != Kind.APPLICATION;
  }
}
