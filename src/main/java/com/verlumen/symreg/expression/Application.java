package com.verlumen.symreg.expression;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * An operator applied to an ordered list of child trees. The number of children always equals
 * {@link Operator#arity()}.
 */
@AutoValue
public abstract class Application extends Node {
  public static Application of(Operator operator, List<? extends Node> children) {
    checkNotNull(operator, "operator");
    ImmutableList<Node> copy = ImmutableList.copyOf(children);
    checkArgument(
        copy.size() == operator.arity(),
        "Operator %s takes %s children but got %s",
        operator.symbol(),
        operator.arity(),
        copy.size());
    return new AutoValue_Application(operator, copy);
  }

  public static Application of(Operator operator, Node... children) {
    return of(operator, ImmutableList.copyOf(children));
  }

  public abstract Operator operator();

  @Override
  public abstract ImmutableList<Node> children();

  @Override
  public Kind kind() {
    return Kind.APPLICATION;
  }

  @Memoized
  @Override
  public int size() {
    int size = 1;
    for (Node child : children()) {
      size += child.size();
    }
    return size;
  }

  @Memoized
  @Override
  public int depth() {
    int deepest = 0;
    for (Node child : children()) {
      deepest = Math.max(deepest, child.depth());
    }
    return deepest + 1;
  }

  @Memoized
  @Override
  public abstract int hashCode();

  /** Prefix form, e.g. {@code (+ x 1.0)}. */
  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder("(").append(operator().symbol());
    for (Node child : children()) {
      builder.append(' ').append(child);
    }
    return builder.append(')').toString();
  }
}
