package com.verlumen.symreg.expression;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A numeric terminal. */
@AutoValue
public abstract class Constant extends Node {
  public static Constant of(double value) {
    return new AutoValue_Constant(value);
  }

  public abstract double value();

  @Override
  public Kind kind() {
    return Kind.CONSTANT;
  }

  @Override
  public int size() {
    return 1;
  }

  @Override
  public int depth() {
    return 0;
  }

  @Override
  public ImmutableList<Node> children() {
    return ImmutableList.of();
  }

  @Override
  public String toString() {
    return Double.toString(value());
  }
}
