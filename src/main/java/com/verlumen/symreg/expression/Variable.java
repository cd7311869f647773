package com.verlumen.symreg.expression;

import com.google.common.collect.ImmutableList;

/** The input variable marker. There is a single instance. */
public final class Variable extends Node {
  public static final String SYMBOL = "x";

  private static final Variable INSTANCE = new Variable();

  public static Variable get() {
    return INSTANCE;
  }

  private Variable() {}

  @Override
  public Kind kind() {
    return Kind.VARIABLE;
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
    return SYMBOL;
  }
}
