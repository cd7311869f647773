package com.verlumen.symreg.expression;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/** The fixed set of functions an expression tree may apply. */
public enum Operator {
  ADD("+", 2, a -> a[0] + a[1]),
  SUBTRACT("-", 2, a -> a[0] - a[1]),
  MULTIPLY("*", 2, a -> a[0] * a[1]),
  PROTECTED_DIVIDE("pd", 2, a -> protectedDivide(a[0], a[1])),
  INCREMENT("inc", 1, a -> a[0] + 1);

  private final String symbol;
  private final int arity;
  private final ToDoubleFunction<double[]> function;

  Operator(String symbol, int arity, ToDoubleFunction<double[]> function) {
    this.symbol = symbol;
    this.arity = arity;
    this.function = function;
  }

  public String symbol() {
    return symbol;
  }

  public int arity() {
    return arity;
  }

  public double apply(double... arguments) {
    checkArgument(
        arguments.length == arity,
        "Operator %s takes %s arguments but got %s",
        symbol,
        arity,
        arguments.length);
    return function.applyAsDouble(arguments);
  }

  /** Returns 0 when {@code denominator} is zero, {@code numerator / denominator} otherwise. */
  public static double protectedDivide(double numerator, double denominator) {
    return denominator == 0.0 ? 0.0 : numerator / denominator;
  }

  public static Optional<Operator> forSymbol(String symbol) {
    return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
  }
}
