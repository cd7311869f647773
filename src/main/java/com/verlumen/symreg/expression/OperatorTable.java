package com.verlumen.symreg.expression;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.random.RandomGenerator;

/**
 * The operators available to random generation and parsing. Tables are immutable and never
 * empty; iteration order is the order the operators were given in.
 */
@AutoValue
public abstract class OperatorTable {
  private static final OperatorTable STANDARD =
      of(Operator.ADD, Operator.SUBTRACT, Operator.MULTIPLY, Operator.PROTECTED_DIVIDE);

  /** The base function set: {@code +, -, *, pd}. */
  public static OperatorTable standard() {
    return STANDARD;
  }

  public static OperatorTable of(Operator... operators) {
    return of(ImmutableList.copyOf(operators));
  }

  public static OperatorTable of(Iterable<Operator> operators) {
    ImmutableList<Operator> distinct = ImmutableSet.copyOf(operators).asList();
    checkArgument(!distinct.isEmpty(), "Operator table cannot be empty");
    return new AutoValue_OperatorTable(distinct);
  }

  /** Parses a comma separated list of operator symbols such as {@code "+,-,*,pd"}. */
  public static OperatorTable parse(String symbols) {
    ImmutableList.Builder<Operator> operators = ImmutableList.builder();
    for (String symbol : Splitter.on(',').trimResults().omitEmptyStrings().split(symbols)) {
      operators.add(
          Operator.forSymbol(symbol)
              .orElseThrow(() -> new IllegalArgumentException("Unknown operator: " + symbol)));
    }
    return of(operators.build());
  }

  public abstract ImmutableList<Operator> operators();

  public boolean contains(Operator operator) {
    return operators().contains(operator);
  }

  public int arity(Operator operator) {
    checkArgument(contains(operator), "Operator %s is not in %s", operator, operators());
    return operator.arity();
  }

  /** Picks an operator uniformly at random. */
  public Operator randomOperator(RandomGenerator random) {
    return operators().get(random.nextInt(operators().size()));
  }
}
