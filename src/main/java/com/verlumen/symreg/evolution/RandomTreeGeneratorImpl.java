package com.verlumen.symreg.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.symreg.expression.Application;
import com.verlumen.symreg.expression.Constant;
import com.verlumen.symreg.expression.Node;
import com.verlumen.symreg.expression.Operator;
import com.verlumen.symreg.expression.OperatorTable;
import com.verlumen.symreg.expression.Variable;
import java.util.random.RandomGenerator;

final class RandomTreeGeneratorImpl implements RandomTreeGenerator {
  private final OperatorTable operatorTable;
  private final TerminalSet terminalSet;

  @Inject
  RandomTreeGeneratorImpl(OperatorTable operatorTable, TerminalSet terminalSet) {
    this.operatorTable = operatorTable;
    this.terminalSet = terminalSet;
  }

  @Override
  public Node randomTree(int maxDepth, RandomGenerator random) {
    checkArgument(maxDepth >= 0, "Depth cannot be negative: %s", maxDepth);
    if (maxDepth == 0 || random.nextBoolean()) {
      return randomTerminal(random);
    }
    Operator operator = operatorTable.randomOperator(random);
    int arity = operatorTable.arity(operator);
    ImmutableList.Builder<Node> children = ImmutableList.builderWithExpectedSize(arity);
    for (int i = 0; i < arity; i++) {
      children.add(randomTree(maxDepth - 1, random));
    }
    return Application.of(operator, children.build());
  }

  @Override
  public Node randomTerminal(RandomGenerator random) {
    if (!terminalSet.constantsEnabled() || random.nextBoolean()) {
      return Variable.get();
    }
    return Constant.of(random.nextDouble(terminalSet.constantMin(), terminalSet.constantMax()));
  }
}
