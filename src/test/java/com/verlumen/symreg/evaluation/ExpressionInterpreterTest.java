package com.verlumen.symreg.evaluation;

import static com.google.common.truth.Truth.assertThat;

import com.verlumen.symreg.expression.ExpressionParser;
import com.verlumen.symreg.expression.Node;
import com.verlumen.symreg.expression.OperatorTable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExpressionInterpreterTest {
  private static final OperatorTable OPERATORS = OperatorTable.parse("+,-,*,pd,inc");

  @Test
  public void evaluate_variableBindsInput() {
    assertThat(ExpressionInterpreter.evaluate(parse("x"), 3.5)).isEqualTo(3.5);
  }

  @Test
  public void evaluate_constantIgnoresInput() {
    assertThat(ExpressionInterpreter.evaluate(parse("-1.25"), 3.5)).isEqualTo(-1.25);
  }

  @Test
  public void evaluate_appliesOperatorsBottomUp() {
    Node tree = parse("(- (* x x) (pd x 2.0))");

    assertThat(ExpressionInterpreter.evaluate(tree, 4.0)).isEqualTo(14.0);
    assertThat(ExpressionInterpreter.evaluate(parse("(inc (inc x))"), 1.0)).isEqualTo(3.0);
  }

  @Test
  public void evaluate_divisionByZeroYieldsZero() {
    assertThat(ExpressionInterpreter.evaluate(parse("(pd x (- x x))"), 5.0)).isEqualTo(0.0);
    assertThat(ExpressionInterpreter.evaluate(parse("(pd 0.0 0.0)"), 0.0)).isEqualTo(0.0);
  }

  private static Node parse(String text) {
    return ExpressionParser.parse(text, OPERATORS);
  }
}
