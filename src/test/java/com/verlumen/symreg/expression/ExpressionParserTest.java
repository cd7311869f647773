package com.verlumen.symreg.expression;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExpressionParserTest {
  private static final OperatorTable STANDARD = OperatorTable.standard();

  @Test
  public void parse_terminals() {
    assertThat(ExpressionParser.parse("x", STANDARD)).isSameInstanceAs(Variable.get());
    assertThat(ExpressionParser.parse(" -2.5 ", STANDARD)).isEqualTo(Constant.of(-2.5));
    assertThat(ExpressionParser.parse("1.0E-5", STANDARD)).isEqualTo(Constant.of(1.0e-5));
  }

  @Test
  public void parse_nestedApplications() {
    Node tree = ExpressionParser.parse("(+ (*  x x)\n (pd x -3.0))", STANDARD);

    assertThat(tree)
        .isEqualTo(
            Application.of(
                Operator.ADD,
                Application.of(Operator.MULTIPLY, Variable.get(), Variable.get()),
                Application.of(Operator.PROTECTED_DIVIDE, Variable.get(), Constant.of(-3.0))));
  }

  @Test
  public void parse_readsBackToString() {
    String text = "(- (pd 4.25 x) (* (+ x 1.0) -0.5))";

    assertThat(ExpressionParser.parse(text, STANDARD).toString()).isEqualTo(text);
  }

  @Test
  public void parse_operatorOutsideTable_throws() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class, () -> ExpressionParser.parse("(inc x)", STANDARD));

    assertThat(thrown).hasMessageThat().contains("Unknown operator at 1: 'inc'");
  }

  @Test
  public void parse_wrongArity_throws() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class, () -> ExpressionParser.parse("(+ x 1 2)", STANDARD));

    assertThat(thrown).hasMessageThat().contains("takes 2 arguments but got 3");
  }

  @Test
  public void parse_malformedInput_throws() {
    assertThrows(IllegalArgumentException.class, () -> ExpressionParser.parse("(+ x 1", STANDARD));
    assertThrows(IllegalArgumentException.class, () -> ExpressionParser.parse("(+ x 1))", STANDARD));
    assertThrows(IllegalArgumentException.class, () -> ExpressionParser.parse("y", STANDARD));
    assertThrows(IllegalArgumentException.class, () -> ExpressionParser.parse("", STANDARD));
    assertThrows(IllegalArgumentException.class, () -> ExpressionParser.parse(")", STANDARD));
    assertThrows(IllegalArgumentException.class, () -> ExpressionParser.parse("()", STANDARD));
  }
}
