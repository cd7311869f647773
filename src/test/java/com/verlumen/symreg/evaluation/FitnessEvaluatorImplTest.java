package com.verlumen.symreg.evaluation;

import static com.google.common.truth.Truth.assertThat;

import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.symreg.expression.Constant;
import com.verlumen.symreg.expression.ExpressionParser;
import com.verlumen.symreg.expression.Node;
import com.verlumen.symreg.expression.OperatorTable;
import com.verlumen.symreg.expression.Variable;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FitnessEvaluatorImplTest {
  @Bind private SampleSet samples = FormulaSampleProvider.quadratic().samples();

  @Inject private FitnessEvaluatorImpl evaluator;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void error_ofExactFormula_isZero() {
    Node exact = ExpressionParser.parse("(+ (+ (* x x) x) 1.0)", OperatorTable.standard());

    assertThat(evaluator.error(exact)).isEqualTo(0.0);
  }

  @Test
  public void error_sumsAbsoluteDifferences() {
    // x^2 + x + 1 - x = x^2 + 1, summed over the 21 inputs.
    double expected = 0;
    for (SamplePair pair : samples.pairs()) {
      expected += Math.abs(pair.x() - pair.y());
    }

    assertThat(evaluator.error(Variable.get())).isWithin(1e-9).of(expected);
  }

  @Test
  public void error_isNonNegativeForTerminals() {
    assertThat(evaluator.error(Constant.of(-4.0))).isAtLeast(0.0);
    assertThat(evaluator.error(Constant.of(4.0))).isAtLeast(0.0);
  }

  @Test
  public void error_ofNonFiniteResult_isPositiveInfinity() {
    // inf - inf evaluates to NaN.
    Node overflow =
        ExpressionParser.parse("(- (* 1e200 1e200) (* 1e200 1e200))", OperatorTable.standard());

    assertThat(evaluator.error(overflow)).isPositiveInfinity();
  }

  @Test
  public void error_onSinglePoint_ofMatchingConstant_isZero() {
    FitnessEvaluatorImpl singlePoint = new FitnessEvaluatorImpl(SampleSet.of(SamplePair.of(0, 1)));

    assertThat(singlePoint.error(Constant.of(1.0))).isEqualTo(0.0);
    assertThat(singlePoint.error(Constant.of(0.5))).isEqualTo(0.5);
  }
}
