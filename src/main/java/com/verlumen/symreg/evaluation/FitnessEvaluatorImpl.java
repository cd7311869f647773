package com.verlumen.symreg.evaluation;

import com.google.inject.Inject;
import com.verlumen.symreg.expression.Node;

final class FitnessEvaluatorImpl implements FitnessEvaluator {
  private final SampleSet samples;

  @Inject
  FitnessEvaluatorImpl(SampleSet samples) {
    this.samples = samples;
  }

  @Override
  public double error(Node individual) {
    double sum = 0;
    for (SamplePair pair : samples.pairs()) {
      sum += Math.abs(ExpressionInterpreter.evaluate(individual, pair.x()) - pair.y());
    }
    // NaN would break the ordering of a sorted population.
    return Double.isNaN(sum) ? Double.POSITIVE_INFINITY : sum;
  }
}
