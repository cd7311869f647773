package com.verlumen.symreg.evaluation;

import com.verlumen.symreg.expression.Node;

/** Scores individuals against the run's sample set. Lower is better. */
public interface FitnessEvaluator {
  /**
   * Sums {@code |f(x) - y|} over every sample, where {@code f} is the individual read as a
   * function of its input variable.
   *
   * @return a non-negative error, 0 for a perfect fit and {@link Double#POSITIVE_INFINITY} when
   *     the individual does not evaluate to a finite sum
   */
  double error(Node individual);
}
