package com.verlumen.symreg.evolution;

import com.google.auto.value.AutoValue;
import com.verlumen.symreg.expression.Node;

/** An individual together with its error, computed once. */
@AutoValue
public abstract class ScoredIndividual {
  public static ScoredIndividual create(Node individual, double error) {
    return new AutoValue_ScoredIndividual(individual, error);
  }

  public abstract Node individual();

  public abstract double error();
}
