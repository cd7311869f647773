package com.verlumen.symreg.evolution;

import com.google.auto.value.AutoValue;
import com.verlumen.symreg.expression.Node;
import java.util.Optional;

/**
 * The result of a run. A run without a solution is a normal outcome of a stochastic search, not a
 * failure.
 */
@AutoValue
public abstract class EvolutionOutcome {
  static EvolutionOutcome solved(ScoredIndividual best, int generations) {
    return new AutoValue_EvolutionOutcome(Optional.of(best.individual()), best, generations);
  }

  static EvolutionOutcome exhausted(ScoredIndividual best, int generations) {
    return new AutoValue_EvolutionOutcome(Optional.empty(), best, generations);
  }

  /** The individual that met the success threshold, if any. */
  public abstract Optional<Node> solution();

  /** The best individual of the last evaluated generation. */
  public abstract ScoredIndividual best();

  /** Number of generations evaluated, counting the initial one. */
  public abstract int generations();

  public boolean succeeded() {
    return solution().isPresent();
  }
}
