package com.verlumen.symreg.evolution;

/** Runs the generational search. */
public interface EvolutionEngine {
  /**
   * Evolves a random initial population until the best individual's error drops below the
   * success threshold or the configured generation budget is spent.
   *
   * <p>The population size, like every other run parameter, is taken from the bound {@link
   * EvolutionConfig#populationSize()}; each generation keeps exactly that many individuals.
   *
   * @return the outcome; {@link EvolutionOutcome#succeeded()} is false when the budget ran out
   */
  EvolutionOutcome evolve();
}
