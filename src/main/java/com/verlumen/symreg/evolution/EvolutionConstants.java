package com.verlumen.symreg.evolution;

/**
 * Default parameters of an evolutionary run. {@link EvolutionConfig} starts from these values.
 */
public final class EvolutionConstants {
  public static final int DEFAULT_POPULATION_SIZE = 1000;
  public static final int TOURNAMENT_SIZE = 7;
  public static final double SUCCESS_THRESHOLD = 0.1;
  public static final int INITIAL_DEPTH = 2;
  public static final int MUTATION_DEPTH = 2;

  /** Generation cap applied by the command line; the engine itself is unbounded by default. */
  public static final int DEFAULT_MAX_GENERATIONS = 100;

  public static final double CONSTANT_MIN = -5.0;
  public static final double CONSTANT_MAX = 5.0;

  private EvolutionConstants() {}
}
