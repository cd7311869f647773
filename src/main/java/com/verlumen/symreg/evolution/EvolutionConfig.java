package com.verlumen.symreg.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** Parameters of one evolutionary run. */
@AutoValue
public abstract class EvolutionConfig {
  public static Builder builder() {
    return new AutoValue_EvolutionConfig.Builder()
        .setPopulationSize(EvolutionConstants.DEFAULT_POPULATION_SIZE)
        .setTournamentSize(EvolutionConstants.TOURNAMENT_SIZE)
        .setSuccessThreshold(EvolutionConstants.SUCCESS_THRESHOLD)
        .setInitialDepth(EvolutionConstants.INITIAL_DEPTH)
        .setMutationDepth(EvolutionConstants.MUTATION_DEPTH);
  }

  public static EvolutionConfig defaults() {
    return builder().build();
  }

  public abstract int populationSize();

  public abstract int tournamentSize();

  /** A run succeeds once the best error is strictly below this value. */
  public abstract double successThreshold();

  /** Depth bound of the trees in the first generation. */
  public abstract int initialDepth();

  /** Depth bound of the subtrees inserted by mutation. */
  public abstract int mutationDepth();

  /** Number of generations evaluated before giving up; absent means no limit. */
  public abstract Optional<Integer> maxGenerations();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setTournamentSize(int tournamentSize);

    public abstract Builder setSuccessThreshold(double successThreshold);

    public abstract Builder setInitialDepth(int initialDepth);

    public abstract Builder setMutationDepth(int mutationDepth);

    public abstract Builder setMaxGenerations(Integer maxGenerations);

    public abstract Builder setMaxGenerations(Optional<Integer> maxGenerations);

    abstract EvolutionConfig autoBuild();

    public EvolutionConfig build() {
      EvolutionConfig config = autoBuild();
      checkArgument(
          config.populationSize() > 0, "Population size must be positive: %s", config.populationSize());
      checkArgument(
          config.tournamentSize() > 0, "Tournament size must be positive: %s", config.tournamentSize());
      checkArgument(
          config.successThreshold() >= 0,
          "Success threshold cannot be negative: %s",
          config.successThreshold());
      checkArgument(config.initialDepth() >= 0, "Initial depth cannot be negative");
      checkArgument(config.mutationDepth() >= 0, "Mutation depth cannot be negative");
      config
          .maxGenerations()
          .ifPresent(max -> checkArgument(max > 0, "Max generations must be positive: %s", max));
      return config;
    }
  }
}
