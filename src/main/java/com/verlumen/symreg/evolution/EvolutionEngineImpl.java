package com.verlumen.symreg.evolution;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.symreg.expression.Node;
import java.util.random.RandomGenerator;

/**
 * Generational search without elitism. Each new generation is made of mutated tournament winners
 * (half), crossovers of two winners (a quarter) and verbatim winners (the rest).
 */
final class EvolutionEngineImpl implements EvolutionEngine {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EvolutionConfig config;
  private final RandomTreeGenerator treeGenerator;
  private final GeneticOperators geneticOperators;
  private final TournamentSelection selection;
  private final PopulationSorter sorter;
  private final GenerationListener listener;
  private final RandomGenerator random;

  @Inject
  EvolutionEngineImpl(
      EvolutionConfig config,
      RandomTreeGenerator treeGenerator,
      GeneticOperators geneticOperators,
      TournamentSelection selection,
      PopulationSorter sorter,
      GenerationListener listener,
      RandomGenerator random) {
    this.config = config;
    this.treeGenerator = treeGenerator;
    this.geneticOperators = geneticOperators;
    this.selection = selection;
    this.sorter = sorter;
    this.listener = listener;
    this.random = random;
  }

  @Override
  public EvolutionOutcome evolve() {
    listener.onStart(config);
    ImmutableList<ScoredIndividual> population = sorter.sortByError(initialPopulation());
    for (int generation = 0; ; generation++) {
      listener.onGeneration(GenerationReport.create(generation, population));
      ScoredIndividual best = population.get(0);
      int evaluated = generation + 1;
      if (best.error() < config.successThreshold()) {
        EvolutionOutcome outcome = EvolutionOutcome.solved(best, evaluated);
        listener.onSuccess(outcome);
        return outcome;
      }
      if (config.maxGenerations().isPresent() && evaluated >= config.maxGenerations().get()) {
        EvolutionOutcome outcome = EvolutionOutcome.exhausted(best, evaluated);
        listener.onExhausted(outcome);
        return outcome;
      }
      population = sorter.sortByError(nextGeneration(population));
      logger.atFine().log("Generation %d replaced", evaluated);
    }
  }

  private ImmutableList<Node> initialPopulation() {
    ImmutableList.Builder<Node> population =
        ImmutableList.builderWithExpectedSize(config.populationSize());
    for (int i = 0; i < config.populationSize(); i++) {
      population.add(treeGenerator.randomTree(config.initialDepth(), random));
    }
    return population.build();
  }

  /** Remainders of the halving and quartering go to the verbatim group. */
  ImmutableList<Node> nextGeneration(ImmutableList<ScoredIndividual> sortedPopulation) {
    int size = config.populationSize();
    int mutations = size / 2;
    int crossovers = size / 4;
    int copies = size - mutations - crossovers;

    ImmutableList.Builder<Node> next = ImmutableList.builderWithExpectedSize(size);
    for (int i = 0; i < mutations; i++) {
      next.add(geneticOperators.mutate(select(sortedPopulation), random));
    }
    for (int i = 0; i < crossovers; i++) {
      next.add(
          geneticOperators.crossover(select(sortedPopulation), select(sortedPopulation), random));
    }
    for (int i = 0; i < copies; i++) {
      next.add(select(sortedPopulation));
    }
    return next.build();
  }

  private Node select(ImmutableList<ScoredIndividual> sortedPopulation) {
    return selection.select(sortedPopulation, config.tournamentSize(), random).individual();
  }
}
