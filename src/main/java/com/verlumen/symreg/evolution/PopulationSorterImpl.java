package com.verlumen.symreg.evolution;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.symreg.evaluation.FitnessEvaluator;
import com.verlumen.symreg.expression.Node;
import java.util.Comparator;
import java.util.List;

final class PopulationSorterImpl implements PopulationSorter {
  private final FitnessEvaluator fitnessEvaluator;

  @Inject
  PopulationSorterImpl(FitnessEvaluator fitnessEvaluator) {
    this.fitnessEvaluator = fitnessEvaluator;
  }

  @Override
  public ImmutableList<ScoredIndividual> sortByError(List<Node> population) {
    return population.stream()
        .map(individual -> ScoredIndividual.create(individual, fitnessEvaluator.error(individual)))
        .sorted(Comparator.comparingDouble(ScoredIndividual::error))
        .collect(ImmutableList.toImmutableList());
  }
}
