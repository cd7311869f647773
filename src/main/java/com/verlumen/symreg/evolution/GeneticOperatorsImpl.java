package com.verlumen.symreg.evolution;

import com.google.inject.Inject;
import com.verlumen.symreg.expression.Node;
import com.verlumen.symreg.expression.TreeIndex;
import java.util.random.RandomGenerator;

final class GeneticOperatorsImpl implements GeneticOperators {
  private final RandomTreeGenerator treeGenerator;
  private final EvolutionConfig config;

  @Inject
  GeneticOperatorsImpl(RandomTreeGenerator treeGenerator, EvolutionConfig config) {
    this.treeGenerator = treeGenerator;
    this.config = config;
  }

  @Override
  public Node mutate(Node individual, RandomGenerator random) {
    int point = random.nextInt(individual.size());
    return TreeIndex.replaceAt(
        individual, point, treeGenerator.randomTree(config.mutationDepth(), random));
  }

  @Override
  public Node crossover(Node receiver, Node donor, RandomGenerator random) {
    int receiverPoint = random.nextInt(receiver.size());
    int donorPoint = random.nextInt(donor.size());
    return TreeIndex.replaceAt(receiver, receiverPoint, TreeIndex.at(donor, donorPoint));
  }
}
