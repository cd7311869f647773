package com.verlumen.symreg.evolution;

import com.verlumen.symreg.expression.Node;
import java.util.random.RandomGenerator;

/** Variation operators. Both return new trees and leave their arguments unchanged. */
public interface GeneticOperators {
  /** Replaces a uniformly chosen point of {@code individual} with a fresh random subtree. */
  Node mutate(Node individual, RandomGenerator random);

  /**
   * Replaces a uniformly chosen point of {@code receiver} with a copy of a uniformly chosen subtree
   * of {@code donor}.
   */
  Node crossover(Node receiver, Node donor, RandomGenerator random);
}
