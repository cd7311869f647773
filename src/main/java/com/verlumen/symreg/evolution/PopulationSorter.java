package com.verlumen.symreg.evolution;

import com.google.common.collect.ImmutableList;
import com.verlumen.symreg.expression.Node;
import java.util.List;

/** Orders a population from lowest to highest error. */
public interface PopulationSorter {
  /**
   * Scores every individual exactly once and sorts them by ascending error.
   *
   * @return a list of the same size as {@code population}
   */
  ImmutableList<ScoredIndividual> sortByError(List<Node> population);
}
