package com.verlumen.symreg.evolution;

import java.util.List;
import java.util.random.RandomGenerator;

/** Picks parents from a population that is already sorted by ascending error. */
public interface TournamentSelection {
  /**
   * Draws {@code tournamentSize} indices uniformly, with replacement, and returns the element at
   * the smallest one. On a sorted population this is the fittest of the sampled individuals.
   *
   * @param sortedPopulation a non-empty list, best first
   * @param tournamentSize number of draws, at least 1
   */
  <T> T select(List<T> sortedPopulation, int tournamentSize, RandomGenerator random);
}
