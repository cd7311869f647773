package com.verlumen.symreg.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.random.RandomGenerator;

final class TournamentSelectionImpl implements TournamentSelection {
  @Override
  public <T> T select(List<T> sortedPopulation, int tournamentSize, RandomGenerator random) {
    checkArgument(!sortedPopulation.isEmpty(), "Cannot select from an empty population");
    checkArgument(tournamentSize > 0, "Tournament size must be positive: %s", tournamentSize);
    int size = sortedPopulation.size();
    int winner = size;
    for (int i = 0; i < tournamentSize; i++) {
      winner = Math.min(winner, random.nextInt(size));
    }
    return sortedPopulation.get(winner);
  }
}
