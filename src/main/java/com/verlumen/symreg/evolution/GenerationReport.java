package com.verlumen.symreg.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.symreg.expression.Node;
import io.jenetics.stat.DoubleMomentStatistics;

/** Summary of one evaluated generation, as handed to a {@link GenerationListener}. */
@AutoValue
public abstract class GenerationReport {
  /**
   * Summarizes a population sorted by ascending error.
   *
   * @param generation the 0-based generation number
   * @param sortedPopulation a non-empty population, best first
   */
  public static GenerationReport create(
      int generation, ImmutableList<ScoredIndividual> sortedPopulation) {
    checkArgument(!sortedPopulation.isEmpty(), "Cannot report on an empty population");
    ScoredIndividual best = sortedPopulation.get(0);
    DoubleMomentStatistics sizes =
        sortedPopulation.stream()
            .collect(DoubleMomentStatistics.toDoubleMomentStatistics(s -> s.individual().size()));
    DoubleMomentStatistics depths =
        sortedPopulation.stream()
            .collect(DoubleMomentStatistics.toDoubleMomentStatistics(s -> s.individual().depth()));
    return new AutoValue_GenerationReport(
        generation,
        sortedPopulation.size(),
        best.individual(),
        best.error(),
        sortedPopulation.get(sortedPopulation.size() / 2).error(),
        sortedPopulation.get(sortedPopulation.size() - 1).error(),
        sizes.mean(),
        depths.mean());
  }

  public abstract int generation();

  public abstract int populationSize();

  public abstract Node best();

  public abstract double bestError();

  /** Error of the individual at rank {@code populationSize / 2}. */
  public abstract double medianError();

  public abstract double worstError();

  public abstract double meanProgramSize();

  public abstract double meanDepth();
}
