package com.verlumen.symreg.evolution;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.symreg.expression.OperatorTable;
import io.jenetics.util.RandomRegistry;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

@AutoValue
public abstract class EvolutionModule extends AbstractModule {
  public static EvolutionModule create(EvolutionConfig config) {
    return create(config, OperatorTable.standard(), TerminalSet.standard(), Optional.empty());
  }

  /**
   * @param seed fixes the random stream for reproducible runs; when absent the stream comes from
   *     the Jenetics {@link RandomRegistry}
   */
  public static EvolutionModule create(
      EvolutionConfig config,
      OperatorTable operatorTable,
      TerminalSet terminalSet,
      Optional<Long> seed) {
    return new AutoValue_EvolutionModule(config, operatorTable, terminalSet, seed);
  }

  abstract EvolutionConfig config();

  abstract OperatorTable operatorTable();

  abstract TerminalSet terminalSet();

  abstract Optional<Long> seed();

  @Override
  protected void configure() {
    bind(EvolutionConfig.class).toInstance(config());
    bind(OperatorTable.class).toInstance(operatorTable());
    bind(TerminalSet.class).toInstance(terminalSet());
    bind(RandomTreeGenerator.class).to(RandomTreeGeneratorImpl.class);
    bind(GeneticOperators.class).to(GeneticOperatorsImpl.class);
    bind(TournamentSelection.class).to(TournamentSelectionImpl.class);
    bind(PopulationSorter.class).to(PopulationSorterImpl.class);
    bind(GenerationListener.class).to(LoggingGenerationListener.class);
    bind(EvolutionEngine.class).to(EvolutionEngineImpl.class);
  }

  @Provides
  @Singleton
  RandomGenerator provideRandomGenerator() {
    return seed().<RandomGenerator>map(SplittableRandom::new).orElseGet(RandomRegistry::random);
  }
}
