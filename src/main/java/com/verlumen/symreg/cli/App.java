package com.verlumen.symreg.cli;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.verlumen.symreg.evaluation.EvaluationModule;
import com.verlumen.symreg.evaluation.FileSampleProvider;
import com.verlumen.symreg.evaluation.FitnessEvaluator;
import com.verlumen.symreg.evaluation.FormulaSampleProvider;
import com.verlumen.symreg.evaluation.SampleProvider;
import com.verlumen.symreg.evolution.EvolutionConfig;
import com.verlumen.symreg.evolution.EvolutionConstants;
import com.verlumen.symreg.evolution.EvolutionEngine;
import com.verlumen.symreg.evolution.EvolutionModule;
import com.verlumen.symreg.evolution.EvolutionOutcome;
import com.verlumen.symreg.evolution.TerminalSet;
import com.verlumen.symreg.expression.ExpressionParser;
import com.verlumen.symreg.expression.Node;
import com.verlumen.symreg.expression.OperatorTable;
import java.io.File;
import java.io.UncheckedIOException;
import java.util.Optional;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.helper.HelpScreenException;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Command-line entry point. Evolves an expression that fits the target samples, or with {@code
 * --evaluate} scores a given expression against them.
 */
public final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final int EXIT_SUCCESS = 0;
  static final int EXIT_NO_SOLUTION = 1;
  static final int EXIT_USAGE = 2;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  @VisibleForTesting
  static int run(String[] args) {
    ArgumentParser parser = createArgumentParser();
    Namespace namespace;
    try {
      namespace = parser.parseArgs(args);
    } catch (HelpScreenException e) {
      return EXIT_SUCCESS;
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      return EXIT_USAGE;
    }

    Injector injector;
    try {
      injector = Guice.createInjector(
          EvaluationModule.create(sampleProvider(namespace)),
          EvolutionModule.create(
              evolutionConfig(namespace),
              OperatorTable.parse(namespace.getString("operators")),
              namespace.getBoolean("no_constants")
                  ? TerminalSet.variableOnly()
                  : TerminalSet.standard(),
              Optional.ofNullable(namespace.getLong("seed"))));
    } catch (IllegalArgumentException | UncheckedIOException e) {
      logger.atSevere().withCause(e).log("Invalid configuration");
      return EXIT_USAGE;
    }

    String expression = namespace.getString("evaluate");
    if (expression != null) {
      return evaluate(injector, expression, namespace.getString("operators"));
    }

    EvolutionOutcome outcome = injector.getInstance(EvolutionEngine.class).evolve();
    return outcome.succeeded() ? EXIT_SUCCESS : EXIT_NO_SOLUTION;
  }

  private static int evaluate(Injector injector, String expression, String operators) {
    Node tree;
    try {
      tree = ExpressionParser.parse(expression, OperatorTable.parse(operators));
    } catch (IllegalArgumentException e) {
      logger.atSevere().log("Cannot parse expression: %s", e.getMessage());
      return EXIT_USAGE;
    }
    double error = injector.getInstance(FitnessEvaluator.class).error(tree);
    logger.atInfo().log("Error of %s: %s (size %d)", tree, error, tree.size());
    return EXIT_SUCCESS;
  }

  private static SampleProvider sampleProvider(Namespace namespace) {
    String samplesFile = namespace.getString("samples_file");
    return samplesFile == null
        ? FormulaSampleProvider.quadratic()
        : FileSampleProvider.create(new File(samplesFile));
  }

  private static EvolutionConfig evolutionConfig(Namespace namespace) {
    EvolutionConfig.Builder builder =
        EvolutionConfig.builder()
            .setPopulationSize(namespace.getInt("population_size"))
            .setTournamentSize(namespace.getInt("tournament_size"))
            .setSuccessThreshold(namespace.getDouble("success_threshold"));
    int maxGenerations = namespace.getInt("max_generations");
    if (maxGenerations != 0) {
      builder.setMaxGenerations(maxGenerations);
    }
    return builder.build();
  }

  private static ArgumentParser createArgumentParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("symreg")
            .build()
            .defaultHelp(true)
            .description("Symbolic regression by genetic programming");

    parser.addArgument("--population-size")
        .type(Integer.class)
        .setDefault(EvolutionConstants.DEFAULT_POPULATION_SIZE)
        .help("Number of individuals per generation");

    parser.addArgument("--max-generations")
        .type(Integer.class)
        .setDefault(EvolutionConstants.DEFAULT_MAX_GENERATIONS)
        .help("Generations to evaluate before giving up; 0 for no limit");

    parser.addArgument("--tournament-size")
        .type(Integer.class)
        .setDefault(EvolutionConstants.TOURNAMENT_SIZE)
        .help("Individuals drawn per tournament");

    parser.addArgument("--success-threshold")
        .type(Double.class)
        .setDefault(EvolutionConstants.SUCCESS_THRESHOLD)
        .help("Stop once the best error is below this value");

    parser.addArgument("--seed")
        .type(Long.class)
        .help("Seed for a reproducible run");

    parser.addArgument("--operators")
        .setDefault("+,-,*,pd")
        .help("Comma separated operator symbols from: +, -, *, pd, inc");

    parser.addArgument("--no-constants")
        .action(Arguments.storeTrue())
        .help("Use only the input variable as a terminal");

    parser.addArgument("--samples-file")
        .help("File of 'x,y' lines to fit instead of x^2 + x + 1");

    parser.addArgument("--evaluate")
        .metavar("EXPR")
        .help("Print the error of a prefix expression such as '(+ (* x x) (+ x 1.0))'");

    return parser;
  }

  private App() {}
}
