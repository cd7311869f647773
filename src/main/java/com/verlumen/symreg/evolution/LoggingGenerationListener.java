package com.verlumen.symreg.evolution;

import com.google.common.flogger.FluentLogger;

/** Writes run progress to the log. */
final class LoggingGenerationListener implements GenerationListener {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Override
  public void onStart(EvolutionConfig config) {
    logger.atInfo().log("Starting evolution with %s", config);
  }

  @Override
  public void onGeneration(GenerationReport report) {
    logger.atInfo().log(
        "Generation: %d\n Best error: %s\n Best program: %s\n     Median error: %s\n"
            + "     Average program size: %.2f",
        report.generation(),
        report.bestError(),
        report.best(),
        report.medianError(),
        report.meanProgramSize());
    logger.atFine().log(
        "Generation %d worst error: %s, mean depth: %.2f",
        report.generation(), report.worstError(), report.meanDepth());
  }

  @Override
  public void onSuccess(EvolutionOutcome outcome) {
    logger.atInfo().log(
        "Success after %d generations: %s", outcome.generations(), outcome.best().individual());
  }

  @Override
  public void onExhausted(EvolutionOutcome outcome) {
    logger.atWarning().log(
        "No solution within %d generations; best error %s from %s",
        outcome.generations(), outcome.best().error(), outcome.best().individual());
  }
}
