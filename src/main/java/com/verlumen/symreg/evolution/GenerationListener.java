package com.verlumen.symreg.evolution;

/**
 * Observes a run. Notifications are purely informational; nothing a listener does affects the
 * search.
 */
public interface GenerationListener {
  void onStart(EvolutionConfig config);

  /** Called once per evaluated generation, before the success check. */
  void onGeneration(GenerationReport report);

  void onSuccess(EvolutionOutcome outcome);

  /** Called when the generation budget runs out without a solution. */
  void onExhausted(EvolutionOutcome outcome);
}
