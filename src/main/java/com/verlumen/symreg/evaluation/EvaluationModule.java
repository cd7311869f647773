package com.verlumen.symreg.evaluation;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;

@AutoValue
public abstract class EvaluationModule extends AbstractModule {
  public static EvaluationModule create(SampleProvider sampleProvider) {
    return new AutoValue_EvaluationModule(sampleProvider.samples());
  }

  abstract SampleSet samples();

  @Override
  protected void configure() {
    bind(SampleSet.class).toInstance(samples());
    bind(FitnessEvaluator.class).to(FitnessEvaluatorImpl.class);
  }
}
