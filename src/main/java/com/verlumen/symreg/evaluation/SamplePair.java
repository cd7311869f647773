package com.verlumen.symreg.evaluation;

import com.google.auto.value.AutoValue;

/** One (input, expected output) point of the target function. */
@AutoValue
public abstract class SamplePair {
  public static SamplePair of(double x, double y) {
    return new AutoValue_SamplePair(x, y);
  }

  public abstract double x();

  public abstract double y();
}
