package com.verlumen.symreg.evaluation;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The ordered, non-empty list of samples an individual is scored against. */
@AutoValue
public abstract class SampleSet {
  public static SampleSet of(Iterable<SamplePair> pairs) {
    ImmutableList<SamplePair> copy = ImmutableList.copyOf(pairs);
    checkArgument(!copy.isEmpty(), "Sample set cannot be empty");
    return new AutoValue_SampleSet(copy);
  }

  public static SampleSet of(SamplePair... pairs) {
    return of(ImmutableList.copyOf(pairs));
  }

  public abstract ImmutableList<SamplePair> pairs();

  public int size() {
    return pairs().size();
  }
}
