package com.verlumen.symreg.evaluation;

/** Supplies the samples a run is fitted against. */
public interface SampleProvider {
  /**
   * Produces the sample set.
   *
   * @return a non-empty, ordered sample set
   * @throws IllegalArgumentException if the underlying data is malformed
   * @throws java.io.UncheckedIOException if the underlying data cannot be read
   */
  SampleSet samples();
}
