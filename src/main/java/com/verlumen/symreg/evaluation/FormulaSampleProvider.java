package com.verlumen.symreg.evaluation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.function.DoubleUnaryOperator;

/**
 * Samples a known function at inputs {@code start}, {@code start + step}, ... while they stay below
 * {@code end}, each input being the previous one plus {@code step}.
 */
public final class FormulaSampleProvider implements SampleProvider {
  private final DoubleUnaryOperator formula;
  private final double start;
  private final double end;
  private final double step;

  /** {@code x^2 + x + 1} from -1.0 in steps of 0.1; 21 inputs, the last one just below 1.0. */
  public static FormulaSampleProvider quadratic() {
    return create(x -> x * x + x + 1, -1.0, 1.0, 0.1);
  }

  public static FormulaSampleProvider create(
      DoubleUnaryOperator formula, double start, double end, double step) {
    checkArgument(step > 0, "Step must be positive: %s", step);
    checkArgument(start < end, "Empty range [%s, %s)", start, end);
    return new FormulaSampleProvider(checkNotNull(formula), start, end, step);
  }

  private FormulaSampleProvider(DoubleUnaryOperator formula, double start, double end, double step) {
    this.formula = formula;
    this.start = start;
    this.end = end;
    this.step = step;
  }

  @Override
  public SampleSet samples() {
    ImmutableList.Builder<SamplePair> pairs = ImmutableList.builder();
    // Inputs accumulate by repeated addition, so rounding may admit a last x just below end.
    for (double x = start; x < end; x += step) {
      pairs.add(SamplePair.of(x, formula.applyAsDouble(x)));
    }
    return SampleSet.of(pairs.build());
  }
}
