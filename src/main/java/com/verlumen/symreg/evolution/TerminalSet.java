package com.verlumen.symreg.evolution;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Which terminals random generation may produce. */
@AutoValue
public abstract class TerminalSet {
  /** The input variable and constants drawn from {@code [-5.0, 5.0)}. */
  public static TerminalSet standard() {
    return create(true, EvolutionConstants.CONSTANT_MIN, EvolutionConstants.CONSTANT_MAX);
  }

  /** Only the input variable. */
  public static TerminalSet variableOnly() {
    return create(false, EvolutionConstants.CONSTANT_MIN, EvolutionConstants.CONSTANT_MAX);
  }

  public static TerminalSet create(boolean constantsEnabled, double constantMin, double constantMax) {
    checkArgument(constantMin < constantMax, "Empty constant range [%s, %s)", constantMin, constantMax);
    return new AutoValue_TerminalSet(constantsEnabled, constantMin, constantMax);
  }

  public abstract boolean constantsEnabled();

  public abstract double constantMin();

  public abstract double constantMax();
}
