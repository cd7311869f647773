package com.verlumen.symreg.evolution;

import com.verlumen.symreg.expression.Node;
import java.util.random.RandomGenerator;

/** Creates random expression trees from the configured operators and terminals. */
public interface RandomTreeGenerator {
  /**
   * Grows a random tree. At depth 0, or on a fair coin flip at any other depth, a random terminal
   * is returned; otherwise a random operator is applied to independently grown children one level
   * shallower.
   *
   * @param maxDepth the maximum depth of the result, at least 0
   * @param random the source of every random draw
   */
  Node randomTree(int maxDepth, RandomGenerator random);

  /** Returns the input variable or, when constants are enabled, possibly a random constant. */
  Node randomTerminal(RandomGenerator random);
}
