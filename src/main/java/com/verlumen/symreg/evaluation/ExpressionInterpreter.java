package com.verlumen.symreg.evaluation;

import com.google.common.collect.ImmutableList;
import com.verlumen.symreg.expression.Application;
import com.verlumen.symreg.expression.Constant;
import com.verlumen.symreg.expression.Node;

/** Evaluates an expression tree as a unary function of its input variable. */
public final class ExpressionInterpreter {

  /**
   * Evaluates {@code tree} bottom-up with {@code x} bound to the input variable. Division by zero
   * yields 0; overflow may still produce infinite or NaN results.
   */
  public static double evaluate(Node tree, double x) {
    switch (tree.kind()) {
      case VARIABLE:
        return x;
      case CONSTANT:
        return ((Constant) tree).value();
      case APPLICATION:
        Application application = (Application) tree;
        ImmutableList<Node> children = application.children();
        double[] arguments = new double[children.size()];
        for (int i = 0; i < arguments.length; i++) {
          arguments[i] = evaluate(children.get(i), x);
        }
        return application.operator().apply(arguments);
    }
    throw new AssertionError("Unknown node kind: " + tree.kind());
  }

  private ExpressionInterpreter() {}
}
