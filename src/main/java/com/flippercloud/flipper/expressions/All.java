package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * True if every argument is truthy. An empty {@code All} is true.
 */
public final class All extends FunctionExpression {
  public All(List<Expression> args) {
    super("All", false, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    for (int i = 0; i < args.size(); i++) {
      if (!Expressions.isTruthy(arg(i, context))) {
        return LDValue.of(false);
      }
    }
    return LDValue.of(true);
  }
}
