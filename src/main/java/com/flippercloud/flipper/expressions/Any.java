package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * True if at least one argument is truthy. An empty {@code Any} is false.
 */
public final class Any extends FunctionExpression {
  public Any(List<Expression> args) {
    super("Any", false, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    for (int i = 0; i < args.size(); i++) {
      if (Expressions.isTruthy(arg(i, context))) {
        return LDValue.of(true);
      }
    }
    return LDValue.of(false);
  }
}
