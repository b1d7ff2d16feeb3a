package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * Converts its argument to a boolean by truthiness.
 */
public final class BooleanExpression extends FunctionExpression {
  public BooleanExpression(List<Expression> args) {
    super("Boolean", true, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    return LDValue.of(Expressions.isTruthy(arg(0, context)));
  }
}
