package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * Negates the truthiness of its single argument.
 */
public final class Not extends FunctionExpression {
  public Not(List<Expression> args) {
    super("Not", true, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    return LDValue.of(!Expressions.isTruthy(arg(0, context)));
  }
}
