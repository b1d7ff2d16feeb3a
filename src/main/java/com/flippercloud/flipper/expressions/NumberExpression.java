package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * Converts its argument to a number; anything unparseable becomes 0.
 */
public final class NumberExpression extends FunctionExpression {
  public NumberExpression(List<Expression> args) {
    super("Number", true, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    return LDValue.of(Expressions.toNumber(arg(0, context)));
  }
}
