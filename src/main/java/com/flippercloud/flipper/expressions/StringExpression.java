package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * Converts a scalar argument to a string; arrays, objects and null become the empty string.
 */
public final class StringExpression extends FunctionExpression {
  public StringExpression(List<Expression> args) {
    super("String", true, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    return LDValue.of(Expressions.toText(arg(0, context)));
  }
}
