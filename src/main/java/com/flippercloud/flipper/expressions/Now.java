package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * The current time in whole seconds since the epoch.
 */
public final class Now extends FunctionExpression {
  public Now(List<Expression> args) {
    super("Now", false, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    return LDValue.of(System.currentTimeMillis() / 1000);
  }
}
