package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * True if the first argument is below the second, both treated as numbers. Usually combined with
 * {@link Random}: {@code {"Percentage": [{"Random": 100}, 25]}}.
 */
public final class Percentage extends FunctionExpression {
  public Percentage(List<Expression> args) {
    super("Percentage", false, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    double value = Expressions.toNumber(arg(0, context));
    double percentage = Expressions.toNumber(arg(1, context));
    return LDValue.of(value < percentage);
  }
}
