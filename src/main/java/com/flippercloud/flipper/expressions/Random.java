package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A random integer in {@code [0, max)}.
 */
public final class Random extends FunctionExpression {
  public Random(List<Expression> args) {
    super("Random", true, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    double max = Expressions.toNumber(arg(0, context));
    return LDValue.of((long)Math.floor(ThreadLocalRandom.current().nextDouble() * max));
  }
}
