package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * Looks up a property of the actor being checked. Missing properties evaluate to null.
 */
public final class Property extends FunctionExpression {
  public Property(List<Expression> args) {
    super("Property", true, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    String key = Expressions.toText(arg(0, context));
    if (key.isEmpty()) {
      return LDValue.ofNull();
    }
    return context.getProperty(key);
  }
}
