package com.flippercloud.flipper.expressions;

import com.flippercloud.flipper.PercentageBucketing;
import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * Deterministic rollout on an arbitrary value, bucketed exactly like the percentage-of-actors gate
 * with the feature name as the prefix: {@code {"PercentageOfActors": [{"Property": "org_id"}, 25]}}.
 */
public final class PercentageOfActors extends FunctionExpression {
  public PercentageOfActors(List<Expression> args) {
    super("PercentageOfActors", false, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    String text = Expressions.toText(arg(0, context));
    double percentage = Expressions.toNumber(arg(1, context));
    if (text.isEmpty() || percentage == 0) {
      return LDValue.of(false);
    }
    String prefix = context.getFeatureName() == null ? "" : context.getFeatureName();
    return LDValue.of(PercentageBucketing.isIncluded(prefix, text, percentage));
  }
}
