package com.flippercloud.flipper;

import com.flippercloud.flipper.expressions.EvaluationContext;
import com.flippercloud.flipper.expressions.Expression;
import com.flippercloud.flipper.expressions.Expressions;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.sdk.LDValue;

import java.util.HashMap;
import java.util.Map;

/**
 * Open when the stored expression evaluates truthy against the candidate actor's properties.
 * <p>
 * Any failure to build or evaluate the expression closes the gate; it is logged but never thrown.
 */
final class ExpressionGate extends Gate {
  static final String FLIPPER_ID_PROPERTY = "flipper_id";

  private final LDLogger logger;

  ExpressionGate(LDLogger logger) {
    super(GateKind.EXPRESSION);
    this.logger = logger;
  }

  @Override
  public boolean isOpen(FeatureCheckContext context) {
    LDValue json = context.getValues().getExpression();
    if (json == null) {
      return false;
    }
    try {
      Expression expression = Expressions.build(json);
      EvaluationContext evaluationContext = new EvaluationContext(context.getFeatureName(),
          propertiesOf(context.getActor()));
      return Expressions.isTruthy(expression.evaluate(evaluationContext));
    } catch (RuntimeException e) {
      logger.warn("Could not evaluate expression for feature \"{}\": {}", context.getFeatureName(), e.toString());
      return false;
    }
  }

  private static Map<String, LDValue> propertiesOf(ActorType actor) {
    Map<String, LDValue> properties = new HashMap<>();
    if (actor != null) {
      properties.put(FLIPPER_ID_PROPERTY, LDValue.of(actor.getValue()));
      properties.putAll(actor.getActor().getFlipperProperties());
    }
    return properties;
  }

  @Override
  public boolean isEnabled(GateValues values) {
    LDValue expression = values.getExpression();
    return expression != null && expression.size() > 0;
  }

  @Override
  public boolean protectsThing(Object thing) {
    return thing instanceof ExpressionType || thing instanceof Expression;
  }

  @Override
  public TypedValue wrap(Object thing) {
    return ExpressionType.wrap(thing);
  }
}
