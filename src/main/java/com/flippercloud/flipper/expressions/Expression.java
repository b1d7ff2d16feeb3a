package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

/**
 * A node of the expression tree stored by the expression gate.
 * <p>
 * Expressions are serialized as JSON objects with a single key naming the operation, whose value
 * holds the arguments: {@code {"Equal": [{"Property": "plan"}, "basic"]}}. Use {@link Expressions#build(LDValue)}
 * to turn that representation back into a tree.
 */
public interface Expression {
  /**
   * Evaluates the expression.
   *
   * @param context the feature name and actor properties
   * @return the result; a JSON null if there is no meaningful result
   */
  LDValue evaluate(EvaluationContext context);

  /**
   * Returns the JSON representation of this expression.
   *
   * @return the serializable value
   */
  LDValue value();
}
