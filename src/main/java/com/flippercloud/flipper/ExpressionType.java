package com.flippercloud.flipper;

import com.flippercloud.flipper.expressions.Constant;
import com.flippercloud.flipper.expressions.Expression;
import com.flippercloud.flipper.expressions.Expressions;
import com.launchdarkly.sdk.LDValue;

/**
 * Wraps an {@link Expression} for the expression gate.
 */
public final class ExpressionType implements TypedValue {
  /**
   * The absence of an expression; disabling the expression gate with it deletes the stored expression.
   */
  public static final ExpressionType NONE = new ExpressionType(new Constant(LDValue.ofNull()));

  private final Expression expression;

  private ExpressionType(Expression expression) {
    this.expression = expression;
  }

  /**
   * Wraps a candidate as an expression.
   *
   * @param thing an {@link ExpressionType}, an {@link Expression}, or its JSON form as an {@link LDValue}
   * @return the wrapped value
   * @throws IllegalArgumentException if the candidate is not an expression
   */
  public static ExpressionType wrap(Object thing) {
    if (thing instanceof ExpressionType) {
      return (ExpressionType)thing;
    }
    if (thing instanceof Expression) {
      return new ExpressionType((Expression)thing);
    }
    if (thing instanceof LDValue) {
      return new ExpressionType(Expressions.build((LDValue)thing));
    }
    throw new IllegalArgumentException("Invalid expression type: " + thing);
  }

  public Expression getExpression() {
    return expression;
  }

  @Override
  public GateKind getKind() {
    return GateKind.EXPRESSION;
  }

  /**
   * Returns the JSON form of the expression.
   */
  @Override
  public LDValue getValue() {
    return expression.value();
  }

  @Override
  public String getStorageValue() {
    LDValue value = getValue();
    return value.isNull() ? null : value.toJsonString();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ExpressionType && expression.equals(((ExpressionType)other).expression);
  }

  @Override
  public int hashCode() {
    return expression.hashCode();
  }

  @Override
  public String toString() {
    return "ExpressionType(" + getValue().toJsonString() + ")";
  }
}
