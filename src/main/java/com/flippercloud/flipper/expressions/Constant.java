package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

/**
 * A literal value. Its JSON representation is the bare value itself.
 */
public final class Constant implements Expression {
  private final LDValue value;

  public Constant(LDValue value) {
    this.value = LDValue.normalize(value);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    return value;
  }

  @Override
  public LDValue value() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Constant && value.equals(((Constant)other).value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value.toJsonString();
  }
}
