package com.flippercloud.flipper.expressions;

import com.google.common.collect.ImmutableList;
import com.launchdarkly.sdk.ArrayBuilder;
import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * Base class for every named operation. Subclasses only implement {@link #evaluate(EvaluationContext)}.
 */
public abstract class FunctionExpression implements Expression {
  private final String name;
  private final boolean unary;
  protected final ImmutableList<Expression> args;

  /**
   * @param name the operation name used as the JSON key
   * @param unary true if the arguments are serialized as a single value rather than an array
   * @param args the argument expressions
   */
  protected FunctionExpression(String name, boolean unary, List<Expression> args) {
    this.name = name;
    this.unary = unary;
    this.args = ImmutableList.copyOf(args);
  }

  public String getName() {
    return name;
  }

  public List<Expression> getArgs() {
    return args;
  }

  /**
   * Evaluates the argument at a position.
   *
   * @param index the argument position
   * @param context the evaluation context
   * @return the result, or a JSON null if there is no such argument
   */
  protected LDValue arg(int index, EvaluationContext context) {
    if (index >= args.size()) {
      return LDValue.ofNull();
    }
    return LDValue.normalize(args.get(index).evaluate(context));
  }

  @Override
  public LDValue value() {
    LDValue argsValue;
    if (unary) {
      argsValue = args.isEmpty() ? LDValue.ofNull() : args.get(0).value();
    } else {
      ArrayBuilder array = LDValue.buildArray();
      for (Expression arg: args) {
        array.add(arg.value());
      }
      argsValue = array.build();
    }
    return LDValue.buildObject().put(name, argsValue).build();
  }

  @Override
  public boolean equals(Object other) {
    if (other == null || other.getClass() != getClass()) {
      return false;
    }
    return args.equals(((FunctionExpression)other).args);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + args.hashCode();
  }

  @Override
  public String toString() {
    return value().toJsonString();
  }
}
