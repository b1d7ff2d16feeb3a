package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.util.List;

/**
 * Base class for the binary comparisons. A null on either side makes every comparison false;
 * ordering comparisons also require both sides to be numbers.
 */
public abstract class Comparison extends FunctionExpression {
  /**
   * The supported comparison operators.
   */
  protected enum Operator {
    EQUAL, NOT_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL_TO, LESS_THAN, LESS_THAN_OR_EQUAL_TO
  }

  private final Operator operator;

  protected Comparison(String name, Operator operator, List<Expression> args) {
    super(name, false, args);
    this.operator = operator;
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    LDValue left = arg(0, context);
    LDValue right = arg(1, context);
    if (left.isNull() || right.isNull()) {
      return LDValue.of(false);
    }
    return LDValue.of(compare(left, right));
  }

  private boolean compare(LDValue left, LDValue right) {
    switch (operator) {
    case EQUAL:
      return left.equals(right);
    case NOT_EQUAL:
      return !left.equals(right);
    default:
      break;
    }
    if (!left.isNumber() || !right.isNumber()) {
      return false;
    }
    double l = left.doubleValue(), r = right.doubleValue();
    switch (operator) {
    case GREATER_THAN:
      return l > r;
    case GREATER_THAN_OR_EQUAL_TO:
      return l >= r;
    case LESS_THAN:
      return l < r;
    case LESS_THAN_OR_EQUAL_TO:
      return l <= r;
    default:
      return false;
    }
  }

  public static final class Equal extends Comparison {
    public Equal(List<Expression> args) {
      super("Equal", Operator.EQUAL, args);
    }
  }

  public static final class NotEqual extends Comparison {
    public NotEqual(List<Expression> args) {
      super("NotEqual", Operator.NOT_EQUAL, args);
    }
  }

  public static final class GreaterThan extends Comparison {
    public GreaterThan(List<Expression> args) {
      super("GreaterThan", Operator.GREATER_THAN, args);
    }
  }

  public static final class GreaterThanOrEqualTo extends Comparison {
    public GreaterThanOrEqualTo(List<Expression> args) {
      super("GreaterThanOrEqualTo", Operator.GREATER_THAN_OR_EQUAL_TO, args);
    }
  }

  public static final class LessThan extends Comparison {
    public LessThan(List<Expression> args) {
      super("LessThan", Operator.LESS_THAN, args);
    }
  }

  public static final class LessThanOrEqualTo extends Comparison {
    public LessThanOrEqualTo(List<Expression> args) {
      super("LessThanOrEqualTo", Operator.LESS_THAN_OR_EQUAL_TO, args);
    }
  }
}
