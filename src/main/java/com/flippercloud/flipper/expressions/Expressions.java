package com.flippercloud.flipper.expressions;

import com.flippercloud.flipper.Typecast;
import com.flippercloud.flipper.expressions.Comparison.Equal;
import com.flippercloud.flipper.expressions.Comparison.GreaterThan;
import com.flippercloud.flipper.expressions.Comparison.GreaterThanOrEqualTo;
import com.flippercloud.flipper.expressions.Comparison.LessThan;
import com.flippercloud.flipper.expressions.Comparison.LessThanOrEqualTo;
import com.flippercloud.flipper.expressions.Comparison.NotEqual;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.sdk.LDValueType;

import java.util.List;
import java.util.function.Function;

/**
 * Builds expression trees from their JSON representation, and hosts the conversion rules shared by
 * the individual operations.
 */
public abstract class Expressions {
  private Expressions() {}

  private static final ImmutableMap<String, Function<List<Expression>, Expression>> REGISTRY =
      ImmutableMap.<String, Function<List<Expression>, Expression>>builder()
        .put("All", All::new)
        .put("Any", Any::new)
        .put("Not", Not::new)
        .put("Boolean", BooleanExpression::new)
        .put("Constant", args -> args.isEmpty() ? new Constant(LDValue.ofNull()) : args.get(0))
        .put("Duration", Duration::new)
        .put("Equal", Equal::new)
        .put("NotEqual", NotEqual::new)
        .put("GreaterThan", GreaterThan::new)
        .put("GreaterThanOrEqualTo", GreaterThanOrEqualTo::new)
        .put("LessThan", LessThan::new)
        .put("LessThanOrEqualTo", LessThanOrEqualTo::new)
        .put("Now", Now::new)
        .put("Number", NumberExpression::new)
        .put("Percentage", Percentage::new)
        .put("PercentageOfActors", PercentageOfActors::new)
        .put("Property", Property::new)
        .put("Random", Random::new)
        .put("String", StringExpression::new)
        .put("Time", Time::new)
        .build();

  /**
   * Builds an expression from its JSON representation. Scalars and null become {@link Constant}s.
   *
   * @param json the JSON value
   * @return the expression
   * @throws IllegalArgumentException if the value names an unknown operation or is not an expression
   */
  public static Expression build(LDValue json) {
    LDValue value = LDValue.normalize(json);
    switch (value.getType()) {
    case OBJECT:
      if (value.size() == 0) {
        throw new IllegalArgumentException("Cannot build expression from empty object");
      }
      String name = value.keys().iterator().next();
      Function<List<Expression>, Expression> factory = REGISTRY.get(name);
      if (factory == null) {
        throw new IllegalArgumentException("Unknown expression type: " + name);
      }
      LDValue rawArgs = value.get(name);
      ImmutableList.Builder<Expression> args = ImmutableList.builder();
      if (rawArgs.getType() == LDValueType.ARRAY) {
        for (LDValue arg: rawArgs.values()) {
          args.add(build(arg));
        }
      } else {
        args.add(build(rawArgs));
      }
      return factory.apply(args.build());
    case ARRAY:
      throw new IllegalArgumentException(value.toJsonString() + " cannot be converted into an expression");
    default:
      return new Constant(value);
    }
  }

  /**
   * Parses and builds an expression from a JSON string.
   *
   * @param json the serialized expression
   * @return the expression
   * @throws IllegalArgumentException if the string is not a valid expression
   */
  public static Expression parse(String json) {
    LDValue value;
    try {
      value = LDValue.parse(json);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Expression is not valid JSON: " + json, e);
    }
    return build(value);
  }

  /**
   * Converts an arbitrary argument into an expression: expressions are returned as is, JSON values are
   * built, and Java scalars become constants.
   *
   * @param thing the argument
   * @return the expression
   * @throws IllegalArgumentException if the argument cannot be converted
   */
  public static Expression of(Object thing) {
    if (thing instanceof Expression) {
      return (Expression)thing;
    }
    if (thing instanceof LDValue) {
      return build((LDValue)thing);
    }
    if (thing == null) {
      return new Constant(LDValue.ofNull());
    }
    if (thing instanceof String) {
      return new Constant(LDValue.of((String)thing));
    }
    if (thing instanceof Boolean) {
      return new Constant(LDValue.of((Boolean)thing));
    }
    if (thing instanceof Integer || thing instanceof Long) {
      return new Constant(LDValue.of(((Number)thing).longValue()));
    }
    if (thing instanceof Number) {
      return new Constant(LDValue.of(((Number)thing).doubleValue()));
    }
    throw new IllegalArgumentException(thing + " cannot be converted into an expression");
  }

  static List<Expression> listOf(Object... things) {
    ImmutableList.Builder<Expression> builder = ImmutableList.builder();
    for (Object thing: things) {
      builder.add(of(thing));
    }
    return builder.build();
  }

  public static Expression property(String name) {
    return new Property(listOf(name));
  }

  public static Expression constant(Object value) {
    return of(value);
  }

  public static Expression all(Object... args) {
    return new All(listOf(args));
  }

  public static Expression any(Object... args) {
    return new Any(listOf(args));
  }

  public static Expression not(Object arg) {
    return new Not(listOf(arg));
  }

  public static Expression equal(Object left, Object right) {
    return new Equal(listOf(left, right));
  }

  public static Expression notEqual(Object left, Object right) {
    return new NotEqual(listOf(left, right));
  }

  public static Expression greaterThan(Object left, Object right) {
    return new GreaterThan(listOf(left, right));
  }

  public static Expression greaterThanOrEqualTo(Object left, Object right) {
    return new GreaterThanOrEqualTo(listOf(left, right));
  }

  public static Expression lessThan(Object left, Object right) {
    return new LessThan(listOf(left, right));
  }

  public static Expression lessThanOrEqualTo(Object left, Object right) {
    return new LessThanOrEqualTo(listOf(left, right));
  }

  public static Expression string(Object value) {
    return new StringExpression(listOf(value));
  }

  public static Expression number(Object value) {
    return new NumberExpression(listOf(value));
  }

  public static Expression bool(Object value) {
    return new BooleanExpression(listOf(value));
  }

  public static Expression random(double max) {
    return new Random(listOf(max));
  }

  public static Expression percentage(Object value, double percentage) {
    return new Percentage(listOf(value, percentage));
  }

  public static Expression percentageOfActors(Object value, double percentage) {
    return new PercentageOfActors(listOf(value, percentage));
  }

  public static Expression now() {
    return new Now(ImmutableList.of());
  }

  public static Expression time(String timestamp) {
    return new Time(listOf(timestamp));
  }

  public static Expression duration(double scalar, String unit) {
    return new Duration(listOf(scalar, unit));
  }

  /**
   * Truthiness as expressions see it: null, false, 0, NaN and the empty string are false.
   *
   * @param value a result
   * @return true if the value is truthy
   */
  public static boolean isTruthy(LDValue value) {
    switch (LDValue.normalize(value).getType()) {
    case NULL:
      return false;
    case BOOLEAN:
      return value.booleanValue();
    case NUMBER:
      return value.doubleValue() != 0 && !Double.isNaN(value.doubleValue());
    case STRING:
      return !value.stringValue().isEmpty();
    default:
      return true;
    }
  }

  /**
   * Numeric coercion: booleans are 0 or 1, numeric strings are parsed, everything else is 0.
   *
   * @param value a result
   * @return the number
   */
  public static double toNumber(LDValue value) {
    switch (LDValue.normalize(value).getType()) {
    case NUMBER:
      return value.doubleValue();
    case BOOLEAN:
      return value.booleanValue() ? 1 : 0;
    case STRING:
      String text = value.stringValue().trim();
      if (text.isEmpty()) {
        return 0;
      }
      try {
        double parsed = Double.parseDouble(text);
        return Double.isNaN(parsed) ? 0 : parsed;
      } catch (NumberFormatException e) {
        return 0;
      }
    default:
      return 0;
    }
  }

  /**
   * String coercion for scalars; arrays, objects and null become the empty string.
   *
   * @param value a result
   * @return the text
   */
  public static String toText(LDValue value) {
    switch (LDValue.normalize(value).getType()) {
    case STRING:
      return value.stringValue();
    case NUMBER:
      return Typecast.toStorageString(value.doubleValue());
    case BOOLEAN:
      return String.valueOf(value.booleanValue());
    default:
      return "";
    }
  }
}
