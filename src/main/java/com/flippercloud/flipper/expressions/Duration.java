package com.flippercloud.flipper.expressions;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.sdk.LDValue;

import java.util.List;
import java.util.Locale;

/**
 * A length of time in seconds: {@code {"Duration": [2, "days"]}}. The unit defaults to seconds.
 */
public final class Duration extends FunctionExpression {
  private static final ImmutableMap<String, Long> SECONDS_PER = ImmutableMap.<String, Long>builder()
      .put("second", 1L)
      .put("minute", 60L)
      .put("hour", 3600L)
      .put("day", 86400L)
      .put("week", 604800L)
      .put("month", 2629746L) // 1/12 of a gregorian year
      .put("year", 31556952L)
      .build();

  public Duration(List<Expression> args) {
    super("Duration", false, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    LDValue scalar = arg(0, context);
    if (!scalar.isNumber()) {
      throw new IllegalArgumentException("Duration value must be a number but was " + scalar.toJsonString());
    }
    LDValue unitValue = arg(1, context);
    String unit = unitValue.isNull() ? "second" : Expressions.toText(unitValue).toLowerCase(Locale.ROOT);
    if (unit.endsWith("s")) {
      unit = unit.substring(0, unit.length() - 1);
    }
    Long secondsPerUnit = SECONDS_PER.get(unit);
    if (secondsPerUnit == null) {
      throw new IllegalArgumentException("Duration unit " + unit + " must be one of: "
          + String.join(", ", SECONDS_PER.keySet()));
    }
    return LDValue.of(scalar.doubleValue() * secondsPerUnit);
  }
}
