package com.flippercloud.flipper.expressions;

import com.launchdarkly.sdk.LDValue;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Converts a timestamp to whole seconds since the epoch. Numbers and digit-only strings are read as
 * milliseconds; other strings must be ISO-8601 or RFC-1123 dates.
 */
public final class Time extends FunctionExpression {
  public Time(List<Expression> args) {
    super("Time", true, args);
  }

  @Override
  public LDValue evaluate(EvaluationContext context) {
    LDValue value = arg(0, context);
    if (value.isNumber()) {
      return LDValue.of((long)Math.floor(value.doubleValue() / 1000));
    }
    String text = value.isString() ? value.stringValue().trim() : "";
    if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
      return LDValue.of(Long.parseLong(text) / 1000);
    }
    return LDValue.of(parse(text).getEpochSecond());
  }

  private static Instant parse(String text) {
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (DateTimeParseException e) {
      try {
        return ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
      } catch (DateTimeParseException e2) {
        throw new IllegalArgumentException("Time value is not a recognized timestamp: " + text, e2);
      }
    }
  }
}
