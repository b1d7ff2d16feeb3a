package com.flippercloud.flipper;

import com.flippercloud.flipper.expressions.Expression;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.sdk.LDValue;
import com.launchdarkly.sdk.LDValueType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Conversions from the raw values that adapters persist into the canonical types the gates work with.
 * <p>
 * Every method is total: unrecognized input produces the documented default rather than an exception,
 * except {@link #checkPercentage(double)} which exists to reject bad input.
 */
public abstract class Typecast {
  private Typecast() {}

  /**
   * Returns true for {@code true}, {@code 1}, {@code "true"} and {@code "1"}; false for anything else.
   *
   * @param value a raw value
   * @return the boolean
   */
  public static boolean toBoolean(Object value) {
    if (value instanceof Boolean) {
      return (Boolean)value;
    }
    if (value instanceof Number) {
      return ((Number)value).doubleValue() == 1;
    }
    if (value instanceof LDValue) {
      LDValue v = (LDValue)value;
      return v.isString() ? toBoolean(v.stringValue()) : (v.isNumber() ? v.doubleValue() == 1 : v.booleanValue());
    }
    if (value instanceof String) {
      String s = ((String)value).trim();
      return s.equals("true") || s.equals("1");
    }
    return false;
  }

  /**
   * Parses a number, returning 0 when the value is missing or not numeric.
   *
   * @param value a raw value
   * @return the number
   */
  public static double toNumber(Object value) {
    if (value instanceof Number) {
      double d = ((Number)value).doubleValue();
      return Double.isNaN(d) ? 0 : d;
    }
    if (value instanceof LDValue) {
      LDValue v = (LDValue)value;
      return v.isNumber() ? v.doubleValue() : (v.isString() ? toNumber(v.stringValue()) : 0);
    }
    if (value instanceof String) {
      String s = ((String)value).trim();
      if (s.isEmpty()) {
        return 0;
      }
      try {
        double d = Double.parseDouble(s);
        return Double.isNaN(d) || Double.isInfinite(d) ? 0 : d;
      } catch (NumberFormatException e) {
        return 0;
      }
    }
    return 0;
  }

  /**
   * Parses a percentage, keeping at most three decimal places. Stored values outside [0, 100] are
   * clamped to that range.
   *
   * @param value a raw value
   * @return the percentage
   */
  public static double toPercentage(Object value) {
    double clamped = Math.max(0, Math.min(100, toNumber(value)));
    return BigDecimal.valueOf(clamped).setScale(3, RoundingMode.HALF_UP).doubleValue();
  }

  /**
   * Converts a collection (or a JSON array) into a set of strings. Anything else becomes an empty set.
   *
   * @param value a raw value
   * @return an immutable set
   */
  public static Set<String> toSet(Object value) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    if (value instanceof Collection) {
      for (Object item: (Collection<?>)value) {
        if (item != null) {
          builder.add(item instanceof LDValue ? toStorageString(item) : item.toString());
        }
      }
    } else if (value instanceof LDValue && ((LDValue)value).getType() == LDValueType.ARRAY) {
      for (LDValue item: ((LDValue)value).values()) {
        if (!item.isNull()) {
          builder.add(toStorageString(item));
        }
      }
    }
    return builder.build();
  }

  /**
   * Converts a stored expression into its JSON form: an already-parsed {@link LDValue}, an
   * {@link Expression}, or a JSON string. Returns null if there is no usable expression.
   *
   * @param value a raw value
   * @return a JSON object, or null
   */
  public static LDValue toExpression(Object value) {
    LDValue json;
    if (value instanceof Expression) {
      json = ((Expression)value).value();
    } else if (value instanceof LDValue) {
      json = (LDValue)value;
    } else if (value instanceof String && !((String)value).isEmpty()) {
      try {
        json = LDValue.parse((String)value);
      } catch (RuntimeException e) {
        return null;
      }
    } else {
      return null;
    }
    return json.getType() == LDValueType.OBJECT ? json : null;
  }

  /**
   * Validates a percentage.
   *
   * @param value the percentage
   * @return the same value
   * @throws IllegalArgumentException if the value is outside [0, 100]
   */
  public static double checkPercentage(double value) {
    if (Double.isNaN(value) || value < 0 || value > 100) {
      throw new IllegalArgumentException(
          "value must be a positive number less than or equal to 100, but was " + toStorageString(value));
    }
    return value;
  }

  /**
   * Formats a value the way adapters persist it: integral numbers without a fractional part, other
   * numbers in plain decimal notation, booleans as {@code "true"}/{@code "false"}.
   *
   * @param value a wrapped value
   * @return the string, or null for null
   */
  public static String toStorageString(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof LDValue) {
      LDValue v = (LDValue)value;
      switch (v.getType()) {
      case NULL:
        return null;
      case STRING:
        return v.stringValue();
      case NUMBER:
        return toStorageString(v.doubleValue());
      case BOOLEAN:
        return String.valueOf(v.booleanValue());
      default:
        return v.toJsonString();
      }
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number)value).doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return String.valueOf(d);
      }
      if (d == Math.rint(d) && Math.abs(d) < 1e15) {
        return String.valueOf((long)d);
      }
      return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
    }
    return value.toString();
  }

  /**
   * Normalizes a snapshot of many features: every record is passed through
   * {@link #featureRecord(Map)}.
   *
   * @param features raw records keyed by feature key
   * @return normalized records
   */
  public static Map<String, Map<String, Object>> featuresHash(Map<String, ? extends Map<String, ?>> features) {
    Map<String, Map<String, Object>> result = new HashMap<>();
    if (features != null) {
      for (Map.Entry<String, ? extends Map<String, ?>> e: features.entrySet()) {
        result.put(e.getKey(), featureRecord(e.getValue()));
      }
    }
    return result;
  }

  /**
   * Normalizes one raw record: collections become sets of strings, JSON objects stay as
   * {@link LDValue}, other JSON scalars become strings, and nulls are dropped.
   *
   * @param record a raw record
   * @return the normalized record
   */
  public static Map<String, Object> featureRecord(Map<String, ?> record) {
    Map<String, Object> result = new HashMap<>();
    if (record == null) {
      return result;
    }
    for (Map.Entry<String, ?> e: record.entrySet()) {
      Object value = e.getValue();
      if (value == null) {
        continue;
      }
      if (value instanceof Collection) {
        result.put(e.getKey(), toSet(value));
      } else if (value instanceof LDValue) {
        LDValue v = (LDValue)value;
        if (v.isNull()) {
          continue;
        }
        if (v.getType() == LDValueType.ARRAY) {
          result.put(e.getKey(), toSet(v));
        } else if (v.getType() == LDValueType.OBJECT) {
          result.put(e.getKey(), v);
        } else {
          result.put(e.getKey(), toStorageString(v));
        }
      } else if (value instanceof Expression) {
        result.put(e.getKey(), ((Expression)value).value());
      } else if (value instanceof Number || value instanceof Boolean) {
        result.put(e.getKey(), toStorageString(value));
      } else {
        result.put(e.getKey(), value);
      }
    }
    return result;
  }
}
