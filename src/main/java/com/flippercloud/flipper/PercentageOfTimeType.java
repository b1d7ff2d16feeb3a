package com.flippercloud.flipper;

/**
 * Wraps a percentage in [0, 100] for the percentage-of-time gate.
 */
public final class PercentageOfTimeType implements TypedValue {
  private final double value;

  private PercentageOfTimeType(double value) {
    this.value = Typecast.checkPercentage(value);
  }

  /**
   * Wraps a candidate as a percentage.
   *
   * @param thing a {@link PercentageOfTimeType} or a {@link Number}
   * @return the wrapped value
   * @throws IllegalArgumentException if the candidate is not a number or is outside [0, 100]
   */
  public static PercentageOfTimeType wrap(Object thing) {
    if (thing instanceof PercentageOfTimeType) {
      return (PercentageOfTimeType)thing;
    }
    if (thing instanceof Number) {
      return new PercentageOfTimeType(((Number)thing).doubleValue());
    }
    throw new IllegalArgumentException("Invalid percentage type: " + thing);
  }

  @Override
  public GateKind getKind() {
    return GateKind.PERCENTAGE_OF_TIME;
  }

  @Override
  public Double getValue() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PercentageOfTimeType && Double.compare(((PercentageOfTimeType)other).value, value) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value);
  }

  @Override
  public String toString() {
    return "PercentageOfTimeType(" + getStorageValue() + ")";
  }
}
