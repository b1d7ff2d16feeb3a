package com.flippercloud.flipper;

/**
 * Wraps a percentage in [0, 100] for the percentage-of-actors gate.
 */
public final class PercentageOfActorsType implements TypedValue {
  private final double value;

  private PercentageOfActorsType(double value) {
    this.value = Typecast.checkPercentage(value);
  }

  /**
   * Wraps a candidate as a percentage.
   *
   * @param thing a {@link PercentageOfActorsType} or a {@link Number}
   * @return the wrapped value
   * @throws IllegalArgumentException if the candidate is not a number or is outside [0, 100]
   */
  public static PercentageOfActorsType wrap(Object thing) {
    if (thing instanceof PercentageOfActorsType) {
      return (PercentageOfActorsType)thing;
    }
    if (thing instanceof Number) {
      return new PercentageOfActorsType(((Number)thing).doubleValue());
    }
    throw new IllegalArgumentException("Invalid percentage type: " + thing);
  }

  @Override
  public GateKind getKind() {
    return GateKind.PERCENTAGE_OF_ACTORS;
  }

  @Override
  public Double getValue() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof PercentageOfActorsType && Double.compare(((PercentageOfActorsType)other).value, value) == 0;
  }

  @Override
  public int hashCode() {
    return Double.hashCode(value);
  }

  @Override
  public String toString() {
    return "PercentageOfActorsType(" + getStorageValue() + ")";
  }
}
