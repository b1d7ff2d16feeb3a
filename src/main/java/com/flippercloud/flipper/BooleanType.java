package com.flippercloud.flipper;

/**
 * Wraps a boolean for the boolean gate.
 */
public final class BooleanType implements TypedValue {
  static final BooleanType TRUE = new BooleanType(true);
  static final BooleanType FALSE = new BooleanType(false);

  private final boolean value;

  private BooleanType(boolean value) {
    this.value = value;
  }

  /**
   * Wraps a candidate as a boolean.
   *
   * @param thing a {@link BooleanType} or a {@link Boolean}
   * @return the wrapped value
   * @throws IllegalArgumentException if the candidate is neither
   */
  public static BooleanType wrap(Object thing) {
    if (thing instanceof BooleanType) {
      return (BooleanType)thing;
    }
    if (thing instanceof Boolean) {
      return ((Boolean)thing) ? TRUE : FALSE;
    }
    throw new IllegalArgumentException("Invalid boolean type: " + thing);
  }

  @Override
  public GateKind getKind() {
    return GateKind.BOOLEAN;
  }

  @Override
  public Boolean getValue() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof BooleanType && ((BooleanType)other).value == value;
  }

  @Override
  public int hashCode() {
    return Boolean.hashCode(value);
  }

  @Override
  public String toString() {
    return "BooleanType(" + value + ")";
  }
}
