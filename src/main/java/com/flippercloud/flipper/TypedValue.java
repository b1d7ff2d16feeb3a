package com.flippercloud.flipper;

/**
 * A candidate value that has been normalized into the canonical form expected by one gate.
 * <p>
 * Wrapping is idempotent: every {@code wrap} factory returns an already-wrapped value unchanged.
 */
public interface TypedValue {
  /**
   * Returns the gate variant this value belongs to.
   *
   * @return the gate kind
   */
  GateKind getKind();

  /**
   * Returns the wrapped value: a {@link Boolean}, a {@link String} or a {@link Double}.
   *
   * @return the value
   */
  Object getValue();

  /**
   * Returns the string that an adapter persists for this value.
   *
   * @return the storage representation
   */
  default String getStorageValue() {
    return Typecast.toStorageString(getValue());
  }
}
