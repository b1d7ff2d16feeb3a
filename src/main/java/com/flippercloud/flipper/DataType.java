package com.flippercloud.flipper;

/**
 * Describes how an adapter must persist the value of a gate.
 */
public enum DataType {
  /**
   * A single flag, stored as the string {@code "true"} when set.
   */
  BOOLEAN,
  /**
   * A percentage between 0 and 100, stored as a decimal string.
   */
  NUMBER,
  /**
   * A set of strings, such as actor ids or group names.
   */
  SET,
  /**
   * A JSON document, stored as its serialized string.
   */
  JSON
}
