package com.flippercloud.flipper;

/**
 * The closed set of gate variants a {@link Feature} evaluates.
 * <p>
 * Each kind carries the gate's public name, the key under which adapters store its value, and the
 * {@link DataType} that dictates the storage representation. Value wrappers report their kind so that
 * a feature can pick the gate that protects them without inspecting runtime types.
 */
public enum GateKind {
  BOOLEAN("boolean", "boolean", DataType.BOOLEAN),
  EXPRESSION("expression", "expression", DataType.JSON),
  ACTOR("actor", "actors", DataType.SET),
  PERCENTAGE_OF_ACTORS("percentageOfActors", "percentageOfActors", DataType.NUMBER),
  PERCENTAGE_OF_TIME("percentageOfTime", "percentageOfTime", DataType.NUMBER),
  GROUP("group", "groups", DataType.SET);

  private final String gateName;
  private final String key;
  private final DataType dataType;

  private GateKind(String gateName, String key, DataType dataType) {
    this.gateName = gateName;
    this.key = key;
    this.dataType = dataType;
  }

  /**
   * Returns the gate name used in instrumentation payloads and gate lookups.
   *
   * @return the gate name
   */
  public String getGateName() {
    return gateName;
  }

  /**
   * Returns the key under which adapters store this gate's value.
   *
   * @return the storage key
   */
  public String getKey() {
    return key;
  }

  /**
   * Returns the storage representation of this gate's value.
   *
   * @return the data type
   */
  public DataType getDataType() {
    return dataType;
  }

  /**
   * Finds a kind by its gate name or storage key.
   *
   * @param name a gate name such as "actor" or a key such as "actors"
   * @return the matching kind, or null if there is none
   */
  public static GateKind forName(String name) {
    for (GateKind kind: values()) {
      if (kind.gateName.equals(name) || kind.key.equals(name)) {
        return kind;
      }
    }
    return null;
  }
}
