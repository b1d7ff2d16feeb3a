package com.flippercloud.flipper;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.sdk.LDValue;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable, typed snapshot of one feature's raw storage record.
 * <p>
 * Instances are built from scratch for every read; nothing ever patches an existing snapshot.
 */
public final class GateValues {
  private static final GateValues EMPTY = new GateValues(ImmutableMap.<String, Object>of());

  private final boolean booleanValue;
  private final Set<String> actors;
  private final Set<String> groups;
  private final double percentageOfActors;
  private final double percentageOfTime;
  private final LDValue expression;

  /**
   * Builds a snapshot from a raw record keyed by gate key.
   *
   * @param raw the raw record; null is treated as empty
   */
  public GateValues(Map<String, ?> raw) {
    Map<String, ?> record = raw == null ? ImmutableMap.<String, Object>of() : raw;
    this.booleanValue = Typecast.toBoolean(record.get(GateKind.BOOLEAN.getKey()));
    this.actors = Typecast.toSet(record.get(GateKind.ACTOR.getKey()));
    this.groups = Typecast.toSet(record.get(GateKind.GROUP.getKey()));
    this.percentageOfActors = Typecast.toPercentage(record.get(GateKind.PERCENTAGE_OF_ACTORS.getKey()));
    this.percentageOfTime = Typecast.toPercentage(record.get(GateKind.PERCENTAGE_OF_TIME.getKey()));
    this.expression = Typecast.toExpression(record.get(GateKind.EXPRESSION.getKey()));
  }

  /**
   * Returns a snapshot with every gate unset.
   *
   * @return the empty snapshot
   */
  public static GateValues empty() {
    return EMPTY;
  }

  public boolean getBoolean() {
    return booleanValue;
  }

  public Set<String> getActors() {
    return actors;
  }

  public Set<String> getGroups() {
    return groups;
  }

  public double getPercentageOfActors() {
    return percentageOfActors;
  }

  public double getPercentageOfTime() {
    return percentageOfTime;
  }

  /**
   * @return the expression as JSON, or null if none is set
   */
  public LDValue getExpression() {
    return expression;
  }

  /**
   * Returns the typed value for a gate.
   *
   * @param kind the gate kind
   * @return a Boolean, a Set of strings, a Double or an LDValue (possibly null for expressions)
   */
  public Object get(GateKind kind) {
    switch (kind) {
    case BOOLEAN:
      return booleanValue;
    case ACTOR:
      return actors;
    case GROUP:
      return groups;
    case PERCENTAGE_OF_ACTORS:
      return percentageOfActors;
    case PERCENTAGE_OF_TIME:
      return percentageOfTime;
    case EXPRESSION:
      return expression;
    default:
      throw new IllegalArgumentException("unknown gate kind: " + kind);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof GateValues)) {
      return false;
    }
    GateValues o = (GateValues)other;
    return booleanValue == o.booleanValue && actors.equals(o.actors) && groups.equals(o.groups) &&
        Double.compare(percentageOfActors, o.percentageOfActors) == 0 &&
        Double.compare(percentageOfTime, o.percentageOfTime) == 0 &&
        Objects.equals(expression, o.expression);
  }

  @Override
  public int hashCode() {
    return Objects.hash(booleanValue, actors, groups, percentageOfActors, percentageOfTime, expression);
  }

  @Override
  public String toString() {
    return "GateValues(boolean=" + booleanValue + ", actors=" + actors + ", groups=" + groups +
        ", percentageOfActors=" + Typecast.toStorageString(percentageOfActors) +
        ", percentageOfTime=" + Typecast.toStorageString(percentageOfTime) +
        ", expression=" + (expression == null ? null : expression.toJsonString()) + ")";
  }
}
