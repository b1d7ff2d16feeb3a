package com.flippercloud.flipper;

import com.google.common.collect.ImmutableList;
import com.launchdarkly.logging.LDLogger;

import java.util.List;

/**
 * A named predicate type that can independently open a feature for some set of checks.
 * <p>
 * The six variants are fixed; they are identified by {@link #getKind()} rather than by class. Gates
 * hold no state of their own beyond the collaborators they are constructed with.
 */
public abstract class Gate {
  private final GateKind kind;

  Gate(GateKind kind) {
    this.kind = kind;
  }

  /**
   * Builds the gates of one feature in evaluation order.
   */
  static List<Gate> standardGates(GroupRegistry groups, LDLogger logger) {
    return ImmutableList.of(
        new BooleanGate(),
        new ExpressionGate(logger),
        new ActorGate(),
        new PercentageOfActorsGate(),
        new PercentageOfTimeGate(),
        new GroupGate(groups)
        );
  }

  public GateKind getKind() {
    return kind;
  }

  /**
   * Returns the gate name, e.g. {@code "actor"}.
   *
   * @return the name
   */
  public String getName() {
    return kind.getGateName();
  }

  /**
   * Returns the key under which adapters store this gate's value, e.g. {@code "actors"}.
   *
   * @return the storage key
   */
  public String getKey() {
    return kind.getKey();
  }

  public DataType getDataType() {
    return kind.getDataType();
  }

  /**
   * Decides whether this gate opens the feature for one check.
   *
   * @param context the feature, its values and the candidate
   * @return true if the gate is open
   */
  public abstract boolean isOpen(FeatureCheckContext context);

  /**
   * Decides whether this gate has any value set at all.
   *
   * @param values the feature's gate values
   * @return true if the gate is enabled for someone
   */
  public abstract boolean isEnabled(GateValues values);

  /**
   * Returns true if candidates of this shape are enabled or disabled through this gate.
   *
   * @param thing a raw or wrapped candidate
   * @return true if this gate handles the candidate
   */
  public abstract boolean protectsThing(Object thing);

  /**
   * Wraps a candidate into this gate's value type.
   *
   * @param thing a raw or wrapped candidate
   * @return the wrapped value
   * @throws IllegalArgumentException if the candidate cannot be wrapped
   */
  public abstract TypedValue wrap(Object thing);

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + getName() + ")";
  }
}
