package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.GateKind;
import com.flippercloud.flipper.GateValues;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.subsystems.Adapter;

import java.util.Set;

/**
 * Caps the number of actors that can be individually enabled for one feature.
 * <p>
 * Only enabling the actor gate is checked. Re-enabling an actor that is already in the set is always
 * allowed.
 */
public final class ActorLimit extends ForwardingAdapter {
  /**
   * The limit used when none is given.
   */
  public static final int DEFAULT_LIMIT = 100;

  private final Adapter adapter;
  private final int limit;

  public ActorLimit(Adapter adapter) {
    this(adapter, DEFAULT_LIMIT);
  }

  /**
   * @param adapter the adapter to wrap
   * @param limit the maximum number of actors per feature
   */
  public ActorLimit(Adapter adapter, int limit) {
    this.adapter = adapter;
    this.limit = limit;
  }

  @Override
  protected Adapter delegate() {
    return adapter;
  }

  public int getLimit() {
    return limit;
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    if (gate.getKind() == GateKind.ACTOR) {
      Set<String> actors = new GateValues(adapter.get(feature)).getActors();
      if (!actors.contains(thing.getStorageValue()) && actors.size() >= limit) {
        throw new ActorLimitExceededException(feature.getName(), limit);
      }
    }
    return adapter.enable(feature, gate, thing);
  }
}
