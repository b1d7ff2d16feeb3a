package com.flippercloud.flipper;

import com.flippercloud.flipper.expressions.Expression;
import com.flippercloud.flipper.expressions.Expressions;
import com.flippercloud.flipper.instrumenters.NoopInstrumenter;
import com.flippercloud.flipper.subsystems.Adapter;
import com.flippercloud.flipper.subsystems.Instrumenter;
import com.google.common.collect.ImmutableList;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.sdk.LDValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * One feature: its name, its gates, and the adapter its state lives in.
 * <p>
 * A feature never caches evaluation results; every check reads fresh {@link GateValues} from the
 * adapter. Put a {@link com.flippercloud.flipper.adapters.Memoizable} in the adapter chain to avoid
 * repeated reads.
 * <p>
 * Every public operation is reported to the instrumenter as a {@code feature_operation.flipper} event.
 */
public final class Feature {
  /**
   * The event name used for every feature operation.
   */
  public static final String INSTRUMENTATION_NAME = "feature_operation.flipper";

  private final String name;
  private final Adapter adapter;
  private final GroupRegistry groups;
  private final Instrumenter instrumenter;
  private final List<Gate> gates;

  /**
   * Creates a feature.
   *
   * @param name the feature name, which is also its storage key
   * @param adapter the adapter holding the feature's state
   * @param groups the registered groups
   * @param instrumenter receives an event for every operation
   * @param logger used to report expression evaluation failures
   */
  public Feature(String name, Adapter adapter, GroupRegistry groups, Instrumenter instrumenter, LDLogger logger) {
    this.name = name;
    this.adapter = adapter;
    this.groups = groups == null ? new GroupRegistry() : groups;
    this.instrumenter = instrumenter == null ? NoopInstrumenter.INSTANCE : instrumenter;
    this.gates = Gate.standardGates(this.groups, logger == null ? LDLogger.none() : logger);
  }

  /**
   * Creates a feature with no registered groups and no instrumentation.
   *
   * @param name the feature name
   * @param adapter the adapter holding the feature's state
   */
  public Feature(String name, Adapter adapter) {
    this(name, adapter, null, null, null);
  }

  public String getName() {
    return name;
  }

  /**
   * Returns the storage key, which is the same as the name.
   *
   * @return the key
   */
  public String getKey() {
    return name;
  }

  public Adapter getAdapter() {
    return adapter;
  }

  /**
   * Enables the feature for everyone.
   *
   * @return the adapter's result
   */
  public boolean enable() {
    return enable(null);
  }

  /**
   * Enables the feature for a value: a boolean, an {@link Actor}, a group name, or any
   * {@link TypedValue}. Null means {@code true}.
   *
   * @param thing the value
   * @return the adapter's result
   * @throws IllegalArgumentException if no gate handles the value
   */
  public boolean enable(Object thing) {
    Object candidate = thing == null ? Boolean.TRUE : thing;
    return instrument("enable", payload -> {
      Gate gate = gateFor(candidate);
      TypedValue wrapped = gate.wrap(candidate);
      payload.put("gate_name", gate.getKey());
      payload.put("thing", wrapped);
      adapter.add(this);
      return adapter.enable(this, gate, wrapped);
    });
  }

  public boolean enableActor(Actor actor) {
    return enable(ActorType.wrap(actor));
  }

  public boolean enableGroup(String groupName) {
    return enable(GroupType.wrap(groupName));
  }

  public boolean enablePercentageOfActors(double percentage) {
    return enable(PercentageOfActorsType.wrap(percentage));
  }

  public boolean enablePercentageOfTime(double percentage) {
    return enable(PercentageOfTimeType.wrap(percentage));
  }

  public boolean enableExpression(Expression expression) {
    return enable(ExpressionType.wrap(expression));
  }

  /**
   * Disables the feature for everyone, clearing every gate.
   *
   * @return the adapter's result
   */
  public boolean disable() {
    return disable(null);
  }

  /**
   * Disables the feature for a value. Null means {@code false}, which clears every gate.
   *
   * @param thing the value
   * @return the adapter's result
   * @throws IllegalArgumentException if no gate handles the value
   */
  public boolean disable(Object thing) {
    Object candidate = thing == null ? Boolean.FALSE : thing;
    return instrument("disable", payload -> {
      Gate gate = gateFor(candidate);
      TypedValue wrapped = gate.wrap(candidate);
      payload.put("gate_name", gate.getKey());
      payload.put("thing", wrapped);
      adapter.add(this);
      return adapter.disable(this, gate, wrapped);
    });
  }

  public boolean disableActor(Actor actor) {
    return disable(ActorType.wrap(actor));
  }

  public boolean disableGroup(String groupName) {
    return disable(GroupType.wrap(groupName));
  }

  public boolean disablePercentageOfActors() {
    return disable(PercentageOfActorsType.wrap(0));
  }

  public boolean disablePercentageOfTime() {
    return disable(PercentageOfTimeType.wrap(0));
  }

  /**
   * Deletes the expression, leaving the other gates untouched.
   *
   * @return the adapter's result
   */
  public boolean disableExpression() {
    return disable(ExpressionType.NONE);
  }

  /**
   * Checks whether the feature is enabled for everyone.
   *
   * @return true if enabled
   */
  public boolean isEnabled() {
    return isEnabled(null);
  }

  /**
   * Checks whether the feature is enabled for a candidate. Gates are consulted in order and the first
   * open gate decides; its key is reported as {@code gate_name}.
   *
   * @param thing an {@link Actor}, an {@link ActorType}, or null
   * @return true if any gate is open
   */
  public boolean isEnabled(Object thing) {
    return instrument("enabled?", payload -> {
      GateValues values = gateValues();
      Object candidate = thing;
      if (thing instanceof Actor || thing instanceof ActorType) {
        candidate = ActorType.candidate(thing);
      }
      if (thing != null) {
        payload.put("thing", candidate);
      }
      FeatureCheckContext context = new FeatureCheckContext(name, values, candidate);
      for (Gate gate: gates) {
        if (gate.isOpen(context)) {
          payload.put("gate_name", gate.getKey());
          return true;
        }
      }
      return false;
    });
  }

  /**
   * Summarizes how the feature is enabled.
   *
   * @return the state
   */
  public FeatureState state() {
    GateValues values = gateValues();
    if (values.getBoolean() || values.getPercentageOfTime() == 100) {
      return FeatureState.ON;
    }
    for (Gate gate: gates) {
      if (gate.getKind() != GateKind.BOOLEAN && gate.isEnabled(values)) {
        return FeatureState.CONDITIONAL;
      }
    }
    return FeatureState.OFF;
  }

  public boolean isOn() {
    return state() == FeatureState.ON;
  }

  public boolean isOff() {
    return state() == FeatureState.OFF;
  }

  public boolean isConditional() {
    return state() == FeatureState.CONDITIONAL;
  }

  public boolean booleanValue() {
    return gateValues().getBoolean();
  }

  public Set<String> actorsValue() {
    return gateValues().getActors();
  }

  public Set<String> groupsValue() {
    return gateValues().getGroups();
  }

  public double percentageOfActorsValue() {
    return gateValues().getPercentageOfActors();
  }

  public double percentageOfTimeValue() {
    return gateValues().getPercentageOfTime();
  }

  /**
   * Returns the stored expression.
   *
   * @return the expression, or null if none is set
   */
  public Expression expressionValue() {
    LDValue json = gateValues().getExpression();
    return json == null ? null : Expressions.build(json);
  }

  /**
   * Reads the current gate values from the adapter.
   *
   * @return a fresh snapshot
   */
  public GateValues gateValues() {
    return new GateValues(adapter.get(this));
  }

  public boolean add() {
    return instrument("add", payload -> adapter.add(this));
  }

  public boolean exist() {
    return instrument("exist?", payload -> adapter.features().contains(getKey()));
  }

  public boolean remove() {
    return instrument("remove", payload -> adapter.remove(this));
  }

  public boolean clear() {
    return instrument("clear", payload -> adapter.clear(this));
  }

  /**
   * Returns the gates that currently have a value.
   *
   * @return enabled gates in evaluation order
   */
  public List<Gate> enabledGates() {
    GateValues values = gateValues();
    List<Gate> result = new ArrayList<>();
    for (Gate gate: gates) {
      if (gate.isEnabled(values)) {
        result.add(gate);
      }
    }
    return result;
  }

  public List<Gate> disabledGates() {
    List<Gate> enabled = enabledGates();
    List<Gate> result = new ArrayList<>();
    for (Gate gate: gates) {
      if (!enabled.contains(gate)) {
        result.add(gate);
      }
    }
    return result;
  }

  public List<String> enabledGateNames() {
    return namesOf(enabledGates());
  }

  public List<String> disabledGateNames() {
    return namesOf(disabledGates());
  }

  private static List<String> namesOf(List<Gate> gates) {
    List<String> names = new ArrayList<>();
    for (Gate gate: gates) {
      names.add(gate.getName());
    }
    return names;
  }

  /**
   * Returns the registered groups this feature is enabled for.
   *
   * @return the groups
   */
  public List<GroupType> enabledGroups() {
    Set<String> enabled = groupsValue();
    List<GroupType> result = new ArrayList<>();
    for (GroupType group: groups.all()) {
      if (enabled.contains(group.getValue())) {
        result.add(group);
      }
    }
    return result;
  }

  public List<GroupType> disabledGroups() {
    Set<String> enabled = groupsValue();
    List<GroupType> result = new ArrayList<>();
    for (GroupType group: groups.all()) {
      if (!enabled.contains(group.getValue())) {
        result.add(group);
      }
    }
    return result;
  }

  /**
   * Finds the gate that handles a value. Wrapped values are routed by their {@link GateKind}; raw
   * values go to the first gate that protects them.
   *
   * @param thing the value
   * @return the gate
   * @throws IllegalArgumentException if no gate handles the value
   */
  public Gate gateFor(Object thing) {
    if (thing instanceof TypedValue) {
      return gate(((TypedValue)thing).getKind());
    }
    for (Gate gate: gates) {
      if (gate.protectsThing(thing)) {
        return gate;
      }
    }
    throw new IllegalArgumentException("No gate found for " + thing);
  }

  /**
   * Looks up a gate by name or storage key.
   *
   * @param name e.g. {@code "actor"} or {@code "actors"}
   * @return the gate, or null if there is no such gate
   */
  public Gate gate(String name) {
    GateKind kind = GateKind.forName(name);
    return kind == null ? null : gate(kind);
  }

  Gate gate(GateKind kind) {
    for (Gate gate: gates) {
      if (gate.getKind() == kind) {
        return gate;
      }
    }
    throw new IllegalStateException("missing gate " + kind);
  }

  /**
   * Returns every gate in evaluation order.
   *
   * @return the gates
   */
  public List<Gate> gates() {
    return ImmutableList.copyOf(gates);
  }

  private <T> T instrument(String operation, Function<Map<String, Object>, T> action) {
    Map<String, Object> payload = new HashMap<>();
    payload.put("feature_name", name);
    payload.put("operation", operation);
    return instrumenter.instrument(INSTRUMENTATION_NAME, payload, action);
  }

  @Override
  public String toString() {
    return name;
  }
}
