package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.export.Export;
import com.flippercloud.flipper.subsystems.Adapter;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records every call that passes through it. Used to check which adapter operations some higher-level
 * call issued.
 */
public final class OperationLogger extends ForwardingAdapter {
  /**
   * One recorded call.
   */
  public static final class Operation {
    private final String type;
    private final List<Object> args;

    Operation(String type, Object... args) {
      this.type = type;
      this.args = Collections.unmodifiableList(Arrays.asList(args));
    }

    public String getType() {
      return type;
    }

    public List<Object> getArgs() {
      return args;
    }

    @Override
    public String toString() {
      return type + args;
    }
  }

  private final Adapter adapter;
  private final List<Operation> operations = new ArrayList<>();

  public OperationLogger(Adapter adapter) {
    this.adapter = adapter;
  }

  @Override
  protected Adapter delegate() {
    return adapter;
  }

  private void log(String type, Object... args) {
    synchronized (operations) {
      operations.add(new Operation(type, args));
    }
  }

  public List<Operation> getOperations() {
    synchronized (operations) {
      return ImmutableList.copyOf(operations);
    }
  }

  public int count() {
    return getOperations().size();
  }

  public int count(String type) {
    return type(type).size();
  }

  /**
   * Returns the recorded calls of one type, e.g. {@code "enable"}.
   *
   * @param type the operation name
   * @return matching calls in order
   */
  public List<Operation> type(String type) {
    List<Operation> result = new ArrayList<>();
    for (Operation op: getOperations()) {
      if (op.getType().equals(type)) {
        result.add(op);
      }
    }
    return result;
  }

  /**
   * Returns the most recent call of one type.
   *
   * @param type the operation name
   * @return the call, or null
   */
  public Operation last(String type) {
    List<Operation> matching = type(type);
    return matching.isEmpty() ? null : matching.get(matching.size() - 1);
  }

  public void reset() {
    synchronized (operations) {
      operations.clear();
    }
  }

  @Override
  public Set<String> features() {
    log("features");
    return adapter.features();
  }

  @Override
  public boolean add(Feature feature) {
    log("add", feature.getKey());
    return adapter.add(feature);
  }

  @Override
  public boolean remove(Feature feature) {
    log("remove", feature.getKey());
    return adapter.remove(feature);
  }

  @Override
  public boolean clear(Feature feature) {
    log("clear", feature.getKey());
    return adapter.clear(feature);
  }

  @Override
  public Map<String, Object> get(Feature feature) {
    log("get", feature.getKey());
    return adapter.get(feature);
  }

  @Override
  public Map<String, Map<String, Object>> getMulti(Collection<Feature> features) {
    log("getMulti", features.size());
    return adapter.getMulti(features);
  }

  @Override
  public Map<String, Map<String, Object>> getAll() {
    log("getAll");
    return adapter.getAll();
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    log("enable", feature.getKey(), gate.getKey(), thing.getStorageValue());
    return adapter.enable(feature, gate, thing);
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    log("disable", feature.getKey(), gate.getKey(), thing.getStorageValue());
    return adapter.disable(feature, gate, thing);
  }

  @Override
  public Export export(String format, int version) {
    log("export", format, version);
    return adapter.export(format, version);
  }

  @Override
  public boolean importFrom(Adapter source) {
    log("import", source.getName());
    return adapter.importFrom(source);
  }

  @Override
  public String toString() {
    return "OperationLogger(adapter=" + adapter.getName() + ", operations=" + count() + ")";
  }
}
