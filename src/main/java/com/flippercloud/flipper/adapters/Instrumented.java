package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.export.Export;
import com.flippercloud.flipper.subsystems.Adapter;
import com.flippercloud.flipper.subsystems.Instrumenter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Reports every adapter call as an {@code adapter_operation.flipper} event.
 * <p>
 * The payload always has {@code operation} and {@code adapter_name}; per-feature calls add
 * {@code feature_name}, gate writes add {@code gate_name}, and {@code getMulti} adds
 * {@code feature_names}. The result is stored under {@code result}.
 */
public final class Instrumented extends ForwardingAdapter {
  /**
   * The event name.
   */
  public static final String INSTRUMENTATION_NAME = "adapter_operation.flipper";

  private final Adapter adapter;
  private final Instrumenter instrumenter;

  public Instrumented(Adapter adapter, Instrumenter instrumenter) {
    this.adapter = adapter;
    this.instrumenter = instrumenter;
  }

  @Override
  protected Adapter delegate() {
    return adapter;
  }

  private <T> T instrument(String operation, Map<String, Object> extra, Supplier<T> action) {
    Map<String, Object> payload = new HashMap<>();
    payload.put("operation", operation);
    payload.put("adapter_name", adapter.getName());
    if (extra != null) {
      payload.putAll(extra);
    }
    return instrumenter.instrument(INSTRUMENTATION_NAME, payload, p -> {
      T result = action.get();
      p.put("result", result);
      return result;
    });
  }

  private static Map<String, Object> featurePayload(Feature feature) {
    Map<String, Object> extra = new HashMap<>();
    extra.put("feature_name", feature.getName());
    return extra;
  }

  private static Map<String, Object> gatePayload(Feature feature, Gate gate) {
    Map<String, Object> extra = featurePayload(feature);
    extra.put("gate_name", gate.getKey());
    return extra;
  }

  @Override
  public Set<String> features() {
    return instrument("features", null, adapter::features);
  }

  @Override
  public boolean add(Feature feature) {
    return instrument("add", featurePayload(feature), () -> adapter.add(feature));
  }

  @Override
  public boolean remove(Feature feature) {
    return instrument("remove", featurePayload(feature), () -> adapter.remove(feature));
  }

  @Override
  public boolean clear(Feature feature) {
    return instrument("clear", featurePayload(feature), () -> adapter.clear(feature));
  }

  @Override
  public Map<String, Object> get(Feature feature) {
    return instrument("get", featurePayload(feature), () -> adapter.get(feature));
  }

  @Override
  public Map<String, Map<String, Object>> getMulti(Collection<Feature> features) {
    List<String> names = new ArrayList<>();
    for (Feature feature: features) {
      names.add(feature.getName());
    }
    Map<String, Object> extra = new HashMap<>();
    extra.put("feature_names", names);
    return instrument("getMulti", extra, () -> adapter.getMulti(features));
  }

  @Override
  public Map<String, Map<String, Object>> getAll() {
    return instrument("getAll", null, adapter::getAll);
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    return instrument("enable", gatePayload(feature, gate), () -> adapter.enable(feature, gate, thing));
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    return instrument("disable", gatePayload(feature, gate), () -> adapter.disable(feature, gate, thing));
  }

  @Override
  public Export export(String format, int version) {
    return instrument("export", null, () -> adapter.export(format, version));
  }

  @Override
  public boolean importFrom(Adapter source) {
    return instrument("import", null, () -> adapter.importFrom(source));
  }
}
