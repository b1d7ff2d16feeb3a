package com.flippercloud.flipper.export;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.subsystems.Adapter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A read-only adapter over the parsed contents of an {@link Export}. Writes report failure; exporting
 * and importing are not supported.
 */
final class ExportAdapter implements Adapter {
  private final ImmutableMap<String, Map<String, Object>> records;

  ExportAdapter(Map<String, Map<String, Object>> records) {
    this.records = ImmutableMap.copyOf(records);
  }

  @Override
  public String getName() {
    return "export";
  }

  @Override
  public Set<String> features() {
    return ImmutableSet.copyOf(records.keySet());
  }

  @Override
  public boolean add(Feature feature) {
    return false;
  }

  @Override
  public boolean remove(Feature feature) {
    return false;
  }

  @Override
  public boolean clear(Feature feature) {
    return false;
  }

  @Override
  public Map<String, Object> get(Feature feature) {
    Map<String, Object> record = records.get(feature.getKey());
    return record == null ? new HashMap<>() : new HashMap<>(record);
  }

  @Override
  public Map<String, Map<String, Object>> getMulti(Collection<Feature> features) {
    Map<String, Map<String, Object>> result = new LinkedHashMap<>();
    for (Feature feature: features) {
      result.put(feature.getKey(), get(feature));
    }
    return result;
  }

  @Override
  public Map<String, Map<String, Object>> getAll() {
    Map<String, Map<String, Object>> result = new LinkedHashMap<>();
    for (Map.Entry<String, Map<String, Object>> e: records.entrySet()) {
      result.put(e.getKey(), new HashMap<>(e.getValue()));
    }
    return result;
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    return false;
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    return false;
  }

  @Override
  public boolean isReadOnly() {
    return true;
  }

  @Override
  public Export export(String format, int version) {
    throw new UnsupportedOperationException("Cannot export from an export");
  }

  @Override
  public boolean importFrom(Adapter source) {
    throw new UnsupportedOperationException("Cannot import into an export");
  }
}
