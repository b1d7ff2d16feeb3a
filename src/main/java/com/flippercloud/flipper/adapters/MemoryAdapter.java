package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.DataType;
import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.GateKind;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.Typecast;
import com.flippercloud.flipper.adapters.sync.Synchronizer;
import com.flippercloud.flipper.export.Export;
import com.flippercloud.flipper.export.Exporters;
import com.flippercloud.flipper.subsystems.Adapter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.logging.LDLogger;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An adapter that keeps all state in memory.
 * <p>
 * Reads are lock-free: every write replaces an immutable snapshot under a lock, the same way for the
 * feature index and for the gate values.
 */
public final class MemoryAdapter implements Adapter {
  private volatile ImmutableSet<String> featureKeys = ImmutableSet.of();
  private volatile ImmutableMap<String, ImmutableMap<String, Object>> records = ImmutableMap.of();
  private final Object writeLock = new Object();
  private final LDLogger logger;

  public MemoryAdapter() {
    this(LDLogger.none());
  }

  /**
   * Creates an adapter that logs import failures to a logger.
   *
   * @param logger the logger
   */
  public MemoryAdapter(LDLogger logger) {
    this.logger = logger;
  }

  @Override
  public String getName() {
    return "memory";
  }

  @Override
  public Set<String> features() {
    return featureKeys;
  }

  @Override
  public boolean add(Feature feature) {
    synchronized (writeLock) {
      if (featureKeys.contains(feature.getKey())) {
        return false;
      }
      featureKeys = ImmutableSet.<String>builder().addAll(featureKeys).add(feature.getKey()).build();
      return true;
    }
  }

  @Override
  public boolean remove(Feature feature) {
    synchronized (writeLock) {
      ImmutableSet.Builder<String> builder = ImmutableSet.builder();
      for (String key: featureKeys) {
        if (!key.equals(feature.getKey())) {
          builder.add(key);
        }
      }
      featureKeys = builder.build();
      putRecord(feature.getKey(), null);
    }
    return true;
  }

  @Override
  public boolean clear(Feature feature) {
    synchronized (writeLock) {
      putRecord(feature.getKey(), null);
    }
    return true;
  }

  @Override
  public Map<String, Object> get(Feature feature) {
    return read(feature.getKey());
  }

  private Map<String, Object> read(String featureKey) {
    Map<String, Object> result = new HashMap<>();
    ImmutableMap<String, Object> record = records.get(featureKey);
    if (record == null) {
      return result;
    }
    for (Map.Entry<String, Object> e: record.entrySet()) {
      GateKind kind = GateKind.forName(e.getKey());
      if (kind != null && kind.getDataType() == DataType.JSON) {
        result.put(e.getKey(), Typecast.toExpression(e.getValue()));
      } else {
        result.put(e.getKey(), e.getValue());
      }
    }
    return result;
  }

  @Override
  public Map<String, Map<String, Object>> getMulti(Collection<Feature> features) {
    Map<String, Map<String, Object>> result = new LinkedHashMap<>();
    for (Feature feature: features) {
      result.put(feature.getKey(), read(feature.getKey()));
    }
    return result;
  }

  @Override
  public Map<String, Map<String, Object>> getAll() {
    Map<String, Map<String, Object>> result = new LinkedHashMap<>();
    for (String key: featureKeys) {
      result.put(key, read(key));
    }
    return result;
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    synchronized (writeLock) {
      switch (gate.getDataType()) {
      case BOOLEAN:
        write(feature.getKey(), gate.getKey(), "true");
        break;
      case NUMBER:
        write(feature.getKey(), gate.getKey(), thing.getStorageValue());
        break;
      case SET:
        updateSet(feature.getKey(), gate.getKey(), thing.getStorageValue(), true);
        break;
      case JSON:
        write(feature.getKey(), gate.getKey(), thing.getStorageValue());
        break;
      default:
        throw new IllegalArgumentException(gate.getName() + " is not supported by this adapter");
      }
    }
    return true;
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    synchronized (writeLock) {
      switch (gate.getDataType()) {
      case BOOLEAN:
        putRecord(feature.getKey(), null);
        break;
      case NUMBER:
        write(feature.getKey(), gate.getKey(), "0");
        break;
      case SET:
        updateSet(feature.getKey(), gate.getKey(), thing.getStorageValue(), false);
        break;
      case JSON:
        write(feature.getKey(), gate.getKey(), null);
        break;
      default:
        throw new IllegalArgumentException(gate.getName() + " is not supported by this adapter");
      }
    }
    return true;
  }

  @Override
  public boolean isReadOnly() {
    return false;
  }

  @Override
  public Export export(String format, int version) {
    return Exporters.build(format, version).call(this);
  }

  @Override
  public boolean importFrom(Adapter source) {
    return new Synchronizer(this, source, logger, true).call();
  }

  // The methods below must be called while holding writeLock.

  private void write(String featureKey, String gateKey, Object value) {
    Map<String, Object> record = new HashMap<>();
    ImmutableMap<String, Object> existing = records.get(featureKey);
    if (existing != null) {
      record.putAll(existing);
    }
    if (value == null) {
      record.remove(gateKey);
    } else {
      record.put(gateKey, value);
    }
    putRecord(featureKey, record.isEmpty() ? null : ImmutableMap.copyOf(record));
  }

  private void updateSet(String featureKey, String gateKey, String member, boolean add) {
    ImmutableMap<String, Object> existing = records.get(featureKey);
    Set<String> current = Typecast.toSet(existing == null ? null : existing.get(gateKey));
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    for (String m: current) {
      if (!m.equals(member)) {
        builder.add(m);
      }
    }
    if (add && member != null) {
      builder.add(member);
    }
    ImmutableSet<String> updated = builder.build();
    write(featureKey, gateKey, updated.isEmpty() ? null : updated);
  }

  private void putRecord(String featureKey, ImmutableMap<String, Object> record) {
    ImmutableMap.Builder<String, ImmutableMap<String, Object>> builder = ImmutableMap.builder();
    for (Map.Entry<String, ImmutableMap<String, Object>> e: records.entrySet()) {
      if (!e.getKey().equals(featureKey)) {
        builder.put(e);
      }
    }
    if (record != null) {
      builder.put(featureKey, record);
    }
    records = builder.build();
  }

  @Override
  public String toString() {
    return "MemoryAdapter(" + featureKeys.size() + " features)";
  }
}
