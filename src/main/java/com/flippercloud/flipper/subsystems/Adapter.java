package com.flippercloud.flipper.subsystems;

import com.flippercloud.flipper.Dsl;
import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.export.Export;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Interface for the storage that feature state is read from and written to.
 * <p>
 * A record is a map from gate key (see {@link Gate#getKey()}) to a raw value whose shape depends on the
 * gate's {@link com.flippercloud.flipper.DataType}: a {@link String} for boolean and number gates, a
 * collection of strings for set gates, and either a JSON string or an already-parsed
 * {@link com.launchdarkly.sdk.LDValue} for the expression gate. Gates with no value are simply absent.
 * <p>
 * Decorators in {@code com.flippercloud.flipper.adapters} implement this same interface around another
 * adapter, so any number of them can be stacked in any order.
 * <p>
 * All implementations must permit concurrent access and updates.
 */
public interface Adapter {
  /**
   * Returns a short name identifying the implementation, used in instrumentation payloads.
   *
   * @return the adapter name
   */
  String getName();

  /**
   * Returns the keys of every known feature.
   *
   * @return a set of feature keys
   */
  Set<String> features();

  /**
   * Registers a feature. A registered feature may have no gate values at all.
   *
   * @param feature the feature
   * @return true if the operation succeeded
   */
  boolean add(Feature feature);

  /**
   * Unregisters a feature and deletes all of its gate values.
   *
   * @param feature the feature
   * @return true if the operation succeeded
   */
  boolean remove(Feature feature);

  /**
   * Deletes all gate values of a feature while keeping it registered.
   *
   * @param feature the feature
   * @return true if the operation succeeded
   */
  boolean clear(Feature feature);

  /**
   * Reads the raw record of one feature.
   *
   * @param feature the feature
   * @return the record; empty if the feature has no values or is unknown
   */
  Map<String, Object> get(Feature feature);

  /**
   * Reads the raw records of several features.
   *
   * @param features the features
   * @return records keyed by feature key, with an entry for every requested feature
   */
  Map<String, Map<String, Object>> getMulti(Collection<Feature> features);

  /**
   * Reads the raw records of every registered feature.
   *
   * @return records keyed by feature key
   */
  Map<String, Map<String, Object>> getAll();

  /**
   * Enables a gate for a value: sets the boolean, stores the percentage or expression, or adds the
   * actor or group to the gate's set.
   *
   * @param feature the feature
   * @param gate the gate
   * @param thing the value, already wrapped by {@link Gate#wrap(Object)}
   * @return true if the operation succeeded
   */
  boolean enable(Feature feature, Gate gate, TypedValue thing);

  /**
   * Disables a gate for a value. Disabling the boolean gate clears the whole feature.
   *
   * @param feature the feature
   * @param gate the gate
   * @param thing the value, already wrapped by {@link Gate#wrap(Object)}
   * @return true if the operation succeeded
   */
  boolean disable(Feature feature, Gate gate, TypedValue thing);

  /**
   * Returns true if this adapter refuses writes.
   *
   * @return true if read-only
   */
  boolean isReadOnly();

  /**
   * Takes a snapshot of every feature.
   *
   * @param format the export format, e.g. {@code "json"}
   * @param version the format version
   * @return the export
   * @throws IllegalArgumentException if the format or version is not supported
   */
  Export export(String format, int version);

  /**
   * Takes a snapshot in the default format, JSON version 1.
   *
   * @return the export
   */
  default Export export() {
    return export("json", 1);
  }

  /**
   * Replaces the state of this adapter with the state of another one, issuing the minimal set of
   * writes.
   *
   * @param source the adapter to copy from
   * @return true if the operation succeeded
   */
  boolean importFrom(Adapter source);

  /**
   * Replaces the state of this adapter with the contents of an export.
   *
   * @param source the export
   * @return true if the operation succeeded
   */
  default boolean importFrom(Export source) {
    return importFrom(source.adapter());
  }

  /**
   * Replaces the state of this adapter with the state behind another {@link Dsl}.
   *
   * @param source the other instance
   * @return true if the operation succeeded
   */
  default boolean importFrom(Dsl source) {
    return importFrom(source.getAdapter());
  }
}
