package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.export.Export;
import com.flippercloud.flipper.export.JsonExport;
import com.flippercloud.flipper.subsystems.Adapter;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.logging.LDLogger;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Turns matching exceptions into safe defaults so that a storage outage reads as every feature being
 * off: no features, empty records, failed writes and an empty export.
 * <p>
 * Exceptions that do not match the configured classes still propagate.
 */
public final class Failsafe extends ForwardingAdapter {
  private final Adapter adapter;
  private final ErrorMatcher errors;
  private final LDLogger logger;

  public Failsafe(Adapter adapter) {
    this(adapter, null, LDLogger.none());
  }

  /**
   * Creates an instance.
   *
   * @param adapter the adapter to wrap
   * @param errors the exception classes to suppress; null or empty means every {@link RuntimeException}
   * @param logger receives a warning for every suppressed exception
   */
  public Failsafe(Adapter adapter, List<Class<? extends RuntimeException>> errors, LDLogger logger) {
    this.adapter = adapter;
    this.errors = ErrorMatcher.of(errors);
    this.logger = logger == null ? LDLogger.none() : logger;
  }

  @Override
  protected Adapter delegate() {
    return adapter;
  }

  private <T> T failsafe(String operation, Supplier<T> action, Supplier<T> fallback) {
    try {
      return action.get();
    } catch (RuntimeException e) {
      if (!errors.matches(e)) {
        throw e;
      }
      logger.warn("Adapter \"{}\" failed on {}, using default: {}", adapter.getName(), operation, e.toString());
      return fallback.get();
    }
  }

  @Override
  public Set<String> features() {
    return failsafe("features", adapter::features, ImmutableSet::of);
  }

  @Override
  public boolean add(Feature feature) {
    return failsafe("add", () -> adapter.add(feature), () -> false);
  }

  @Override
  public boolean remove(Feature feature) {
    return failsafe("remove", () -> adapter.remove(feature), () -> false);
  }

  @Override
  public boolean clear(Feature feature) {
    return failsafe("clear", () -> adapter.clear(feature), () -> false);
  }

  @Override
  public Map<String, Object> get(Feature feature) {
    return failsafe("get", () -> adapter.get(feature), HashMap::new);
  }

  @Override
  public Map<String, Map<String, Object>> getMulti(Collection<Feature> features) {
    return failsafe("getMulti", () -> adapter.getMulti(features), HashMap::new);
  }

  @Override
  public Map<String, Map<String, Object>> getAll() {
    return failsafe("getAll", adapter::getAll, HashMap::new);
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    return failsafe("enable", () -> adapter.enable(feature, gate, thing), () -> false);
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    return failsafe("disable", () -> adapter.disable(feature, gate, thing), () -> false);
  }

  @Override
  public Export export(String format, int version) {
    return failsafe("export", () -> adapter.export(format, version), JsonExport::empty);
  }

  @Override
  public boolean importFrom(Adapter source) {
    return failsafe("import", () -> adapter.importFrom(source), () -> false);
  }
}
