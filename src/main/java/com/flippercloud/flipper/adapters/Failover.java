package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.export.Export;
import com.flippercloud.flipper.subsystems.Adapter;
import com.launchdarkly.logging.LDLogger;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Reads from a primary adapter and falls back to a secondary one when the primary throws a matching
 * exception.
 * <p>
 * Writes always go to the primary. With dual writes enabled they are then repeated on the secondary;
 * the primary's result is returned either way.
 */
public final class Failover implements Adapter {
  private final Adapter primary;
  private final Adapter secondary;
  private final boolean dualWrite;
  private final ErrorMatcher errors;
  private final LDLogger logger;

  public Failover(Adapter primary, Adapter secondary) {
    this(primary, secondary, false, null, LDLogger.none());
  }

  /**
   * Creates an instance.
   *
   * @param primary the preferred adapter
   * @param secondary the fallback adapter
   * @param dualWrite true to repeat writes on the secondary
   * @param errors the exception classes that trigger a fallback; null or empty means every
   *   {@link RuntimeException}
   * @param logger receives a warning for every fallback
   */
  public Failover(Adapter primary, Adapter secondary, boolean dualWrite,
      List<Class<? extends RuntimeException>> errors, LDLogger logger) {
    this.primary = primary;
    this.secondary = secondary;
    this.dualWrite = dualWrite;
    this.errors = ErrorMatcher.of(errors);
    this.logger = logger == null ? LDLogger.none() : logger;
  }

  private <T> T read(String operation, Supplier<T> fromPrimary, Supplier<T> fromSecondary) {
    try {
      return fromPrimary.get();
    } catch (RuntimeException e) {
      if (!errors.matches(e)) {
        throw e;
      }
      logger.warn("Adapter \"{}\" failed on {}, using \"{}\": {}", primary.getName(), operation,
          secondary.getName(), e.toString());
      return fromSecondary.get();
    }
  }

  private boolean write(Supplier<Boolean> toPrimary, Supplier<Boolean> toSecondary) {
    boolean result = toPrimary.get();
    if (dualWrite) {
      toSecondary.get();
    }
    return result;
  }

  @Override
  public String getName() {
    return primary.getName();
  }

  @Override
  public Set<String> features() {
    return read("features", primary::features, secondary::features);
  }

  @Override
  public boolean add(Feature feature) {
    return write(() -> primary.add(feature), () -> secondary.add(feature));
  }

  @Override
  public boolean remove(Feature feature) {
    return write(() -> primary.remove(feature), () -> secondary.remove(feature));
  }

  @Override
  public boolean clear(Feature feature) {
    return write(() -> primary.clear(feature), () -> secondary.clear(feature));
  }

  @Override
  public Map<String, Object> get(Feature feature) {
    return read("get", () -> primary.get(feature), () -> secondary.get(feature));
  }

  @Override
  public Map<String, Map<String, Object>> getMulti(Collection<Feature> features) {
    return read("getMulti", () -> primary.getMulti(features), () -> secondary.getMulti(features));
  }

  @Override
  public Map<String, Map<String, Object>> getAll() {
    return read("getAll", primary::getAll, secondary::getAll);
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    return write(() -> primary.enable(feature, gate, thing), () -> secondary.enable(feature, gate, thing));
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    return write(() -> primary.disable(feature, gate, thing), () -> secondary.disable(feature, gate, thing));
  }

  @Override
  public boolean isReadOnly() {
    return primary.isReadOnly();
  }

  @Override
  public Export export(String format, int version) {
    return read("export", () -> primary.export(format, version), () -> secondary.export(format, version));
  }

  @Override
  public boolean importFrom(Adapter source) {
    return write(() -> primary.importFrom(source), () -> secondary.importFrom(source));
  }
}
