package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.subsystems.Adapter;
import com.launchdarkly.logging.LDLogger;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Checks that every feature read through {@code get} or {@code getMulti} has been added, and reacts
 * to a missing feature according to its {@link Mode} or a custom handler.
 */
public final class Strict extends ForwardingAdapter {
  /**
   * What to do when a missing feature is read.
   */
  public enum Mode {
    /**
     * Throw a {@link FeatureNotFoundException}.
     */
    RAISE,
    /**
     * Log a warning and continue.
     */
    WARN,
    /**
     * Continue silently.
     */
    NOOP
  }

  private final Adapter adapter;
  private final Consumer<Feature> handler;

  /**
   * Creates an adapter that throws on a missing feature.
   *
   * @param adapter the adapter to wrap
   */
  public Strict(Adapter adapter) {
    this(adapter, Mode.RAISE, LDLogger.none());
  }

  /**
   * @param adapter the adapter to wrap
   * @param raise true for {@link Mode#RAISE}, false for {@link Mode#NOOP}
   */
  public Strict(Adapter adapter, boolean raise) {
    this(adapter, raise ? Mode.RAISE : Mode.NOOP, LDLogger.none());
  }

  /**
   * @param adapter the adapter to wrap
   * @param mode what to do with a missing feature
   * @param logger receives the warning in {@link Mode#WARN}
   */
  public Strict(Adapter adapter, Mode mode, LDLogger logger) {
    this(adapter, handlerFor(mode, logger));
  }

  /**
   * Creates an adapter that calls a handler with every missing feature. The handler may throw.
   *
   * @param adapter the adapter to wrap
   * @param handler receives each missing feature
   */
  public Strict(Adapter adapter, Consumer<Feature> handler) {
    this.adapter = adapter;
    this.handler = handler;
  }

  private static Consumer<Feature> handlerFor(Mode mode, LDLogger logger) {
    switch (mode) {
    case RAISE:
      return feature -> {
        throw new FeatureNotFoundException(feature.getName());
      };
    case WARN:
      return feature -> logger.warn(new FeatureNotFoundException(feature.getName()).getMessage());
    default:
      return feature -> {};
    }
  }

  @Override
  protected Adapter delegate() {
    return adapter;
  }

  @Override
  public Map<String, Object> get(Feature feature) {
    assertFeatureExists(feature, adapter.features());
    return adapter.get(feature);
  }

  @Override
  public Map<String, Map<String, Object>> getMulti(Collection<Feature> features) {
    Set<String> known = adapter.features();
    for (Feature feature: features) {
      assertFeatureExists(feature, known);
    }
    return adapter.getMulti(features);
  }

  private void assertFeatureExists(Feature feature, Set<String> known) {
    if (!known.contains(feature.getKey())) {
      handler.accept(feature);
    }
  }
}
