package com.flippercloud.flipper;

import com.flippercloud.flipper.expressions.Expression;
import com.flippercloud.flipper.export.Export;
import com.flippercloud.flipper.instrumenters.NoopInstrumenter;
import com.flippercloud.flipper.subsystems.Adapter;
import com.flippercloud.flipper.subsystems.Instrumenter;
import com.launchdarkly.logging.LDLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Operations on features by name, over one adapter and one group registry.
 * <p>
 * {@link Feature} instances are created on first use and reused afterwards.
 */
public class Dsl {
  private final Adapter adapter;
  private final GroupRegistry groups;
  private final Instrumenter instrumenter;
  private final LDLogger evaluationLogger;
  private final ConcurrentMap<String, Feature> memoizedFeatures = new ConcurrentHashMap<>();

  /**
   * Creates an instance.
   *
   * @param adapter the adapter, usually already wrapped in decorators
   * @param groups the group registry shared by every feature of this instance
   * @param instrumenter receives feature operation events
   * @param evaluationLogger used to report expression evaluation failures
   */
  public Dsl(Adapter adapter, GroupRegistry groups, Instrumenter instrumenter, LDLogger evaluationLogger) {
    this.adapter = adapter;
    this.groups = groups == null ? new GroupRegistry() : groups;
    this.instrumenter = instrumenter == null ? NoopInstrumenter.INSTANCE : instrumenter;
    this.evaluationLogger = evaluationLogger == null ? LDLogger.none() : evaluationLogger;
  }

  /**
   * Creates an instance with its own group registry and no instrumentation.
   *
   * @param adapter the adapter
   */
  public Dsl(Adapter adapter) {
    this(adapter, null, null, null);
  }

  public boolean isFeatureEnabled(String featureName) {
    return feature(featureName).isEnabled();
  }

  public boolean isFeatureEnabled(String featureName, Object thing) {
    return feature(featureName).isEnabled(thing);
  }

  public boolean enable(String featureName) {
    return feature(featureName).enable();
  }

  public boolean enable(String featureName, Object thing) {
    return feature(featureName).enable(thing);
  }

  public boolean enableActor(String featureName, Actor actor) {
    return feature(featureName).enableActor(actor);
  }

  public boolean enableGroup(String featureName, String groupName) {
    return feature(featureName).enableGroup(groupName);
  }

  public boolean enablePercentageOfActors(String featureName, double percentage) {
    return feature(featureName).enablePercentageOfActors(percentage);
  }

  public boolean enablePercentageOfTime(String featureName, double percentage) {
    return feature(featureName).enablePercentageOfTime(percentage);
  }

  public boolean enableExpression(String featureName, Expression expression) {
    return feature(featureName).enableExpression(expression);
  }

  public boolean disable(String featureName) {
    return feature(featureName).disable();
  }

  public boolean disable(String featureName, Object thing) {
    return feature(featureName).disable(thing);
  }

  public boolean disableActor(String featureName, Actor actor) {
    return feature(featureName).disableActor(actor);
  }

  public boolean disableGroup(String featureName, String groupName) {
    return feature(featureName).disableGroup(groupName);
  }

  public boolean disablePercentageOfActors(String featureName) {
    return feature(featureName).disablePercentageOfActors();
  }

  public boolean disablePercentageOfTime(String featureName) {
    return feature(featureName).disablePercentageOfTime();
  }

  public boolean disableExpression(String featureName) {
    return feature(featureName).disableExpression();
  }

  public boolean add(String featureName) {
    return feature(featureName).add();
  }

  public boolean exist(String featureName) {
    return feature(featureName).exist();
  }

  public boolean remove(String featureName) {
    return feature(featureName).remove();
  }

  /**
   * Returns every feature known to the adapter.
   *
   * @return the features
   */
  public Set<Feature> features() {
    Set<Feature> result = new LinkedHashSet<>();
    for (String key: adapter.features()) {
      result.add(feature(key));
    }
    return result;
  }

  /**
   * Returns the feature with a name, creating the instance on first use. This does not register the
   * feature with the adapter.
   *
   * @param featureName the name
   * @return the feature
   */
  public Feature feature(String featureName) {
    return memoizedFeatures.computeIfAbsent(featureName,
        n -> new Feature(n, adapter, groups, instrumenter, evaluationLogger));
  }

  /**
   * Same as {@link #feature(String)}.
   *
   * @param featureName the name
   * @return the feature
   */
  public Feature get(String featureName) {
    return feature(featureName);
  }

  /**
   * Reads several features with one {@link Adapter#getMulti(Collection)} call, so that a memoizing
   * adapter can serve later checks from its cache.
   *
   * @param featureNames the names
   * @return the features
   */
  public List<Feature> preload(Collection<String> featureNames) {
    List<Feature> features = new ArrayList<>();
    for (String name: featureNames) {
      features.add(feature(name));
    }
    adapter.getMulti(features);
    return features;
  }

  /**
   * Reads every feature with one {@link Adapter#getAll()} call.
   *
   * @return the features
   */
  public List<Feature> preloadAll() {
    List<Feature> features = new ArrayList<>();
    for (String key: adapter.getAll().keySet()) {
      features.add(feature(key));
    }
    return features;
  }

  public boolean isReadOnly() {
    return adapter.isReadOnly();
  }

  /**
   * Registers a group, replacing any group with the same name.
   *
   * @param groupName the name
   * @param callback decides membership
   * @return the group
   */
  public GroupType register(String groupName, GroupCallback callback) {
    return groups.register(groupName, callback);
  }

  /**
   * Returns a registered group.
   *
   * @param groupName the name
   * @return the group, or null if no group with that name is registered
   */
  public GroupType group(String groupName) {
    return groups.get(groupName);
  }

  public Export export() {
    return adapter.export();
  }

  public Export export(String format, int version) {
    return adapter.export(format, version);
  }

  public boolean importFrom(Adapter source) {
    return adapter.importFrom(source);
  }

  public boolean importFrom(Export source) {
    return adapter.importFrom(source);
  }

  public boolean importFrom(Dsl source) {
    return adapter.importFrom(source);
  }

  public Adapter getAdapter() {
    return adapter;
  }

  public GroupRegistry getGroups() {
    return groups;
  }

  public Instrumenter getInstrumenter() {
    return instrumenter;
  }
}
