package com.flippercloud.flipper.expressions;

import com.google.common.collect.ImmutableMap;
import com.launchdarkly.sdk.LDValue;

import java.util.Map;

/**
 * The inputs an {@link Expression} is evaluated against: the feature being checked and the
 * properties of the actor, if any.
 */
public final class EvaluationContext {
  private final String featureName;
  private final Map<String, LDValue> properties;

  /**
   * Creates a context.
   *
   * @param featureName the feature name; may be null outside of a feature check
   * @param properties the actor properties; null is treated as empty
   */
  public EvaluationContext(String featureName, Map<String, LDValue> properties) {
    this.featureName = featureName;
    this.properties = properties == null ? ImmutableMap.of() : properties;
  }

  public String getFeatureName() {
    return featureName;
  }

  public Map<String, LDValue> getProperties() {
    return properties;
  }

  /**
   * Looks up a property.
   *
   * @param name the property name
   * @return the value, or a JSON null if the actor has no such property
   */
  public LDValue getProperty(String name) {
    return LDValue.normalize(properties.get(name));
  }
}
