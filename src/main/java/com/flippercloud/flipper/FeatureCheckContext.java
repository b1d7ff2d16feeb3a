package com.flippercloud.flipper;

/**
 * Everything a gate needs to decide whether it is open for one check.
 */
public final class FeatureCheckContext {
  private final String featureName;
  private final GateValues values;
  private final Object thing;

  /**
   * @param featureName the feature being checked
   * @param values the feature's current gate values
   * @param thing the candidate; an {@link ActorType}, another wrapped value, or null
   */
  public FeatureCheckContext(String featureName, GateValues values, Object thing) {
    this.featureName = featureName;
    this.values = values;
    this.thing = thing;
  }

  public String getFeatureName() {
    return featureName;
  }

  public GateValues getValues() {
    return values;
  }

  public Object getThing() {
    return thing;
  }

  /**
   * Returns the candidate as an actor if it is one with a usable id.
   *
   * @return the actor, or null
   */
  public ActorType getActor() {
    if (thing instanceof ActorType && ((ActorType)thing).hasValidId()) {
      return (ActorType)thing;
    }
    return null;
  }
}
