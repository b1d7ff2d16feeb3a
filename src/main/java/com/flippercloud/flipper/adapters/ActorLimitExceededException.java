package com.flippercloud.flipper.adapters;

/**
 * Thrown by {@link ActorLimit} when enabling one more actor would exceed the limit. Nothing is written.
 */
public final class ActorLimitExceededException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String featureName;
  private final int limit;

  /**
   * @param featureName the feature
   * @param limit the configured limit
   */
  public ActorLimitExceededException(String featureName, int limit) {
    super("Actor limit of " + limit + " exceeded for feature " + featureName);
    this.featureName = featureName;
    this.limit = limit;
  }

  public String getFeatureName() {
    return featureName;
  }

  public int getLimit() {
    return limit;
  }
}
