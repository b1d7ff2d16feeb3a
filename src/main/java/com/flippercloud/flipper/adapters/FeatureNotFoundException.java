package com.flippercloud.flipper.adapters;

/**
 * Thrown by {@link Strict} when a feature that was never added is read.
 */
public final class FeatureNotFoundException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String featureName;

  /**
   * @param featureName the missing feature
   */
  public FeatureNotFoundException(String featureName) {
    super("Could not find feature \"" + featureName + "\". Call flipper.add(\"" + featureName +
        "\") to create it.");
    this.featureName = featureName;
  }

  public String getFeatureName() {
    return featureName;
  }
}
