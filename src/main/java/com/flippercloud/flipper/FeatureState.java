package com.flippercloud.flipper;

/**
 * A summary of how a feature is currently enabled.
 */
public enum FeatureState {
  /**
   * Enabled for everyone: the boolean gate is set, or percentage of time is 100.
   */
  ON,
  /**
   * Not enabled for anyone.
   */
  OFF,
  /**
   * Enabled for some actors, groups, percentage or expression.
   */
  CONDITIONAL
}
