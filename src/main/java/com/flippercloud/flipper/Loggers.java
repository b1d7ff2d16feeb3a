package com.flippercloud.flipper;

/**
 * Logger names shared by implementation code.
 * <p>
 * Components are logged under a small set of stable names derived from the {@link Flipper} class
 * rather than under their own class names, which are mostly implementation details. Code in other
 * packages receives an {@link com.launchdarkly.logging.LDLogger} that was created with these names.
 */
abstract class Loggers {
  private Loggers() {}

  static final String BASE_LOGGER_NAME = Flipper.class.getName();
  static final String ADAPTER_LOGGER_NAME = "Adapter";
  static final String EVALUATION_LOGGER_NAME = "Evaluation";
  static final String SYNC_LOGGER_NAME = "Sync";
}
