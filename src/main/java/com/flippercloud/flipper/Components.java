package com.flippercloud.flipper;

import com.flippercloud.flipper.adapters.MemoryAdapter;
import com.flippercloud.flipper.instrumenters.LoggingInstrumenter;
import com.flippercloud.flipper.instrumenters.MemoryInstrumenter;
import com.flippercloud.flipper.instrumenters.NoopInstrumenter;
import com.flippercloud.flipper.subsystems.Adapter;
import com.flippercloud.flipper.subsystems.Instrumenter;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LDSLF4J;
import com.launchdarkly.logging.Logs;

/**
 * Factories for the standard implementations of the component interfaces, for use with
 * {@link FlipperConfig.Builder}.
 */
public abstract class Components {
  private Components() {}

  /**
   * Returns a new, empty in-memory adapter.
   *
   * @return an adapter
   */
  public static Adapter memoryAdapter() {
    return new MemoryAdapter();
  }

  /**
   * Returns an instrumenter that discards every event.
   *
   * @return an instrumenter
   */
  public static Instrumenter noInstrumentation() {
    return NoopInstrumenter.INSTANCE;
  }

  /**
   * Returns an instrumenter that keeps every event in memory. Mostly useful in tests.
   *
   * @return an instrumenter
   */
  public static MemoryInstrumenter memoryInstrumentation() {
    return new MemoryInstrumenter();
  }

  /**
   * Returns an instrumenter that logs every event at debug level.
   *
   * @param logger the logger
   * @return an instrumenter
   */
  public static Instrumenter loggingInstrumentation(LDLogger logger) {
    return new LoggingInstrumenter(logger);
  }

  /**
   * Returns the default log adapter: SLF4J if it is on the classpath, otherwise the console.
   *
   * @return a log adapter
   */
  public static LDLogAdapter defaultLogAdapter() {
    try {
      Class.forName("org.slf4j.LoggerFactory");
      return LDSLF4J.adapter();
    } catch (ClassNotFoundException e) {
      return Logs.toConsole();
    }
  }
}
