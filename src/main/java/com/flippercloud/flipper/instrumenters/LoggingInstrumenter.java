package com.flippercloud.flipper.instrumenters;

import com.flippercloud.flipper.subsystems.Instrumenter;
import com.launchdarkly.logging.LDLogger;

import java.util.Map;
import java.util.function.Function;

/**
 * Logs each event at debug level, with its duration.
 */
public final class LoggingInstrumenter implements Instrumenter {
  private final LDLogger logger;

  public LoggingInstrumenter(LDLogger logger) {
    this.logger = logger;
  }

  @Override
  public <T> T instrument(String name, Map<String, Object> payload, Function<Map<String, Object>, T> operation) {
    long start = System.nanoTime();
    try {
      T result = operation.apply(payload);
      logger.debug("{} {} ({} ms)", name, payload, (System.nanoTime() - start) / 1_000_000);
      return result;
    } catch (RuntimeException e) {
      logger.debug("{} {} failed ({} ms): {}", name, payload, (System.nanoTime() - start) / 1_000_000, e.toString());
      throw e;
    }
  }
}
