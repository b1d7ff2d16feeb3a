package com.flippercloud.flipper.instrumenters;

import com.flippercloud.flipper.subsystems.Instrumenter;

import java.util.Map;
import java.util.function.Function;

/**
 * Runs every operation without recording anything.
 */
public final class NoopInstrumenter implements Instrumenter {
  public static final NoopInstrumenter INSTANCE = new NoopInstrumenter();

  private NoopInstrumenter() {}

  @Override
  public <T> T instrument(String name, Map<String, Object> payload, Function<Map<String, Object>, T> operation) {
    return operation.apply(payload);
  }
}
