package com.flippercloud.flipper.subsystems;

import java.util.Map;
import java.util.function.Function;

/**
 * Receives an event for every feature, adapter and synchronizer operation.
 * <p>
 * An implementation must run the operation exactly once and return its result. It may add entries to
 * the payload (such as {@code result} or {@code exception}), and it must rethrow any exception the
 * operation throws after recording it.
 */
public interface Instrumenter {
  /**
   * Runs an operation inside an instrumentation event.
   *
   * @param <T> the result type
   * @param name the event name, e.g. {@code "feature_operation.flipper"}
   * @param payload the mutable event payload
   * @param operation the operation, which may add entries to the payload
   * @return the operation's result
   */
  <T> T instrument(String name, Map<String, Object> payload, Function<Map<String, Object>, T> operation);
}
