package com.flippercloud.flipper.adapters.sync;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.GateValues;
import com.flippercloud.flipper.GroupRegistry;
import com.flippercloud.flipper.instrumenters.NoopInstrumenter;
import com.flippercloud.flipper.subsystems.Adapter;
import com.flippercloud.flipper.subsystems.Instrumenter;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.LogValues;

import java.util.HashMap;
import java.util.Map;

/**
 * Makes a local adapter match a remote source: every remote feature is reconciled with
 * {@link FeatureSynchronizer}, features missing locally are added, and features missing remotely are
 * removed.
 * <p>
 * The whole run is reported as a {@code synchronizer_call.flipper} event. A failure is reported as
 * {@code synchronizer_exception.flipper}, logged, and then either rethrown or turned into a
 * {@code false} result.
 */
public final class Synchronizer {
  public static final String CALL_EVENT = "synchronizer_call.flipper";
  public static final String EXCEPTION_EVENT = "synchronizer_exception.flipper";

  private final Adapter local;
  private final Adapter remote;
  private final Instrumenter instrumenter;
  private final GroupRegistry groups;
  private final LDLogger logger;
  private final boolean raise;

  /**
   * Creates an instance with no instrumentation.
   *
   * @param local the adapter to write to
   * @param remote the adapter to read from
   * @param logger receives failures
   * @param raise true to rethrow failures, false to return false instead
   */
  public Synchronizer(Adapter local, Adapter remote, LDLogger logger, boolean raise) {
    this(local, remote, NoopInstrumenter.INSTANCE, new GroupRegistry(), logger, raise);
  }

  /**
   * Creates an instance.
   *
   * @param local the adapter to write to
   * @param remote the adapter to read from
   * @param instrumenter receives the synchronizer events
   * @param groups the groups the local features are built with
   * @param logger receives failures
   * @param raise true to rethrow failures, false to return false instead
   */
  public Synchronizer(Adapter local, Adapter remote, Instrumenter instrumenter, GroupRegistry groups,
      LDLogger logger, boolean raise) {
    this.local = local;
    this.remote = remote;
    this.instrumenter = instrumenter;
    this.groups = groups;
    this.logger = logger == null ? LDLogger.none() : logger;
    this.raise = raise;
  }

  /**
   * Runs the synchronization.
   *
   * @return true on success; false on failure if not raising
   */
  public boolean call() {
    return instrumenter.instrument(CALL_EVENT, new HashMap<>(), payload -> {
      try {
        sync();
        return true;
      } catch (RuntimeException e) {
        Map<String, Object> exceptionPayload = new HashMap<>();
        exceptionPayload.put("exception", e);
        instrumenter.instrument(EXCEPTION_EVENT, exceptionPayload, p -> null);
        logger.error("Synchronizing \"{}\" from \"{}\" failed: {}", local.getName(), remote.getName(),
            LogValues.exceptionSummary(e));
        logger.debug("{}", LogValues.exceptionTrace(e));
        if (raise) {
          throw e;
        }
        return false;
      }
    });
  }

  private void sync() {
    Map<String, Map<String, Object>> localAll = local.getAll();
    Map<String, Map<String, Object>> remoteAll = remote.getAll();

    for (Map.Entry<String, Map<String, Object>> e: remoteAll.entrySet()) {
      Feature feature = feature(e.getKey());
      Map<String, Object> localRecord = localAll.get(e.getKey());
      GateValues localValues = localRecord == null ? GateValues.empty() : new GateValues(localRecord);
      new FeatureSynchronizer(feature, localValues, new GateValues(e.getValue())).call();
    }

    for (String key: remoteAll.keySet()) {
      if (!localAll.containsKey(key)) {
        feature(key).add();
      }
    }

    for (String key: localAll.keySet()) {
      if (!remoteAll.containsKey(key)) {
        feature(key).remove();
      }
    }
  }

  private Feature feature(String key) {
    return new Feature(key, local, groups, null, logger);
  }
}
