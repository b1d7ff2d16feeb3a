package com.flippercloud.flipper;

import com.flippercloud.flipper.adapters.ActorLimit;
import com.flippercloud.flipper.adapters.Instrumented;
import com.flippercloud.flipper.adapters.Memoizable;
import com.flippercloud.flipper.adapters.MemoryAdapter;
import com.flippercloud.flipper.adapters.Strict;
import com.flippercloud.flipper.expressions.Expression;
import com.flippercloud.flipper.expressions.Expressions;
import com.flippercloud.flipper.subsystems.Adapter;
import com.launchdarkly.logging.LDLogger;
import com.launchdarkly.logging.Logs;
import com.launchdarkly.sdk.LDValue;

import java.util.Set;

/**
 * The main entry point: a {@link Dsl} over a configured adapter chain.
 * <p>
 * The adapter from {@link FlipperConfig} is wrapped, innermost first, in {@link Instrumented} (when an
 * instrumenter is configured), {@link ActorLimit} (when the limit is positive), {@link Strict} (unless
 * the mode is {@link Strict.Mode#NOOP}) and {@link Memoizable}.
 * <pre>
 * Flipper flipper = new Flipper(new FlipperConfig.Builder().build());
 * flipper.enableActor("search", Actor.of("User;42"));
 * if (flipper.isFeatureEnabled("search", currentUser)) { ... }
 * </pre>
 */
public class Flipper extends Dsl {
  private final Memoizable memoizable;
  private final LDLogger baseLogger;

  /**
   * Creates an instance from a configuration.
   *
   * @param config the configuration
   */
  public Flipper(FlipperConfig config) {
    this(config, baseLoggerFor(config));
  }

  /**
   * Creates an instance over an adapter with default settings.
   *
   * @param adapter the storage adapter
   */
  public Flipper(Adapter adapter) {
    this(new FlipperConfig.Builder().adapter(adapter).build());
  }

  private Flipper(FlipperConfig config, LDLogger baseLogger) {
    this(config, baseLogger, buildChain(config, baseLogger));
  }

  private Flipper(FlipperConfig config, LDLogger baseLogger, Memoizable memoizable) {
    super(memoizable, new GroupRegistry(), config.instrumenter,
        baseLogger.subLogger(Loggers.EVALUATION_LOGGER_NAME));
    this.memoizable = memoizable;
    this.baseLogger = baseLogger;
  }

  private static LDLogger baseLoggerFor(FlipperConfig config) {
    return LDLogger.withAdapter(Logs.level(config.logAdapter, config.logLevel), config.loggerName);
  }

  private static Memoizable buildChain(FlipperConfig config, LDLogger baseLogger) {
    Adapter adapter = config.adapter != null ? config.adapter :
        new MemoryAdapter(baseLogger.subLogger(Loggers.SYNC_LOGGER_NAME));
    if (config.instrumenter != null) {
      adapter = new Instrumented(adapter, config.instrumenter);
    }
    if (config.actorLimit > 0) {
      adapter = new ActorLimit(adapter, config.actorLimit);
    }
    if (config.strict != Strict.Mode.NOOP) {
      adapter = new Strict(adapter, config.strict, baseLogger.subLogger(Loggers.ADAPTER_LOGGER_NAME));
    }
    Memoizable memoizable = new Memoizable(adapter);
    memoizable.setMemoize(config.memoize);
    return memoizable;
  }

  /**
   * Turns memoization of adapter reads on or off. Turning it off discards everything cached.
   *
   * @param memoize true to memoize
   */
  public void setMemoize(boolean memoize) {
    memoizable.setMemoize(memoize);
  }

  public boolean isMemoizing() {
    return memoizable.isMemoize();
  }

  /**
   * Returns the logger this instance was configured with.
   *
   * @return the base logger
   */
  public LDLogger getLogger() {
    return baseLogger;
  }

  public Set<String> groupNames() {
    return getGroups().names();
  }

  public boolean groupExists(String groupName) {
    return getGroups().contains(groupName);
  }

  /**
   * Removes every registered group. Stored group names stay enabled but no longer match anyone.
   */
  public void unregisterGroups() {
    getGroups().clear();
  }

  /**
   * Builds an expression from its JSON form.
   *
   * @param json e.g. {@code {"Equal": [{"Property": "plan"}, "basic"]}}
   * @return the expression
   */
  public static Expression build(LDValue json) {
    return Expressions.build(json);
  }

  public static Expression constant(Object value) {
    return Expressions.constant(value);
  }

  public static Expression property(String name) {
    return Expressions.property(name);
  }

  public static Expression any(Object... args) {
    return Expressions.any(args);
  }

  public static Expression all(Object... args) {
    return Expressions.all(args);
  }

  public static Expression not(Object arg) {
    return Expressions.not(arg);
  }

  public static Expression string(Object value) {
    return Expressions.string(value);
  }

  public static Expression number(Object value) {
    return Expressions.number(value);
  }

  public static Expression bool(Object value) {
    return Expressions.bool(value);
  }

  public static Expression random(double max) {
    return Expressions.random(max);
  }

  public static Expression now() {
    return Expressions.now();
  }

  public static Expression time(String timestamp) {
    return Expressions.time(timestamp);
  }

  /**
   * Builds a duration in seconds.
   *
   * @param scalar the amount
   * @param unit e.g. {@code "second"}, {@code "day"}, {@code "week"}
   * @return the expression
   */
  public static Expression duration(double scalar, String unit) {
    return Expressions.duration(scalar, unit);
  }

  public static Expression duration(double scalar) {
    return Expressions.duration(scalar, "second");
  }
}
