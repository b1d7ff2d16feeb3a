package com.flippercloud.flipper;

import com.flippercloud.flipper.adapters.ActorLimit;
import com.flippercloud.flipper.adapters.Strict;
import com.flippercloud.flipper.subsystems.Adapter;
import com.flippercloud.flipper.subsystems.Instrumenter;
import com.launchdarkly.logging.LDLogAdapter;
import com.launchdarkly.logging.LDLogLevel;

/**
 * Configuration options for a {@link Flipper} instance. Instances of this class must be constructed with
 * a {@link FlipperConfig.Builder}.
 */
public final class FlipperConfig {
  final Adapter adapter;
  final Instrumenter instrumenter;
  final LDLogAdapter logAdapter;
  final LDLogLevel logLevel;
  final String loggerName;
  final Strict.Mode strict;
  final int actorLimit;
  final boolean memoize;

  FlipperConfig(Builder builder) {
    this.adapter = builder.adapter;
    this.instrumenter = builder.instrumenter;
    this.logAdapter = builder.logAdapter == null ? Components.defaultLogAdapter() : builder.logAdapter;
    this.logLevel = builder.logLevel;
    this.loggerName = builder.loggerName == null ? Loggers.BASE_LOGGER_NAME : builder.loggerName;
    this.strict = builder.strict;
    this.actorLimit = builder.actorLimit;
    this.memoize = builder.memoize;
  }

  /**
   * @return the storage adapter, or null if {@link Flipper} should create a memory adapter
   */
  public Adapter getAdapter() {
    return adapter;
  }

  /**
   * @return the instrumenter, or null if adapter operations are not instrumented
   */
  public Instrumenter getInstrumenter() {
    return instrumenter;
  }

  public LDLogAdapter getLogAdapter() {
    return logAdapter;
  }

  public Strict.Mode getStrict() {
    return strict;
  }

  public int getActorLimit() {
    return actorLimit;
  }

  public boolean isMemoize() {
    return memoize;
  }

  /**
   * A <a href="http://en.wikipedia.org/wiki/Builder_pattern">builder</a> for {@link FlipperConfig}.
   * Builder calls can be chained:
   * <pre>
   * FlipperConfig config = new FlipperConfig.Builder()
   *      .adapter(myAdapter)
   *      .strict(Strict.Mode.WARN)
   *      .memoize(true)
   *      .build();
   * </pre>
   */
  public static class Builder {
    private Adapter adapter = null;
    private Instrumenter instrumenter = null;
    private LDLogAdapter logAdapter = null;
    private LDLogLevel logLevel = LDLogLevel.INFO;
    private String loggerName = null;
    private Strict.Mode strict = Strict.Mode.NOOP;
    private int actorLimit = ActorLimit.DEFAULT_LIMIT;
    private boolean memoize = false;

    /**
     * Creates a builder with all configuration parameters set to the default.
     */
    public Builder() {
    }

    /**
     * Sets the storage adapter. The default is a new {@link com.flippercloud.flipper.adapters.MemoryAdapter}.
     *
     * @param adapter the adapter
     * @return the builder
     */
    public Builder adapter(Adapter adapter) {
      this.adapter = adapter;
      return this;
    }

    /**
     * Sets an instrumenter. When set, it receives feature operation events and every adapter call is
     * wrapped in {@link com.flippercloud.flipper.adapters.Instrumented}.
     *
     * @param instrumenter the instrumenter, or null for none
     * @return the builder
     */
    public Builder instrumenter(Instrumenter instrumenter) {
      this.instrumenter = instrumenter;
      return this;
    }

    /**
     * Sets the logging implementation, such as {@code Logs.toConsole()} or {@code LDSLF4J.adapter()}.
     * The default is SLF4J if it is on the classpath, otherwise the console.
     *
     * @param logAdapter the log adapter
     * @return the builder
     */
    public Builder logging(LDLogAdapter logAdapter) {
      this.logAdapter = logAdapter;
      return this;
    }

    /**
     * Sets the minimum log level for adapters that do not have their own configuration. The default
     * is {@link LDLogLevel#INFO}.
     *
     * @param logLevel the level
     * @return the builder
     */
    public Builder logLevel(LDLogLevel logLevel) {
      this.logLevel = logLevel == null ? LDLogLevel.INFO : logLevel;
      return this;
    }

    /**
     * Overrides the base logger name.
     *
     * @param loggerName the name
     * @return the builder
     */
    public Builder loggerName(String loggerName) {
      this.loggerName = loggerName;
      return this;
    }

    /**
     * Sets what happens when an unknown feature is read. The default, {@link Strict.Mode#NOOP}, adds no
     * checking at all.
     *
     * @param strict the mode
     * @return the builder
     */
    public Builder strict(Strict.Mode strict) {
      this.strict = strict == null ? Strict.Mode.NOOP : strict;
      return this;
    }

    /**
     * Sets the maximum number of actors that can be individually enabled per feature. Zero or less
     * disables the limit. The default is {@value ActorLimit#DEFAULT_LIMIT}.
     *
     * @param actorLimit the limit
     * @return the builder
     */
    public Builder actorLimit(int actorLimit) {
      this.actorLimit = actorLimit;
      return this;
    }

    /**
     * Sets whether adapter reads are memoized from the start. Memoization can also be turned on and
     * off later with {@link Flipper#setMemoize(boolean)}.
     *
     * @param memoize true to memoize
     * @return the builder
     */
    public Builder memoize(boolean memoize) {
      this.memoize = memoize;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration
     */
    public FlipperConfig build() {
      return new FlipperConfig(this);
    }
  }
}
