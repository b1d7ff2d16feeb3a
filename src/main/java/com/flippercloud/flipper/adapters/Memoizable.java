package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.subsystems.Adapter;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.UncheckedExecutionException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Caches reads while memoization is turned on.
 * <p>
 * Loads go through a Guava cache, so concurrent callers asking for the same key before the first
 * load finishes all wait for that one load, and a load that fails is not cached.
 * <p>
 * Every write expires the entries it may have changed before it returns. Each entry remembers when
 * its load started, and an entry whose load started before the latest expiry of its key is never
 * served; this covers a write that completes while a read of the same feature is still in flight.
 * Memoization is off by default; turning it off discards the whole cache.
 */
public final class Memoizable extends ForwardingAdapter {
  static final String FEATURES_KEY = "flipper_features";
  static final String GET_ALL_KEY = "all_memoized";

  /**
   * The storage behind a {@link Memoizable}. One cache can be shared by several instances, for
   * instance by every adapter used while handling one request.
   */
  public static final class Cache {
    private final com.google.common.cache.Cache<String, Entry> entries = CacheBuilder.newBuilder().build();
    private final AtomicLong clock = new AtomicLong();
    private final ConcurrentMap<String, Long> expiredAt = new ConcurrentHashMap<>();
    private volatile long clearedAt;

    public Cache() {}

    public void clear() {
      clearedAt = clock.incrementAndGet();
      entries.invalidateAll();
    }

    public int size() {
      return (int)entries.size();
    }

    public boolean containsKey(String key) {
      return current(key) != null;
    }

    long stamp() {
      return clock.get();
    }

    void expire(String key) {
      expiredAt.put(key, clock.incrementAndGet());
      entries.invalidate(key);
    }

    boolean isCurrent(String key, Entry entry) {
      if (entry.stamp < clearedAt) {
        return false;
      }
      Long expired = expiredAt.get(key);
      return expired == null || expired <= entry.stamp;
    }

    Entry current(String key) {
      Entry entry = entries.getIfPresent(key);
      return entry != null && isCurrent(key, entry) ? entry : null;
    }

    void store(String key, long stamp, Object value) {
      Entry entry = new Entry(stamp, value);
      entries.put(key, entry);
      if (!isCurrent(key, entry)) {
        entries.asMap().remove(key, entry);
      }
    }

    Entry load(String key, Supplier<?> loader) {
      while (true) {
        Entry entry;
        try {
          entry = entries.get(key, () -> {
            long stamp = stamp();
            return new Entry(stamp, loader.get());
          });
        } catch (ExecutionException | UncheckedExecutionException e) {
          throw getAsRuntimeException(e);
        }
        if (isCurrent(key, entry)) {
          return entry;
        }
        entries.asMap().remove(key, entry);
      }
    }
  }

  private static final class Entry {
    final long stamp;
    final Object value;

    Entry(long stamp, Object value) {
      this.stamp = stamp;
      this.value = value;
    }
  }

  private final Adapter adapter;
  private final Cache cache;
  private volatile boolean memoize;

  public Memoizable(Adapter adapter) {
    this(adapter, new Cache());
  }

  /**
   * @param adapter the adapter to wrap
   * @param cache the cache to use, possibly shared with other instances
   */
  public Memoizable(Adapter adapter, Cache cache) {
    this.adapter = adapter;
    this.cache = cache;
  }

  @Override
  protected Adapter delegate() {
    return adapter;
  }

  public Cache getCache() {
    return cache;
  }

  public boolean isMemoize() {
    return memoize;
  }

  /**
   * Turns memoization on or off. Turning it off clears the cache.
   *
   * @param memoize true to cache reads
   */
  public void setMemoize(boolean memoize) {
    if (!memoize) {
      cache.clear();
    }
    this.memoize = memoize;
  }

  static String keyFor(String featureKey) {
    return "feature/" + featureKey;
  }

  private static RuntimeException getAsRuntimeException(Exception e) {
    Throwable t = e.getCause() != null ? e.getCause() : e;
    return t instanceof RuntimeException ? (RuntimeException)t : new RuntimeException(t);
  }

  @SuppressWarnings("unchecked")
  private <T> T load(String key, Supplier<T> loader) {
    return (T)cache.load(key, loader).value;
  }

  private void expire(String key) {
    if (memoize) {
      cache.expire(key);
    }
  }

  private void expireFeature(Feature feature) {
    expire(keyFor(feature.getKey()));
  }

  private void expireFeaturesSet() {
    expire(FEATURES_KEY);
    expire(GET_ALL_KEY);
  }

  @Override
  public Set<String> features() {
    if (!memoize) {
      return adapter.features();
    }
    return load(FEATURES_KEY, adapter::features);
  }

  @Override
  public Map<String, Object> get(Feature feature) {
    if (!memoize) {
      return adapter.get(feature);
    }
    return load(keyFor(feature.getKey()), () -> adapter.get(feature));
  }

  @Override
  public Map<String, Map<String, Object>> getMulti(Collection<Feature> features) {
    if (!memoize) {
      return adapter.getMulti(features);
    }
    long stamp = cache.stamp();
    List<Feature> uncached = new ArrayList<>();
    for (Feature feature: features) {
      if (!cache.containsKey(keyFor(feature.getKey()))) {
        uncached.add(feature);
      }
    }
    if (!uncached.isEmpty()) {
      for (Map.Entry<String, Map<String, Object>> e: adapter.getMulti(uncached).entrySet()) {
        cache.store(keyFor(e.getKey()), stamp, e.getValue());
      }
    }
    Map<String, Map<String, Object>> result = new LinkedHashMap<>();
    for (Feature feature: features) {
      result.put(feature.getKey(), load(keyFor(feature.getKey()), () -> adapter.get(feature)));
    }
    return result;
  }

  @Override
  public Map<String, Map<String, Object>> getAll() {
    if (!memoize) {
      return adapter.getAll();
    }
    if (cache.containsKey(GET_ALL_KEY)) {
      Map<String, Map<String, Object>> result = new LinkedHashMap<>();
      for (String featureKey: features()) {
        Feature feature = new Feature(featureKey, adapter);
        result.put(featureKey, load(keyFor(featureKey), () -> adapter.get(feature)));
      }
      return result;
    }
    long stamp = cache.stamp();
    Map<String, Map<String, Object>> response = adapter.getAll();
    for (Map.Entry<String, Map<String, Object>> e: response.entrySet()) {
      cache.store(keyFor(e.getKey()), stamp, e.getValue());
    }
    cache.store(FEATURES_KEY, stamp, ImmutableSet.copyOf(response.keySet()));
    cache.store(GET_ALL_KEY, stamp, Boolean.TRUE);
    return response;
  }

  @Override
  public boolean add(Feature feature) {
    boolean result = adapter.add(feature);
    expireFeaturesSet();
    return result;
  }

  @Override
  public boolean remove(Feature feature) {
    boolean result = adapter.remove(feature);
    expireFeaturesSet();
    expireFeature(feature);
    return result;
  }

  @Override
  public boolean clear(Feature feature) {
    boolean result = adapter.clear(feature);
    expireFeature(feature);
    return result;
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    boolean result = adapter.enable(feature, gate, thing);
    expireFeature(feature);
    return result;
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    boolean result = adapter.disable(feature, gate, thing);
    expireFeature(feature);
    return result;
  }

  @Override
  public boolean importFrom(Adapter source) {
    boolean result = adapter.importFrom(source);
    if (memoize) {
      cache.clear();
    }
    return result;
  }
}
