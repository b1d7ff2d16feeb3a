package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.export.Export;
import com.flippercloud.flipper.subsystems.Adapter;
import com.google.common.collect.ForwardingObject;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * An adapter that forwards every call to another adapter. Decorators override only the methods whose
 * behavior they change.
 */
public abstract class ForwardingAdapter extends ForwardingObject implements Adapter {
  /**
   * Constructor for use by subclasses.
   */
  protected ForwardingAdapter() {}

  @Override
  protected abstract Adapter delegate();

  @Override
  public String getName() {
    return delegate().getName();
  }

  @Override
  public Set<String> features() {
    return delegate().features();
  }

  @Override
  public boolean add(Feature feature) {
    return delegate().add(feature);
  }

  @Override
  public boolean remove(Feature feature) {
    return delegate().remove(feature);
  }

  @Override
  public boolean clear(Feature feature) {
    return delegate().clear(feature);
  }

  @Override
  public Map<String, Object> get(Feature feature) {
    return delegate().get(feature);
  }

  @Override
  public Map<String, Map<String, Object>> getMulti(Collection<Feature> features) {
    return delegate().getMulti(features);
  }

  @Override
  public Map<String, Map<String, Object>> getAll() {
    return delegate().getAll();
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    return delegate().enable(feature, gate, thing);
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    return delegate().disable(feature, gate, thing);
  }

  @Override
  public boolean isReadOnly() {
    return delegate().isReadOnly();
  }

  @Override
  public Export export(String format, int version) {
    return delegate().export(format, version);
  }

  @Override
  public boolean importFrom(Adapter source) {
    return delegate().importFrom(source);
  }
}
