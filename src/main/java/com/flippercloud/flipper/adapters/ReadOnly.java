package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.subsystems.Adapter;

/**
 * Refuses every write with a {@link WriteAttemptedException}; reads pass through.
 */
public final class ReadOnly extends ForwardingAdapter {
  private final Adapter adapter;

  public ReadOnly(Adapter adapter) {
    this.adapter = adapter;
  }

  @Override
  protected Adapter delegate() {
    return adapter;
  }

  @Override
  public boolean isReadOnly() {
    return true;
  }

  @Override
  public boolean add(Feature feature) {
    throw new WriteAttemptedException();
  }

  @Override
  public boolean remove(Feature feature) {
    throw new WriteAttemptedException();
  }

  @Override
  public boolean clear(Feature feature) {
    throw new WriteAttemptedException();
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    throw new WriteAttemptedException();
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    throw new WriteAttemptedException();
  }

  @Override
  public boolean importFrom(Adapter source) {
    throw new WriteAttemptedException();
  }
}
