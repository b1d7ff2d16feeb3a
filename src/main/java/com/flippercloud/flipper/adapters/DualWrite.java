package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.subsystems.Adapter;

/**
 * Reads from a local adapter and writes to a remote adapter first, then to the local one.
 * <p>
 * Writes return the remote result. If the local write fails after the remote one succeeded, the two
 * adapters are left diverged.
 */
public final class DualWrite extends ForwardingAdapter {
  private final Adapter local;
  private final Adapter remote;

  /**
   * @param local serves every read
   * @param remote receives every write first
   */
  public DualWrite(Adapter local, Adapter remote) {
    this.local = local;
    this.remote = remote;
  }

  @Override
  protected Adapter delegate() {
    return local;
  }

  @Override
  public String getName() {
    return "dual_write";
  }

  @Override
  public boolean add(Feature feature) {
    boolean result = remote.add(feature);
    local.add(feature);
    return result;
  }

  @Override
  public boolean remove(Feature feature) {
    boolean result = remote.remove(feature);
    local.remove(feature);
    return result;
  }

  @Override
  public boolean clear(Feature feature) {
    boolean result = remote.clear(feature);
    local.clear(feature);
    return result;
  }

  @Override
  public boolean enable(Feature feature, Gate gate, TypedValue thing) {
    boolean result = remote.enable(feature, gate, thing);
    local.enable(feature, gate, thing);
    return result;
  }

  @Override
  public boolean disable(Feature feature, Gate gate, TypedValue thing) {
    boolean result = remote.disable(feature, gate, thing);
    local.disable(feature, gate, thing);
    return result;
  }

  @Override
  public boolean importFrom(Adapter source) {
    boolean result = remote.importFrom(source);
    local.importFrom(source);
    return result;
  }
}
