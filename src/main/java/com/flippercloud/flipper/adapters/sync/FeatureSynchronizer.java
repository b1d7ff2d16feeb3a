package com.flippercloud.flipper.adapters.sync;

import com.flippercloud.flipper.Actor;
import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.GateValues;
import com.flippercloud.flipper.expressions.Expressions;
import com.google.common.collect.Sets;
import com.launchdarkly.sdk.LDValue;

import java.util.Objects;
import java.util.Set;

/**
 * Brings one local feature in line with its remote state, gate by gate, with as few writes as
 * possible. Gates that already match are not touched, and set members present on both sides are
 * left alone.
 */
public final class FeatureSynchronizer {
  private final Feature feature;
  private final GateValues remote;
  private GateValues local;

  /**
   * @param feature the local feature to write to
   * @param local the feature's current local values
   * @param remote the values to converge on
   */
  public FeatureSynchronizer(Feature feature, GateValues local, GateValues remote) {
    this.feature = feature;
    this.local = local;
    this.remote = remote;
  }

  public void call() {
    if (local.equals(remote)) {
      return;
    }
    syncBoolean();
    syncActors();
    syncGroups();
    syncPercentageOfActors();
    syncPercentageOfTime();
    syncExpression();
  }

  private void syncBoolean() {
    if (local.getBoolean() == remote.getBoolean()) {
      return;
    }
    if (remote.getBoolean()) {
      feature.enable();
    } else {
      // Disabling the boolean gate clears every other gate as well.
      feature.disable();
      local = GateValues.empty();
    }
  }

  private void syncActors() {
    Set<String> localActors = local.getActors();
    Set<String> remoteActors = remote.getActors();
    for (String id: Sets.difference(localActors, remoteActors)) {
      feature.disableActor(Actor.of(id));
    }
    for (String id: Sets.difference(remoteActors, localActors)) {
      feature.enableActor(Actor.of(id));
    }
  }

  private void syncGroups() {
    Set<String> localGroups = local.getGroups();
    Set<String> remoteGroups = remote.getGroups();
    for (String name: Sets.difference(localGroups, remoteGroups)) {
      feature.disableGroup(name);
    }
    for (String name: Sets.difference(remoteGroups, localGroups)) {
      feature.enableGroup(name);
    }
  }

  private void syncPercentageOfActors() {
    double remoteValue = remote.getPercentageOfActors();
    if (Double.compare(local.getPercentageOfActors(), remoteValue) == 0) {
      return;
    }
    if (remoteValue == 0) {
      feature.disablePercentageOfActors();
    } else {
      feature.enablePercentageOfActors(remoteValue);
    }
  }

  private void syncPercentageOfTime() {
    double remoteValue = remote.getPercentageOfTime();
    if (Double.compare(local.getPercentageOfTime(), remoteValue) == 0) {
      return;
    }
    if (remoteValue == 0) {
      feature.disablePercentageOfTime();
    } else {
      feature.enablePercentageOfTime(remoteValue);
    }
  }

  private void syncExpression() {
    LDValue remoteValue = remote.getExpression();
    if (Objects.equals(local.getExpression(), remoteValue)) {
      return;
    }
    if (remoteValue == null) {
      feature.disableExpression();
    } else {
      feature.enableExpression(Expressions.build(remoteValue));
    }
  }
}
