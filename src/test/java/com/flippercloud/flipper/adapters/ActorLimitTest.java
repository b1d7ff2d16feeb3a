package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Actor;
import com.flippercloud.flipper.BaseTest;
import com.flippercloud.flipper.Feature;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class ActorLimitTest extends BaseTest {
  private final ActorLimit adapter = new ActorLimit(new MemoryAdapter(), 3);
  private final Feature feature = new Feature("search", adapter);

  @Test
  public void defaultLimit() {
    assertEquals(100, new ActorLimit(new MemoryAdapter()).getLimit());
    assertEquals(3, adapter.getLimit());
  }

  @Test
  public void actorsUpToTheLimitAreAllowed() {
    feature.enableActor(Actor.of("1"));
    feature.enableActor(Actor.of("2"));
    feature.enableActor(Actor.of("3"));
    assertEquals(ImmutableSet.of("1", "2", "3"), feature.actorsValue());
  }

  @Test
  public void actorBeyondTheLimitIsRejected() {
    feature.enableActor(Actor.of("1"));
    feature.enableActor(Actor.of("2"));
    feature.enableActor(Actor.of("3"));
    try {
      feature.enableActor(Actor.of("4"));
      fail("expected exception");
    } catch (ActorLimitExceededException e) {
      assertEquals("search", e.getFeatureName());
      assertEquals(3, e.getLimit());
      assertEquals("Actor limit of 3 exceeded for feature search", e.getMessage());
    }
    assertEquals(3, feature.actorsValue().size());
  }

  @Test
  public void reEnablingExistingActorIsAllowed() {
    feature.enableActor(Actor.of("1"));
    feature.enableActor(Actor.of("2"));
    feature.enableActor(Actor.of("3"));
    assertTrue(feature.enableActor(Actor.of("2")));
  }

  @Test
  public void otherGatesAreNotLimited() {
    feature.enableActor(Actor.of("1"));
    feature.enableActor(Actor.of("2"));
    feature.enableActor(Actor.of("3"));
    assertTrue(feature.enable());
    assertTrue(feature.enablePercentageOfActors(50));
    assertTrue(feature.enableGroup("admins"));
  }

  @Test
  public void disablingFreesASlot() {
    feature.enableActor(Actor.of("1"));
    feature.enableActor(Actor.of("2"));
    feature.enableActor(Actor.of("3"));
    feature.disableActor(Actor.of("1"));
    feature.enableActor(Actor.of("4"));
    assertEquals(ImmutableSet.of("2", "3", "4"), feature.actorsValue());
  }
}
