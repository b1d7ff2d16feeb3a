package com.flippercloud.flipper;

import com.flippercloud.flipper.adapters.ActorLimitExceededException;
import com.flippercloud.flipper.adapters.FeatureNotFoundException;
import com.flippercloud.flipper.adapters.MemoryAdapter;
import com.flippercloud.flipper.adapters.OperationLogger;
import com.flippercloud.flipper.adapters.Strict;
import com.flippercloud.flipper.expressions.Expressions;
import com.flippercloud.flipper.instrumenters.MemoryInstrumenter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.logging.LDLogLevel;
import com.launchdarkly.sdk.LDValue;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class FlipperTest extends BaseTest {
  @Test
  public void defaultsToMemoryAdapter() {
    Flipper flipper = new Flipper(baseConfig().build());
    flipper.enable("search");
    assertTrue(flipper.isFeatureEnabled("search"));
    assertFalse(flipper.isMemoizing());
    assertFalse(flipper.isReadOnly());
  }

  @Test
  public void memoizeOptionCachesReads() {
    OperationLogger operations = new OperationLogger(new MemoryAdapter());
    Flipper flipper = new Flipper(baseConfig().adapter(operations).memoize(true).build());
    assertTrue(flipper.isMemoizing());
    flipper.enable("search");
    operations.reset();

    flipper.isFeatureEnabled("search");
    flipper.isFeatureEnabled("search");
    assertEquals(1, operations.count("get"));

    flipper.setMemoize(false);
    flipper.isFeatureEnabled("search");
    flipper.isFeatureEnabled("search");
    assertEquals(3, operations.count("get"));
  }

  @Test
  public void strictRaiseRejectsUnknownFeatures() {
    Flipper flipper = new Flipper(baseConfig().strict(Strict.Mode.RAISE).build());
    try {
      flipper.isFeatureEnabled("unknown");
      fail("expected exception");
    } catch (FeatureNotFoundException e) {
      assertEquals("unknown", e.getFeatureName());
    }
    flipper.add("unknown");
    assertFalse(flipper.isFeatureEnabled("unknown"));
  }

  @Test
  public void strictWarnLogs() {
    Flipper flipper = new Flipper(baseConfig().strict(Strict.Mode.WARN).build());
    assertFalse(flipper.isFeatureEnabled("unknown"));
    assertTrue(logCapture.hasMessageMatching(LDLogLevel.WARN, ".*Could not find feature \"unknown\".*"));
  }

  @Test
  public void actorLimitIsApplied() {
    Flipper flipper = new Flipper(baseConfig().actorLimit(2).build());
    flipper.enableActor("search", Actor.of("1"));
    flipper.enableActor("search", Actor.of("2"));
    try {
      flipper.enableActor("search", Actor.of("3"));
      fail("expected exception");
    } catch (ActorLimitExceededException e) {
      assertEquals(2, e.getLimit());
    }
    assertEquals(ImmutableSet.of("1", "2"), flipper.feature("search").actorsValue());
  }

  @Test
  public void zeroActorLimitDisablesCheck() {
    Flipper flipper = new Flipper(baseConfig().actorLimit(0).build());
    for (int i = 0; i < 150; i++) {
      flipper.enableActor("search", Actor.of("User;" + i));
    }
    assertEquals(150, flipper.feature("search").actorsValue().size());
  }

  @Test
  public void instrumenterSeesFeatureAndAdapterOperations() {
    MemoryInstrumenter instrumenter = new MemoryInstrumenter();
    Flipper flipper = new Flipper(baseConfig().instrumenter(instrumenter).build());
    flipper.enable("search");

    MemoryInstrumenter.Event featureEvent = instrumenter.eventByName("feature_operation.flipper");
    assertNotNull(featureEvent);
    assertEquals("enable", featureEvent.getPayload().get("operation"));
    MemoryInstrumenter.Event adapterEvent = instrumenter.eventByName("adapter_operation.flipper");
    assertNotNull(adapterEvent);
    assertEquals("memory", adapterEvent.getPayload().get("adapter_name"));
  }

  @Test
  public void groupRegistration() {
    Flipper flipper = new Flipper(baseConfig().build());
    flipper.register("admins", actor -> actor.getFlipperId().startsWith("admin"));
    assertTrue(flipper.groupExists("admins"));
    assertEquals(ImmutableSet.of("admins"), flipper.groupNames());

    flipper.enableGroup("search", "admins");
    assertTrue(flipper.isFeatureEnabled("search", Actor.of("admin-1")));
    assertFalse(flipper.isFeatureEnabled("search", Actor.of("user-1")));

    flipper.unregisterGroups();
    assertFalse(flipper.groupExists("admins"));
    assertFalse(flipper.isFeatureEnabled("search", Actor.of("admin-1")));
    assertEquals(ImmutableSet.of("admins"), flipper.feature("search").groupsValue());
  }

  @Test
  public void expressionShortcuts() {
    Flipper flipper = new Flipper(baseConfig().build());
    flipper.enableExpression("search", Flipper.all(
        Expressions.equal(Flipper.property("plan"), "basic"),
        Flipper.not(Flipper.bool(Flipper.property("banned")))));

    Actor basic = Actor.of("User;1", ImmutableMap.of("plan", LDValue.of("basic")));
    Actor banned = Actor.of("User;2", ImmutableMap.of("plan", LDValue.of("basic"), "banned", LDValue.of(true)));
    Actor premium = Actor.of("User;3", ImmutableMap.of("plan", LDValue.of("premium")));
    assertTrue(flipper.isFeatureEnabled("search", basic));
    assertFalse(flipper.isFeatureEnabled("search", banned));
    assertFalse(flipper.isFeatureEnabled("search", premium));
  }

  @Test
  public void buildFromJson() {
    assertEquals(Flipper.property("plan"), Flipper.build(LDValue.parse("{\"Property\":\"plan\"}")));
    assertEquals(Flipper.duration(2, "day").value(), Expressions.duration(2, "day").value());
    assertEquals(Flipper.duration(5), Expressions.duration(5, "second"));
  }
}
