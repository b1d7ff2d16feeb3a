package com.flippercloud.flipper.adapters.sync;

import com.flippercloud.flipper.Actor;
import com.flippercloud.flipper.BaseTest;
import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.GroupRegistry;
import com.flippercloud.flipper.adapters.MemoryAdapter;
import com.flippercloud.flipper.adapters.OperationLogger;
import com.flippercloud.flipper.instrumenters.MemoryInstrumenter;
import com.flippercloud.flipper.subsystems.Adapter;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.logging.LDLogLevel;

import org.easymock.EasyMockSupport;
import org.junit.Test;

import static org.easymock.EasyMock.expect;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class SynchronizerTest extends BaseTest {
  private final EasyMockSupport mocks = new EasyMockSupport();
  private final MemoryAdapter localMemory = new MemoryAdapter();
  private final OperationLogger local = new OperationLogger(localMemory);
  private final MemoryAdapter remote = new MemoryAdapter();
  private final MemoryInstrumenter instrumenter = new MemoryInstrumenter();

  private Synchronizer synchronizer(Adapter source, boolean raise) {
    return new Synchronizer(local, source, instrumenter, new GroupRegistry(), testLogger, raise);
  }

  @Test
  public void convergesFeatureSets() {
    new Feature("a", localMemory).enable();
    new Feature("b", localMemory).enable();
    new Feature("a", remote).enable();
    new Feature("c", remote).enableActor(Actor.of("User;1"));

    assertTrue(synchronizer(remote, true).call());

    assertEquals(ImmutableSet.of("a", "c"), localMemory.features());
    assertEquals(remote.getAll(), localMemory.getAll());
    for (OperationLogger.Operation op: local.type("enable")) {
      assertEquals("c", op.getArgs().get(0));
    }
    assertEquals(0, local.count("disable"));
    assertEquals("b", local.last("remove").getArgs().get(0));
  }

  @Test
  public void identicalAdaptersProduceNoWrites() {
    new Feature("a", localMemory).enablePercentageOfActors(10);
    new Feature("a", remote).enablePercentageOfActors(10);

    synchronizer(remote, true).call();
    assertEquals(1, local.count());
    assertEquals(1, local.count("getAll"));
  }

  @Test
  public void emptyRemoteFeatureIsAdded() {
    new Feature("a", remote).add();
    synchronizer(remote, true).call();
    assertEquals(ImmutableSet.of("a"), localMemory.features());
  }

  @Test
  public void callIsInstrumented() {
    synchronizer(remote, true).call();
    MemoryInstrumenter.Event event = instrumenter.eventByName(Synchronizer.CALL_EVENT);
    assertNotNull(event);
    assertEquals(true, event.getResult());
  }

  @Test
  public void failureIsRethrownWhenRaising() {
    IllegalStateException error = new IllegalStateException("remote down");
    Adapter broken = brokenAdapter(error);
    try {
      synchronizer(broken, true).call();
      fail("expected exception");
    } catch (IllegalStateException e) {
      assertSame(error, e);
    }
    assertSame(error, instrumenter.eventByName(Synchronizer.EXCEPTION_EVENT).getPayload().get("exception"));
  }

  @Test
  public void failureReturnsFalseWhenNotRaising() {
    IllegalStateException error = new IllegalStateException("remote down");
    Adapter broken = brokenAdapter(error);
    assertFalse(synchronizer(broken, false).call());
    assertSame(error, instrumenter.eventByName(Synchronizer.EXCEPTION_EVENT).getPayload().get("exception"));
    assertTrue(logCapture.hasMessageMatching(LDLogLevel.ERROR, ".*Synchronizing \"memory\" from \"broken\" failed.*"));
  }

  private Adapter brokenAdapter(RuntimeException error) {
    Adapter broken = mocks.niceMock(Adapter.class);
    expect(broken.getName()).andReturn("broken").anyTimes();
    expect(broken.getAll()).andThrow(error);
    mocks.replayAll();
    return broken;
  }
}
