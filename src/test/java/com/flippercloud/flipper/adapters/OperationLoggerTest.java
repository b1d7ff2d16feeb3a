package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Actor;
import com.flippercloud.flipper.BaseTest;
import com.flippercloud.flipper.Feature;
import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

@SuppressWarnings("javadoc")
public class OperationLoggerTest extends BaseTest {
  private final OperationLogger adapter = new OperationLogger(new MemoryAdapter());
  private final Feature feature = new Feature("search", adapter);

  @Test
  public void recordsCallsWithArguments() {
    feature.enableActor(Actor.of("User;1"));
    feature.disablePercentageOfTime();

    assertEquals(ImmutableList.of("search"), adapter.last("add").getArgs());
    assertEquals(ImmutableList.of("search", "actors", "User;1"), adapter.last("enable").getArgs());
    assertEquals(ImmutableList.of("search", "percentageOfTime", "0"), adapter.last("disable").getArgs());
    assertEquals(4, adapter.count());
    assertEquals(2, adapter.count("add"));
  }

  @Test
  public void lastReturnsNullWhenNoCall() {
    assertNull(adapter.last("enable"));
    assertEquals(0, adapter.type("enable").size());
  }

  @Test
  public void resetForgetsCalls() {
    feature.isEnabled();
    adapter.export();
    assertEquals(ImmutableList.of("json", 1), adapter.last("export").getArgs());
    adapter.reset();
    assertEquals(0, adapter.count());
  }

  @Test
  public void importLogsSourceName() {
    adapter.importFrom(new MemoryAdapter());
    assertEquals(ImmutableList.of("memory"), adapter.last("import").getArgs());
  }
}
