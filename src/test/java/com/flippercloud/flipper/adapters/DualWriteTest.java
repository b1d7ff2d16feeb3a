package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Actor;
import com.flippercloud.flipper.BaseTest;
import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.Gate;
import com.flippercloud.flipper.TypedValue;
import com.flippercloud.flipper.subsystems.Adapter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class DualWriteTest extends BaseTest {
  private final OperationLogger local = new OperationLogger(new MemoryAdapter());
  private final OperationLogger remote = new OperationLogger(new MemoryAdapter());
  private final DualWrite adapter = new DualWrite(local, remote);
  private final Feature feature = new Feature("search", adapter);

  @Test
  public void name() {
    assertEquals("dual_write", adapter.getName());
  }

  @Test
  public void readsComeFromLocal() {
    new Feature("search", remote).enable();
    assertFalse(feature.isEnabled());
    assertEquals(1, local.count("get"));
    assertEquals(0, remote.count("get"));
  }

  @Test
  public void writesGoToBoth() {
    feature.enableActor(Actor.of("User;1"));
    assertTrue(new Feature("search", local).isEnabled(Actor.of("User;1")));
    assertTrue(new Feature("search", remote).isEnabled(Actor.of("User;1")));

    feature.remove();
    assertEquals(ImmutableSet.of(), local.features());
    assertEquals(ImmutableSet.of(), remote.features());
  }

  @Test
  public void remoteIsWrittenFirst() {
    List<String> order = new ArrayList<>();
    DualWrite ordered = new DualWrite(recording("local", order), recording("remote", order));
    Feature other = new Feature("search", ordered);
    other.enable();
    assertEquals(ImmutableList.of("remote:add", "local:add", "remote:enable", "local:enable"), order);
  }

  @Test
  public void resultComesFromRemote() {
    new Feature("search", remote).add();
    assertFalse(adapter.add(feature));
    assertTrue(local.features().contains("search"));
  }

  private static Adapter recording(String name, List<String> order) {
    MemoryAdapter memory = new MemoryAdapter();
    return new ForwardingAdapter() {
      @Override
      protected Adapter delegate() {
        return memory;
      }

      @Override
      public boolean add(Feature feature) {
        order.add(name + ":add");
        return super.add(feature);
      }

      @Override
      public boolean enable(Feature feature, Gate gate, TypedValue thing) {
        order.add(name + ":enable");
        return super.enable(feature, gate, thing);
      }
    };
  }
}
