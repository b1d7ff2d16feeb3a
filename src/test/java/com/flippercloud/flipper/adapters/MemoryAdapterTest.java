package com.flippercloud.flipper.adapters;

import com.flippercloud.flipper.Actor;
import com.flippercloud.flipper.BaseTest;
import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.GateValues;
import com.flippercloud.flipper.expressions.Expressions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.sdk.LDValue;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class MemoryAdapterTest extends BaseTest {
  private final MemoryAdapter adapter = new MemoryAdapter(testLogger);
  private final Feature feature = new Feature("search", adapter);

  @Test
  public void name() {
    assertEquals("memory", adapter.getName());
    assertFalse(adapter.isReadOnly());
  }

  @Test
  public void unknownFeatureHasEmptyRecord() {
    assertTrue(adapter.get(feature).isEmpty());
    assertEquals(ImmutableSet.of(), adapter.features());
  }

  @Test
  public void addIsIdempotent() {
    assertTrue(adapter.add(feature));
    assertFalse(adapter.add(feature));
    assertEquals(ImmutableSet.of("search"), adapter.features());
  }

  @Test
  public void storesGateValuesInStorageForm() {
    feature.enable();
    feature.enableActor(Actor.of("User;1"));
    feature.enableActor(Actor.of("User;2"));
    feature.enableGroup("admins");
    feature.enablePercentageOfActors(25);
    feature.enablePercentageOfTime(12.5);
    feature.enableExpression(Expressions.bool(true));

    Map<String, Object> record = adapter.get(feature);
    assertEquals("true", record.get("boolean"));
    assertEquals(ImmutableSet.of("User;1", "User;2"), record.get("actors"));
    assertEquals(ImmutableSet.of("admins"), record.get("groups"));
    assertEquals("25", record.get("percentageOfActors"));
    assertEquals("12.5", record.get("percentageOfTime"));
    assertEquals(LDValue.parse("{\"Boolean\":true}"), record.get("expression"));
  }

  @Test
  public void disableSetMemberRemovesOnlyThatMember() {
    feature.enableActor(Actor.of("User;1"));
    feature.enableActor(Actor.of("User;2"));
    feature.disableActor(Actor.of("User;1"));
    assertEquals(ImmutableSet.of("User;2"), feature.actorsValue());
    feature.disableActor(Actor.of("User;2"));
    assertNull(adapter.get(feature).get("actors"));
  }

  @Test
  public void disableNumberWritesZero() {
    feature.enablePercentageOfActors(25);
    feature.disablePercentageOfActors();
    assertEquals("0", adapter.get(feature).get("percentageOfActors"));
  }

  @Test
  public void disableBooleanClearsRecord() {
    feature.enableActor(Actor.of("User;1"));
    feature.enablePercentageOfTime(10);
    feature.disable();
    assertTrue(adapter.get(feature).isEmpty());
    assertTrue(adapter.features().contains("search"));
  }

  @Test
  public void removeDeletesKeyAndRecord() {
    feature.enable();
    adapter.remove(feature);
    assertEquals(ImmutableSet.of(), adapter.features());
    assertTrue(adapter.get(feature).isEmpty());
  }

  @Test
  public void clearKeepsKey() {
    feature.enable();
    adapter.clear(feature);
    assertEquals(ImmutableSet.of("search"), adapter.features());
    assertEquals(GateValues.empty(), feature.gateValues());
  }

  @Test
  public void getMultiAndGetAll() {
    Feature stats = new Feature("stats", adapter);
    feature.enable();
    stats.add();

    Map<String, Map<String, Object>> multi = adapter.getMulti(ImmutableList.of(feature, stats, new Feature("missing", adapter)));
    assertEquals(3, multi.size());
    assertEquals("true", multi.get("search").get("boolean"));
    assertTrue(multi.get("missing").isEmpty());

    Map<String, Map<String, Object>> all = adapter.getAll();
    assertEquals(ImmutableSet.of("search", "stats"), all.keySet());
    assertTrue(all.get("stats").isEmpty());
  }

  @Test
  public void recordsAreCopiesOfStoredState() {
    feature.enable();
    Map<String, Object> record = adapter.get(feature);
    record.clear();
    assertEquals("true", adapter.get(feature).get("boolean"));
  }
}
