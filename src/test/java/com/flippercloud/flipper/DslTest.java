package com.flippercloud.flipper;

import com.flippercloud.flipper.adapters.MemoryAdapter;
import com.flippercloud.flipper.adapters.OperationLogger;
import com.flippercloud.flipper.export.Export;
import com.flippercloud.flipper.expressions.Expressions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

@SuppressWarnings("javadoc")
public class DslTest extends BaseTest {
  private final OperationLogger adapter = new OperationLogger(new MemoryAdapter());
  private final Dsl dsl = new Dsl(adapter);

  @Test
  public void featureInstancesAreReused() {
    assertSame(dsl.feature("search"), dsl.feature("search"));
    assertSame(dsl.feature("search"), dsl.get("search"));
  }

  @Test
  public void featureLookupDoesNotRegister() {
    dsl.feature("search");
    assertFalse(dsl.exist("search"));
    assertTrue(dsl.add("search"));
    assertTrue(dsl.exist("search"));
    assertFalse(dsl.add("search"));
  }

  @Test
  public void enableAndDisableByName() {
    Actor actor = Actor.of("User;1");
    dsl.enableActor("search", actor);
    assertTrue(dsl.isFeatureEnabled("search", actor));
    assertFalse(dsl.isFeatureEnabled("search"));
    dsl.disableActor("search", actor);
    assertFalse(dsl.isFeatureEnabled("search", actor));

    dsl.enable("search");
    assertTrue(dsl.isFeatureEnabled("search"));
    dsl.disable("search");
    assertFalse(dsl.isFeatureEnabled("search"));
  }

  @Test
  public void percentagesByName() {
    dsl.enablePercentageOfActors("search", 30);
    dsl.enablePercentageOfTime("search", 15);
    assertEquals(30, dsl.feature("search").percentageOfActorsValue(), 0);
    assertEquals(15, dsl.feature("search").percentageOfTimeValue(), 0);
    dsl.disablePercentageOfActors("search");
    dsl.disablePercentageOfTime("search");
    assertEquals(0, dsl.feature("search").percentageOfActorsValue(), 0);
    assertEquals(0, dsl.feature("search").percentageOfTimeValue(), 0);
  }

  @Test
  public void groupsByName() {
    GroupType admins = dsl.register("admins", actor -> actor.getFlipperId().equals("admin"));
    assertEquals(admins, dsl.group("admins"));
    assertNull(dsl.group("staff"));

    dsl.enableGroup("search", "admins");
    assertTrue(dsl.isFeatureEnabled("search", Actor.of("admin")));
    dsl.disableGroup("search", "admins");
    assertFalse(dsl.isFeatureEnabled("search", Actor.of("admin")));
  }

  @Test
  public void expressionsByName() {
    dsl.enableExpression("search", Expressions.bool(true));
    assertTrue(dsl.isFeatureEnabled("search", Actor.of("User;1")));
    dsl.disableExpression("search");
    assertFalse(dsl.isFeatureEnabled("search", Actor.of("User;1")));
  }

  @Test
  public void featuresListsAdapterKeys() {
    dsl.add("search");
    dsl.add("stats");
    Set<String> names = new HashSet<>();
    for (Feature feature: dsl.features()) {
      names.add(feature.getName());
    }
    assertEquals(ImmutableSet.of("search", "stats"), names);

    dsl.remove("stats");
    assertEquals(1, dsl.features().size());
  }

  @Test
  public void preloadUsesOneGetMulti() {
    dsl.add("search");
    dsl.add("stats");
    adapter.reset();

    List<Feature> features = dsl.preload(ImmutableList.of("search", "stats"));
    assertEquals(2, features.size());
    assertEquals(1, adapter.count("getMulti"));
    assertEquals(0, adapter.count("get"));
  }

  @Test
  public void preloadAllUsesGetAll() {
    dsl.add("search");
    dsl.add("stats");
    adapter.reset();

    assertEquals(2, dsl.preloadAll().size());
    assertEquals(1, adapter.count("getAll"));
  }

  @Test
  public void exportAndImport() {
    dsl.enable("search");
    dsl.enableActor("stats", Actor.of("User;1"));
    Export export = dsl.export();

    Dsl other = new Dsl(new MemoryAdapter());
    other.enable("stale");
    assertTrue(other.importFrom(export));

    assertTrue(other.isFeatureEnabled("search"));
    assertTrue(other.isFeatureEnabled("stats", Actor.of("User;1")));
    assertFalse(other.exist("stale"));
  }

  @Test
  public void importFromAnotherInstance() {
    dsl.enablePercentageOfActors("search", 5);
    Dsl other = new Dsl(new MemoryAdapter());
    other.importFrom(dsl);
    assertEquals(5, other.feature("search").percentageOfActorsValue(), 0);
    assertFalse(other.isReadOnly());
  }
}
