package com.flippercloud.flipper.export;

import com.flippercloud.flipper.Actor;
import com.flippercloud.flipper.BaseTest;
import com.flippercloud.flipper.Feature;
import com.flippercloud.flipper.adapters.MemoryAdapter;
import com.flippercloud.flipper.expressions.Expressions;
import com.google.common.collect.ImmutableSet;
import com.launchdarkly.sdk.LDValue;

import org.junit.Test;

import java.util.Map;

import static com.launchdarkly.testhelpers.JsonAssertions.assertJsonEquals;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

@SuppressWarnings("javadoc")
public class JsonExportTest extends BaseTest {
  private final MemoryAdapter adapter = new MemoryAdapter();

  @Test
  public void exportsEveryGateInV1Format() {
    Feature search = new Feature("search", adapter);
    search.enableActor(Actor.of("User;2"));
    search.enableActor(Actor.of("User;1"));
    search.enableGroup("admins");
    search.enablePercentageOfActors(25);
    search.enablePercentageOfTime(12.5);
    search.enableExpression(Expressions.equal(Expressions.property("plan"), "basic"));
    new Feature("stats", adapter).enable();
    new Feature("empty", adapter).add();

    Export export = adapter.export();
    assertEquals("json", export.getFormat());
    assertEquals(1, export.getVersion());
    assertJsonEquals("{\"version\":1,\"features\":{" +
        "\"empty\":{\"boolean\":null,\"actors\":[],\"groups\":[],\"percentageOfActors\":null," +
        "\"percentageOfTime\":null,\"expression\":null}," +
        "\"search\":{\"boolean\":null,\"actors\":[\"User;1\",\"User;2\"],\"groups\":[\"admins\"]," +
        "\"percentageOfActors\":25,\"percentageOfTime\":12.5," +
        "\"expression\":{\"Equal\":[{\"Property\":\"plan\"},\"basic\"]}}," +
        "\"stats\":{\"boolean\":\"true\",\"actors\":[],\"groups\":[],\"percentageOfActors\":null," +
        "\"percentageOfTime\":null,\"expression\":null}}}",
        export.getContents());
  }

  @Test
  public void featuresAreNormalized() {
    JsonExport export = new JsonExport("{\"version\":1,\"features\":{\"search\":{" +
        "\"boolean\":true,\"actors\":[\"User;1\"],\"groups\":[],\"percentageOfActors\":25," +
        "\"percentageOfTime\":null,\"expression\":{\"Boolean\":true}}}}");
    Map<String, Object> record = export.features().get("search");
    assertEquals("true", record.get("boolean"));
    assertEquals(ImmutableSet.of("User;1"), record.get("actors"));
    assertEquals(ImmutableSet.of(), record.get("groups"));
    assertEquals("25", record.get("percentageOfActors"));
    assertFalse(record.containsKey("percentageOfTime"));
    assertEquals(LDValue.parse("{\"Boolean\":true}"), record.get("expression"));
  }

  @Test
  public void parsedFeaturesCannotBeModified() {
    new Feature("search", adapter).enableActor(Actor.of("User;1"));
    Export export = adapter.export();
    Map<String, Map<String, Object>> features = export.features();
    try {
      features.clear();
      fail("expected exception");
    } catch (UnsupportedOperationException e) {
      // expected
    }
    try {
      features.get("search").remove("actors");
      fail("expected exception");
    } catch (UnsupportedOperationException e) {
      // expected
    }

    MemoryAdapter target = new MemoryAdapter();
    target.importFrom(export);
    assertEquals(ImmutableSet.of("User;1"), new Feature("search", target).actorsValue());
  }

  @Test
  public void importRoundTripsThroughAnotherAdapter() {
    Feature search = new Feature("search", adapter);
    search.enableActor(Actor.of("User;1"));
    search.enablePercentageOfTime(12.5);
    search.enableExpression(Expressions.bool(true));

    MemoryAdapter target = new MemoryAdapter();
    assertTrue(target.importFrom(adapter.export()));
    assertEquals(adapter.getAll(), target.getAll());
    assertEquals(adapter.export(), target.export());
  }

  @Test
  public void exportAdapterIsReadOnly() {
    new Feature("search", adapter).enable();
    Export export = adapter.export();
    assertTrue(export.adapter().isReadOnly());
    assertEquals("export", export.adapter().getName());
    assertEquals(ImmutableSet.of("search"), export.adapter().features());
    assertFalse(export.adapter().add(new Feature("other", export.adapter())));
  }

  @Test
  public void emptyExport() {
    assertTrue(JsonExport.empty().features().isEmpty());
    MemoryAdapter target = new MemoryAdapter();
    new Feature("stale", target).add();
    target.importFrom(JsonExport.empty());
    assertTrue(target.features().isEmpty());
  }

  @Test
  public void invalidJson() {
    try {
      new JsonExport("{not json").features();
      fail("expected exception");
    } catch (InvalidJsonException e) {
      assertThat(e.getMessage(), containsString("JSON"));
    }
  }

  @Test
  public void missingFeatures() {
    assertInvalid("{\"version\":1}", "missing \"features\"");
    assertInvalid("{\"version\":1,\"features\":[]}", "must be an object");
    assertInvalid("[]", "must be a JSON object");
    assertInvalid("{\"features\":{\"search\":true}}", "Feature \"search\" must be an object");
  }

  @Test
  public void importOfInvalidExportFailsWithoutWriting() {
    MemoryAdapter target = new MemoryAdapter();
    new Feature("search", target).enable();
    try {
      target.importFrom(new JsonExport("{\"version\":1}"));
      fail("expected exception");
    } catch (InvalidExportException e) {
      // expected
    }
    assertEquals(ImmutableSet.of("search"), target.features());
  }

  @Test
  public void equality() {
    assertEquals(new JsonExport("{}"), new JsonExport("{}", 1));
    assertNotEquals(new JsonExport("{}"), new JsonExport("{}", 2));
    assertNotEquals(new JsonExport("{}"), new JsonExport("{ }"));
  }

  private static void assertInvalid(String contents, String message) {
    try {
      new JsonExport(contents).features();
      fail("expected exception");
    } catch (InvalidExportException e) {
      assertThat(e.getMessage(), containsString(message));
    }
  }
}
