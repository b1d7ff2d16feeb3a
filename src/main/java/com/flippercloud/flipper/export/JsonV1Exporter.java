package com.flippercloud.flipper.export;

import com.flippercloud.flipper.GateKind;
import com.flippercloud.flipper.GateValues;
import com.flippercloud.flipper.subsystems.Adapter;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Writes version 1 of the JSON format. Every feature lists all six gate keys; unset gates are null,
 * sets are sorted arrays and features are sorted by key, so equal states produce identical contents.
 */
final class JsonV1Exporter implements Exporter {
  static final int VERSION = 1;

  @Override
  public Export call(Adapter adapter) {
    Map<String, Map<String, Object>> all = new TreeMap<>(adapter.getAll());
    JsonObject features = new JsonObject();
    for (Map.Entry<String, Map<String, Object>> e: all.entrySet()) {
      features.add(e.getKey(), featureJson(new GateValues(e.getValue())));
    }
    JsonObject root = new JsonObject();
    root.addProperty("version", VERSION);
    root.add("features", features);
    return new JsonExport(JsonHelpers.serialize(root), VERSION);
  }

  private static JsonObject featureJson(GateValues values) {
    JsonObject json = new JsonObject();
    json.add(GateKind.BOOLEAN.getKey(), values.getBoolean() ? new JsonPrimitive("true") : JsonNull.INSTANCE);
    json.add(GateKind.ACTOR.getKey(), sortedArray(values.getActors()));
    json.add(GateKind.GROUP.getKey(), sortedArray(values.getGroups()));
    json.add(GateKind.PERCENTAGE_OF_ACTORS.getKey(), percentage(values.getPercentageOfActors()));
    json.add(GateKind.PERCENTAGE_OF_TIME.getKey(), percentage(values.getPercentageOfTime()));
    json.add(GateKind.EXPRESSION.getKey(), values.getExpression() == null ? JsonNull.INSTANCE :
        JsonHelpers.parse(values.getExpression().toJsonString()));
    return json;
  }

  private static JsonArray sortedArray(Set<String> members) {
    JsonArray array = new JsonArray();
    for (String m: new TreeSet<>(members)) {
      array.add(m);
    }
    return array;
  }

  private static JsonElement percentage(double value) {
    if (value == 0) {
      return JsonNull.INSTANCE;
    }
    if (value == Math.rint(value)) {
      return new JsonPrimitive((long)value);
    }
    return new JsonPrimitive(value);
  }
}
