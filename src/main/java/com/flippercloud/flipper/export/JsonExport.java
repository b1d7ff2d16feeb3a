package com.flippercloud.flipper.export;

import com.flippercloud.flipper.Typecast;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.launchdarkly.sdk.LDValue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * An export in JSON: {@code {"version": 1, "features": {"<key>": {"<gate key>": <value>}}}}.
 * <p>
 * Arrays become sets of strings, objects (expressions) are kept as JSON values, other scalars become
 * strings, and nulls are dropped.
 */
public final class JsonExport extends Export {
  static final String FORMAT = "json";

  private static final String EMPTY_V1 = "{\"version\":1,\"features\":{}}";

  private volatile Map<String, Map<String, Object>> features;

  public JsonExport(String contents) {
    this(contents, 1);
  }

  public JsonExport(String contents, int version) {
    super(contents, FORMAT, version);
  }

  /**
   * Returns an export with no features.
   *
   * @return an empty version 1 export
   */
  public static JsonExport empty() {
    return new JsonExport(EMPTY_V1);
  }

  @Override
  public Map<String, Map<String, Object>> features() {
    Map<String, Map<String, Object>> result = features;
    if (result == null) {
      result = parse(getContents());
      features = result;
    }
    return result;
  }

  private static Map<String, Map<String, Object>> parse(String contents) {
    if (contents == null) {
      throw new InvalidExportException("Export has no contents");
    }
    JsonElement root = JsonHelpers.parse(contents);
    if (!root.isJsonObject()) {
      throw new InvalidExportException("Export must be a JSON object");
    }
    JsonElement featuresElement = root.getAsJsonObject().get("features");
    if (featuresElement == null) {
      throw new InvalidExportException("Export missing \"features\" property");
    }
    if (!featuresElement.isJsonObject()) {
      throw new InvalidExportException("Export \"features\" property must be an object");
    }
    Map<String, Map<String, Object>> raw = new HashMap<>();
    for (Map.Entry<String, JsonElement> feature: featuresElement.getAsJsonObject().entrySet()) {
      if (!feature.getValue().isJsonObject()) {
        throw new InvalidExportException("Feature \"" + feature.getKey() + "\" must be an object");
      }
      Map<String, Object> record = new HashMap<>();
      for (Map.Entry<String, JsonElement> gate: feature.getValue().getAsJsonObject().entrySet()) {
        Object value = toRawValue(gate.getValue());
        if (value != null) {
          record.put(gate.getKey(), value);
        }
      }
      raw.put(feature.getKey(), record);
    }
    ImmutableMap.Builder<String, Map<String, Object>> features = ImmutableMap.builder();
    for (Map.Entry<String, Map<String, Object>> e: Typecast.featuresHash(raw).entrySet()) {
      features.put(e.getKey(), ImmutableMap.copyOf(e.getValue()));
    }
    return features.build();
  }

  private static Object toRawValue(JsonElement element) {
    if (element == null || element.isJsonNull()) {
      return null;
    }
    if (element.isJsonArray()) {
      List<String> members = new ArrayList<>();
      for (JsonElement member: (JsonArray)element) {
        if (!member.isJsonNull()) {
          members.add(member.isJsonPrimitive() ? member.getAsString() : member.toString());
        }
      }
      return members;
    }
    if (element.isJsonObject()) {
      return LDValue.parse(JsonHelpers.serialize((JsonObject)element));
    }
    return element.getAsString();
  }
}
