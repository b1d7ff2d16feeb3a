package com.flippercloud.flipper.export;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

abstract class JsonHelpers {
  private JsonHelpers() {}

  // Exports spell out unset gates as null, so nulls must be written.
  private static final Gson gsonWithNullsAllowed = new GsonBuilder().serializeNulls().create();

  static Gson gsonInstance() {
    return gsonWithNullsAllowed;
  }

  static JsonElement parse(String json) throws InvalidJsonException {
    try {
      return JsonParser.parseString(json);
    } catch (JsonParseException e) {
      throw new InvalidJsonException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  static String serialize(JsonElement element) {
    return gsonInstance().toJson(element);
  }
}
