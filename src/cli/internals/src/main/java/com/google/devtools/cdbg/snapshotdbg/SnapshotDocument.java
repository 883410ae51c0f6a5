/*
 * Copyright 2022 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.devtools.cdbg.snapshotdbg;

import static com.google.devtools.cdbg.snapshotdbg.CliLogger.warnfmt;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import java.lang.reflect.Type;
import java.util.Map;

/**
 * Reads breakpoint documents, as stored in the Firebase RTDB, and writes parsed snapshot data as
 * JSON.
 */
public final class SnapshotDocument {
  private static final Type BREAKPOINT_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

  // Untyped numbers (such as captured variable values) are read as Long when integral, Double
  // otherwise, rather than Gson's default of always using Double.
  private static final Gson GSON =
      new GsonBuilder()
          .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
          .serializeNulls()
          .create();

  private static final Gson PRETTY_GSON =
      new GsonBuilder()
          .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
          .serializeNulls()
          .disableHtmlEscaping()
          .setPrettyPrinting()
          .create();

  private SnapshotDocument() {}

  /**
   * Parses a snapshot.
   *
   * @param json breakpoint document of a snapshot
   * @throws SnapshotFormatException if the document is not a JSON object or its fields don't have
   *     the expected types
   */
  public static Snapshot parse(String json) throws SnapshotFormatException {
    JsonElement element = parseObject(json);
    try {
      return GSON.fromJson(element, Snapshot.class);
    } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
      warnfmt("Snapshot document has unexpected content: %s", e.getMessage());
      throw new SnapshotFormatException("Snapshot document has unexpected content", e);
    }
  }

  /**
   * Parses a breakpoint as a map of field names to their values, where each value is a POJO that
   * represents a JSON value.
   *
   * @param json breakpoint document
   * @throws SnapshotFormatException if the document is not a JSON object
   */
  public static Map<String, Object> parseBreakpoint(String json) throws SnapshotFormatException {
    return GSON.fromJson(parseObject(json), BREAKPOINT_TYPE);
  }

  /**
   * Serializes a POJO, such as the output of {@link VariableResolver}, as JSON.
   *
   * @param value the value to serialize
   * @param pretty whether to indent the output
   */
  public static String toJson(Object value, boolean pretty) {
    return pretty ? PRETTY_GSON.toJson(value) : GSON.toJson(value);
  }

  private static JsonElement parseObject(String json) throws SnapshotFormatException {
    JsonElement element;
    try {
      element = JsonParser.parseString(json);
    } catch (JsonParseException e) {
      warnfmt("Breakpoint document could not be parsed as JSON: %s", e.getMessage());
      throw new SnapshotFormatException("Breakpoint document is not valid JSON", e);
    }

    if (!element.isJsonObject()) {
      throw new SnapshotFormatException("Breakpoint document is not a JSON object");
    }

    return element;
  }
}
