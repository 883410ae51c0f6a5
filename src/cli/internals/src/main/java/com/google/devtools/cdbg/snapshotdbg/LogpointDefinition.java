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

import static com.google.devtools.cdbg.snapshotdbg.CliLogger.infofmt;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.devtools.cdbg.snapshotdbg.Snapshot.SourceLocation;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Builds the breakpoint data of a new logpoint, as it is written to the database. */
public final class LogpointDefinition {
  /**
   * Server value placeholder, the database replaces it with the time of the write in milliseconds
   * since the Unix epoch.
   */
  static final ImmutableMap<String, String> SERVER_TIMESTAMP = ImmutableMap.of(".sv", "timestamp");

  private LogpointDefinition() {}

  /**
   * Creates the logpoint data.
   *
   * <p>The result is a POJO that can be serialized as a JSON document. The 'id' field is not set,
   * it is allocated when the logpoint is written.
   *
   * @param location where to add the logpoint
   * @param userMessage log message with embedded {expression} substrings
   * @param logLevel level of the emitted log messages
   * @param condition condition restricting when the message is logged, null or empty for none
   * @param userEmail account of the user creating the logpoint
   * @return the logpoint data, keyed by breakpoint field name
   * @throws LogMessageFormatException if the braces in {@code userMessage} are unbalanced
   */
  public static Map<String, Object> create(
      SourceLocation location,
      String userMessage,
      LogLevel logLevel,
      String condition,
      String userEmail)
      throws LogMessageFormatException {
    Objects.requireNonNull(location);
    LogMessageFormat messageFormat = LogMessageFormat.split(userMessage);

    Map<String, Object> logpoint = new TreeMap<>();
    logpoint.put("action", "LOG");
    logpoint.put("logMessageFormat", messageFormat.getFormat());
    if (!messageFormat.getExpressions().isEmpty()) {
      logpoint.put("expressions", messageFormat.getExpressions());
    }

    Map<String, Object> locationData = new TreeMap<>();
    locationData.put("path", location.path);
    locationData.put("line", location.line);
    logpoint.put("location", locationData);

    logpoint.put("logLevel", logLevel.toString());
    logpoint.put("userEmail", userEmail);
    logpoint.put("createTimeUnixMsec", SERVER_TIMESTAMP);

    if (!Strings.isNullOrEmpty(condition)) {
      logpoint.put("condition", condition);
    }

    infofmt(
        "Logpoint at %s uses format '%s' with %d expressions",
        BreakpointUtils.transformLocationToFileLine(location),
        messageFormat.getFormat(),
        messageFormat.getExpressions().size());

    return logpoint;
  }
}
