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

import com.google.devtools.cdbg.snapshotdbg.Snapshot.SourceLocation;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/** Utilities shared by the snapshot and logpoint commands. */
public final class BreakpointUtils {
  /** Breakpoint location entered by the user, in the format file:line. */
  private static final Pattern LOCATION_PATTERN = Pattern.compile("^[^:]+:[1-9][0-9]*$");

  /** Largest line number accepted in a location. */
  public static final long MAX_LINE_NUMBER = 2147483647L;

  /** Fields that hold a timestamp in Unix milliseconds, mapped from their RFC3339 counterpart. */
  private static final String[][] TIMESTAMP_CONVERSIONS =
      new String[][] {
        {"createTime", "createTimeUnixMsec"},
        {"finalTime", "finalTimeUnixMsec"}
      };

  private static final DateTimeFormatter RFC3339_FORMATTER =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'000Z'").withZone(ZoneOffset.UTC);

  private BreakpointUtils() {}

  /**
   * Parses a user supplied location.
   *
   * @param fileLine location in the format file:line
   * @return the parsed location, or null if the input is not a valid location
   */
  public static SourceLocation parseAndValidateLocation(String fileLine) {
    if (fileLine == null || !LOCATION_PATTERN.matcher(fileLine).matches()) {
      return null;
    }

    int separator = fileLine.indexOf(':');
    String digits = fileLine.substring(separator + 1);

    // Anything longer than 10 digits is over the limit, and would overflow parseLong eventually.
    if (digits.length() > 10 || Long.parseLong(digits) > MAX_LINE_NUMBER) {
      return null;
    }

    return new SourceLocation(fileLine.substring(0, separator), Integer.parseInt(digits));
  }

  /**
   * Formats a location as file:line.
   *
   * @return the formatted location, or null if the path or the line is missing
   */
  public static String transformLocationToFileLine(SourceLocation location) {
    if (location == null || location.path == null || location.line == null) {
      return null;
    }

    return location.path + ":" + location.line;
  }

  /**
   * Converts a Unix timestamp in milliseconds to its RFC3339 representation, for instance
   * "2022-04-14T18:50:15.852000Z".
   *
   * <p>A timestamp that can't be represented yields the beginning of the epoch, which is visually
   * recognizable as "time not known".
   */
  public static String convertUnixMsecToRfc3339(long unixMsec) {
    Instant instant = Instant.ofEpochMilli(unixMsec);

    // RFC3339 only covers four digit years.
    int year = instant.atOffset(ZoneOffset.UTC).getYear();
    if (year < 1 || year > 9999) {
      instant = Instant.EPOCH;
    }

    return RFC3339_FORMATTER.format(instant);
  }

  /**
   * Validates and normalizes a breakpoint read from the database.
   *
   * <p>On success the following fields are guaranteed to be populated: id, location (path and
   * line), action, isFinalState, createTime, createTimeUnixMsec, userEmail, and for final
   * breakpoints finalTime and finalTimeUnixMsec. Logpoints (action 'LOG') additionally get
   * logMessageFormatString, the user form of logMessageFormat, and logLevel.
   *
   * @param document breakpoint document, expected to be a JSON object
   * @param breakpointId ID to use if the document doesn't carry one, may be null
   * @return the normalized breakpoint, the same map instance that was passed in, or null if a
   *     required field is missing
   */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> normalizeBreakpoint(Object document, String breakpointId) {
    if (!(document instanceof Map)) {
      return null;
    }

    Map<String, Object> breakpoint = (Map<String, Object>) document;

    if (!breakpoint.containsKey("id") && breakpointId != null) {
      breakpoint.put("id", breakpointId);
    }

    if (!breakpoint.containsKey("id") || !(breakpoint.get("location") instanceof Map)) {
      return null;
    }

    Map<String, Object> location = (Map<String, Object>) breakpoint.get("location");
    if (!location.containsKey("path") || !location.containsKey("line")) {
      return null;
    }

    breakpoint.putIfAbsent("action", "CAPTURE");
    breakpoint.putIfAbsent("isFinalState", false);

    // Assuming everything is working correctly the createTimeUnixMsec value should be present, if
    // not it's set to 0 so it's clear the time was not actually known.
    breakpoint.putIfAbsent("createTimeUnixMsec", 0L);

    if (Boolean.TRUE.equals(breakpoint.get("isFinalState"))) {
      breakpoint.putIfAbsent("finalTimeUnixMsec", 0L);
    }

    breakpoint.putIfAbsent("userEmail", "unknown");
    setConvertedTimestamps(breakpoint);

    if ("LOG".equals(breakpoint.get("action"))) {
      Object format = breakpoint.get("logMessageFormat");
      breakpoint.put(
          "logMessageFormatString",
          LogMessageFormat.merge(
              (format instanceof String) ? (String) format : "",
              toStringList(breakpoint.get("expressions"))));
      breakpoint.putIfAbsent("logLevel", LogLevel.INFO.toString());
    }

    return breakpoint;
  }

  private static void setConvertedTimestamps(Map<String, Object> breakpoint) {
    for (String[] conversion : TIMESTAMP_CONVERSIONS) {
      if (breakpoint.containsKey(conversion[0]) || !breakpoint.containsKey(conversion[1])) {
        continue;
      }

      // A value that isn't a number converts to the epoch.
      Object unixMsec = breakpoint.get(conversion[1]);
      long value = (unixMsec instanceof Number) ? ((Number) unixMsec).longValue() : 0L;
      breakpoint.put(conversion[0], convertUnixMsecToRfc3339(value));
    }
  }

  private static List<String> toStringList(Object value) {
    List<String> strings = new ArrayList<>();
    if (value instanceof List) {
      for (Object element : (List<?>) value) {
        strings.add(String.valueOf(element));
      }
    }
    return strings;
  }
}
